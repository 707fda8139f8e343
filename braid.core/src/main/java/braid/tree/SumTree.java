package braid.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Persistent B-tree of items augmented with an associative summary.
 * <p>
 * Nodes are never modified after construction. Every operation returning a {@code SumTree} builds new nodes
 * only along the paths it touches and shares the rest with the receiver, so keeping an old tree around
 * costs nothing and copying a tree is a reference copy.
 * <p>
 * Items live in the children of height-0 nodes. Every inner node caches the summaries of its children,
 * which lets a {@link TreeCursor} skip whole subtrees while seeking.
 *
 * @param <Metrics> summary of a run of items, combined with {@link TreeOps#rf(Object, Object)}
 * @param <Data>    item type
 */
public final class SumTree<Metrics, Data> {

  public static final class Node<Metrics> {
    final int height;
    final ArrayList<Object> children;
    final ArrayList<Metrics> metrics;
    final Metrics summary;

    Node(int height, ArrayList<Object> children, ArrayList<Metrics> childrenMetrics, Metrics summary) {
      this.height = height;
      this.children = children;
      this.metrics = childrenMetrics;
      this.summary = summary;
    }

    public int height() {
      return height;
    }

    public int size() {
      return children.size();
    }
  }

  public final Node<Metrics> root;
  public final Metrics metrics;
  public final TreeOps<Metrics, Data> ops;

  SumTree(Node<Metrics> root, TreeOps<Metrics, Data> ops) {
    this.root = root;
    this.metrics = root.summary;
    this.ops = ops;
  }

  public static <Metrics, Data> SumTree<Metrics, Data> empty(TreeOps<Metrics, Data> ops) {
    return new SumTree<>(new Node<>(0, new ArrayList<>(0), new ArrayList<>(0), ops.emptyMetrics()), ops);
  }

  public static <Metrics, Data> SumTree<Metrics, Data> fromItem(Data item, TreeOps<Metrics, Data> ops) {
    Metrics m = ops.calculateMetrics(item);
    return new SumTree<>(new Node<>(0, singletonList(item), singletonList(m), m), ops);
  }

  /*
   * builds the tree bottom up, every level is partitioned into nodes of [splitThreshold / 2, splitThreshold] children
   * */
  public static <Metrics, Data> SumTree<Metrics, Data> fromItems(List<Data> items, TreeOps<Metrics, Data> ops) {
    if (items.isEmpty()) {
      return empty(ops);
    }
    ArrayList<Object> level = new ArrayList<>(items);
    ArrayList<Metrics> levelMetrics = new ArrayList<>(items.size());
    for (Data item : items) {
      levelMetrics.add(ops.calculateMetrics(item));
    }
    int height = 0;
    while (true) {
      ArrayList<Node<Metrics>> nodes = new ArrayList<>();
      splitNode(nodes, height, level, levelMetrics, 0, level.size(), ops);
      if (nodes.size() == 1) {
        return new SumTree<>(nodes.get(0), ops);
      }
      level = new ArrayList<>(nodes);
      levelMetrics = new ArrayList<>(nodes.size());
      for (Node<Metrics> node : nodes) {
        levelMetrics.add(node.summary);
      }
      height++;
    }
  }

  public boolean isEmpty() {
    return root.children.isEmpty();
  }

  public int height() {
    return root.height;
  }

  public TreeCursor<Metrics, Data> cursor() {
    return new TreeCursor<>(this);
  }

  public Data first() {
    if (isEmpty()) {
      return null;
    }
    Node<Metrics> node = root;
    while (node.height > 0) {
      node = childNode(node, 0);
    }
    //noinspection unchecked
    return (Data)node.children.get(0);
  }

  public Data last() {
    if (isEmpty()) {
      return null;
    }
    Node<Metrics> node = root;
    while (node.height > 0) {
      node = childNode(node, node.children.size() - 1);
    }
    //noinspection unchecked
    return (Data)node.children.get(node.children.size() - 1);
  }

  public List<Data> items() {
    ArrayList<Data> result = new ArrayList<>();
    collectItems(root, result);
    return Collections.unmodifiableList(result);
  }

  public SumTree<Metrics, Data> push(Data item) {
    return append(fromItem(item, ops));
  }

  public SumTree<Metrics, Data> extend(List<Data> items) {
    return append(fromItems(items, ops));
  }

  /*
   * replaces the last item with f(last), copying only the right spine
   * does nothing on an empty tree
   * */
  public SumTree<Metrics, Data> updateLast(UnaryOperator<Data> f) {
    if (isEmpty()) {
      return this;
    }
    return new SumTree<>(updateLast(root, f), ops);
  }

  /*
   * concatenates two trees along the right spine of the taller one (left spine if `other` is taller)
   * only the nodes on that spine are copied, every other subtree of both trees is reused as is
   * */
  public SumTree<Metrics, Data> append(SumTree<Metrics, Data> other) {
    if (other.isEmpty()) {
      return this;
    }
    if (this.isEmpty()) {
      return other.ops == ops ? other : new SumTree<>(other.root, ops);
    }
    List<Node<Metrics>> parts = root.height >= other.root.height
                                ? appendRight(root, other.root)
                                : prependLeft(root, other.root);
    if (parts.size() == 1) {
      return new SumTree<>(parts.get(0), ops);
    }
    return new SumTree<>(branch(parts.get(0).height + 1, parts), ops);
  }

  private List<Node<Metrics>> appendRight(Node<Metrics> left, Node<Metrics> right) {
    if (left.height == right.height) {
      return concat(left, right);
    }
    int last = left.children.size() - 1;
    List<Node<Metrics>> parts = appendRight(childNode(left, last), right);
    ArrayList<Object> children = new ArrayList<>(left.children.size() + 1);
    ArrayList<Metrics> metrics = new ArrayList<>(left.children.size() + 1);
    children.addAll(left.children.subList(0, last));
    metrics.addAll(left.metrics.subList(0, last));
    for (Node<Metrics> part : parts) {
      children.add(part);
      metrics.add(part.summary);
    }
    return split(left.height, children, metrics);
  }

  private List<Node<Metrics>> prependLeft(Node<Metrics> left, Node<Metrics> right) {
    if (left.height == right.height) {
      return concat(left, right);
    }
    List<Node<Metrics>> parts = prependLeft(left, childNode(right, 0));
    ArrayList<Object> children = new ArrayList<>(right.children.size() + 1);
    ArrayList<Metrics> metrics = new ArrayList<>(right.children.size() + 1);
    for (Node<Metrics> part : parts) {
      children.add(part);
      metrics.add(part.summary);
    }
    children.addAll(right.children.subList(1, right.children.size()));
    metrics.addAll(right.metrics.subList(1, right.metrics.size()));
    return split(right.height, children, metrics);
  }

  private List<Node<Metrics>> concat(Node<Metrics> left, Node<Metrics> right) {
    int mergeThreshold = ops.splitThreshold() / 2;
    if (left.children.size() >= mergeThreshold && right.children.size() >= mergeThreshold) {
      ArrayList<Node<Metrics>> result = new ArrayList<>(2);
      result.add(left);
      result.add(right);
      return result;
    }
    return split(left.height, join(left.children, right.children), join(left.metrics, right.metrics));
  }

  private List<Node<Metrics>> split(int height, ArrayList<Object> children, ArrayList<Metrics> metrics) {
    ArrayList<Node<Metrics>> result = new ArrayList<>(2);
    splitNode(result, height, children, metrics, 0, children.size(), ops);
    return result;
  }

  private static <Metrics> void splitNode(ArrayList<Node<Metrics>> result,
                                          int height,
                                          ArrayList<Object> children,
                                          ArrayList<Metrics> metrics,
                                          int from,
                                          int to,
                                          TreeOps<Metrics, ?> ops) {
    int length = to - from;
    if (length <= ops.splitThreshold()) {
      ArrayList<Metrics> partMetrics = new ArrayList<>(metrics.subList(from, to));
      result.add(new Node<>(height, new ArrayList<>(children.subList(from, to)), partMetrics, ops.rf(partMetrics)));
    }
    else {
      int half = length / 2;
      splitNode(result, height, children, metrics, from, from + half, ops);
      splitNode(result, height, children, metrics, from + half, to, ops);
    }
  }

  private Node<Metrics> branch(int height, List<Node<Metrics>> nodes) {
    ArrayList<Object> children = new ArrayList<>(nodes.size());
    ArrayList<Metrics> metrics = new ArrayList<>(nodes.size());
    for (Node<Metrics> node : nodes) {
      children.add(node);
      metrics.add(node.summary);
    }
    return new Node<>(height, children, metrics, ops.rf(metrics));
  }

  private Node<Metrics> updateLast(Node<Metrics> node, UnaryOperator<Data> f) {
    int last = node.children.size() - 1;
    ArrayList<Object> children = new ArrayList<>(node.children);
    ArrayList<Metrics> metrics = new ArrayList<>(node.metrics);
    if (node.height == 0) {
      //noinspection unchecked
      Data updated = f.apply((Data)children.get(last));
      children.set(last, updated);
      metrics.set(last, ops.calculateMetrics(updated));
    }
    else {
      Node<Metrics> updated = updateLast(childNode(node, last), f);
      children.set(last, updated);
      metrics.set(last, updated.summary);
    }
    return new Node<>(node.height, children, metrics, ops.rf(metrics));
  }

  private void collectItems(Node<Metrics> node, ArrayList<Data> result) {
    if (node.height == 0) {
      for (Object child : node.children) {
        //noinspection unchecked
        result.add((Data)child);
      }
    }
    else {
      for (int i = 0; i < node.children.size(); i++) {
        collectItems(childNode(node, i), result);
      }
    }
  }

  static <Metrics> Node<Metrics> childNode(Node<Metrics> node, int idx) {
    //noinspection unchecked
    return (Node<Metrics>)node.children.get(idx);
  }

  static <T> ArrayList<T> singletonList(T object) {
    ArrayList<T> l = new ArrayList<>(1);
    l.add(object);
    return l;
  }

  static <T> ArrayList<T> join(List<T> left, List<T> right) {
    ArrayList<T> tmp = new ArrayList<>(left.size() + right.size());
    tmp.addAll(left);
    tmp.addAll(right);
    return tmp;
  }
}
