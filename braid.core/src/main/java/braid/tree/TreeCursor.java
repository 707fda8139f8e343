package braid.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Positioned view over a {@link SumTree}.
 * <p>
 * The cursor is always in one of three states: on an item, past the last item, or before the first item
 * (only reachable with {@link #prev()}). {@link #start()} is the summary of every item before the current one.
 * <p>
 * Seeking is driven by predicates {@code (acc, next) -> boolean}:
 * {@code acc} is the summary of everything before the candidate and {@code next} is the candidate's summary.
 * The cursor stops at the first item for which the predicate holds, skipping whole subtrees for which it does not,
 * so predicates must be monotone: once true for a prefix, true for every longer prefix.
 */
public final class TreeCursor<Metrics, Data> {

  private static final class Frame<Metrics> {
    final SumTree.Node<Metrics> node;
    final Metrics nodeStart;
    int index;
    // summary of everything before children[index]
    Metrics start;

    Frame(SumTree.Node<Metrics> node, int index, Metrics start, Metrics nodeStart) {
      this.node = node;
      this.index = index;
      this.start = start;
      this.nodeStart = nodeStart;
    }
  }

  private interface Sink<Metrics> {
    void accept(Object child, Metrics metrics);
  }

  private final SumTree<Metrics, Data> tree;
  private final TreeOps<Metrics, Data> ops;
  private final ArrayList<Frame<Metrics>> stack = new ArrayList<>();
  private boolean atEnd;
  private boolean beforeStart;

  TreeCursor(SumTree<Metrics, Data> tree) {
    this.tree = tree;
    this.ops = tree.ops;
    reset();
  }

  /*
   * moves to the first item
   * */
  public void reset() {
    stack.clear();
    beforeStart = false;
    atEnd = tree.isEmpty();
    if (!atEnd) {
      stack.add(new Frame<>(tree.root, 0, ops.emptyMetrics(), ops.emptyMetrics()));
      descendLeft();
    }
  }

  public boolean isAtEnd() {
    return atEnd;
  }

  public boolean isBeforeStart() {
    return beforeStart;
  }

  public Data item() {
    if (atEnd || beforeStart) {
      return null;
    }
    Frame<Metrics> leaf = top();
    //noinspection unchecked
    return (Data)leaf.node.children.get(leaf.index);
  }

  public Metrics itemMetrics() {
    if (atEnd || beforeStart) {
      return null;
    }
    Frame<Metrics> leaf = top();
    return leaf.node.metrics.get(leaf.index);
  }

  public Metrics start() {
    if (atEnd) {
      return tree.metrics;
    }
    if (beforeStart) {
      return ops.emptyMetrics();
    }
    return top().start;
  }

  public Metrics end() {
    Metrics itemMetrics = itemMetrics();
    return itemMetrics == null ? start() : ops.rf(start(), itemMetrics);
  }

  public void next() {
    if (atEnd) {
      return;
    }
    if (beforeStart) {
      reset();
      return;
    }
    while (!stack.isEmpty()) {
      Frame<Metrics> f = top();
      f.start = ops.rf(f.start, f.node.metrics.get(f.index));
      f.index++;
      if (f.index < f.node.children.size()) {
        descendLeft();
        return;
      }
      stack.remove(stack.size() - 1);
    }
    atEnd = true;
  }

  public void prev() {
    if (beforeStart) {
      return;
    }
    if (atEnd) {
      atEnd = false;
      if (tree.isEmpty()) {
        beforeStart = true;
        return;
      }
      int last = tree.root.children.size() - 1;
      Metrics empty = ops.emptyMetrics();
      stack.add(new Frame<>(tree.root, last, accumulate(empty, tree.root.metrics, last), empty));
      descendRight();
      return;
    }
    while (!stack.isEmpty()) {
      Frame<Metrics> f = top();
      if (f.index > 0) {
        f.index--;
        f.start = accumulate(f.nodeStart, f.node.metrics, f.index);
        descendRight();
        return;
      }
      stack.remove(stack.size() - 1);
    }
    beforeStart = true;
  }

  /*
   * restarts from the root and stops at the first item satisfying the predicate
   * returns false and moves past the end when there is no such item
   * */
  public boolean seek(BiFunction<Metrics, Metrics, Boolean> pred) {
    stack.clear();
    beforeStart = false;
    atEnd = tree.isEmpty();
    if (atEnd) {
      return false;
    }
    stack.add(new Frame<>(tree.root, 0, ops.emptyMetrics(), ops.emptyMetrics()));
    return scan(pred, null);
  }

  /*
   * same as seek, but never moves backwards: the current item is the first candidate
   * */
  public boolean seekForward(BiFunction<Metrics, Metrics, Boolean> pred) {
    return scan(pred, null);
  }

  /*
   * seeks forward and returns every item skipped on the way, the current one included
   * subtrees skipped as a whole are reused in the result without copying
   * */
  public SumTree<Metrics, Data> slice(BiFunction<Metrics, Metrics, Boolean> pred) {
    SliceBuilder builder = new SliceBuilder();
    scan(pred, builder::add);
    return builder.build();
  }

  /*
   * seeks forward and returns the summary of every item skipped on the way, the current one included
   * */
  public Metrics summary(BiFunction<Metrics, Metrics, Boolean> pred) {
    ArrayList<Metrics> acc = new ArrayList<>(1);
    acc.add(ops.emptyMetrics());
    scan(pred, (child, metrics) -> acc.set(0, ops.rf(acc.get(0), metrics)));
    return acc.get(0);
  }

  /*
   * everything from the current item to the end
   * */
  public SumTree<Metrics, Data> suffix() {
    return slice((acc, next) -> false);
  }

  private boolean scan(BiFunction<Metrics, Metrics, Boolean> pred, Sink<Metrics> sink) {
    if (atEnd) {
      return false;
    }
    if (beforeStart) {
      reset();
      if (atEnd) {
        return false;
      }
    }
    while (true) {
      Frame<Metrics> f = top();
      boolean found = false;
      int size = f.node.children.size();
      while (f.index < size) {
        Metrics m = f.node.metrics.get(f.index);
        if (pred.apply(f.start, m)) {
          found = true;
          break;
        }
        if (sink != null) {
          sink.accept(f.node.children.get(f.index), m);
        }
        f.start = ops.rf(f.start, m);
        f.index++;
      }

      if (found) {
        if (f.node.height == 0) {
          return true;
        }
        stack.add(new Frame<>(SumTree.childNode(f.node, f.index), 0, f.start, f.start));
      }
      else {
        stack.remove(stack.size() - 1);
        if (stack.isEmpty()) {
          atEnd = true;
          return false;
        }
        // the child we leave was consumed item by item, step over it without reporting it again
        Frame<Metrics> parent = top();
        parent.start = ops.rf(parent.start, parent.node.metrics.get(parent.index));
        parent.index++;
      }
    }
  }

  private void descendLeft() {
    Frame<Metrics> f = top();
    while (f.node.height > 0) {
      SumTree.Node<Metrics> child = SumTree.childNode(f.node, f.index);
      f = new Frame<>(child, 0, f.start, f.start);
      stack.add(f);
    }
  }

  private void descendRight() {
    Frame<Metrics> f = top();
    while (f.node.height > 0) {
      SumTree.Node<Metrics> child = SumTree.childNode(f.node, f.index);
      int last = child.children.size() - 1;
      f = new Frame<>(child, last, accumulate(f.start, child.metrics, last), f.start);
      stack.add(f);
    }
  }

  private Metrics accumulate(Metrics from, List<Metrics> metrics, int count) {
    Metrics acc = from;
    for (int i = 0; i < count; i++) {
      acc = ops.rf(acc, metrics.get(i));
    }
    return acc;
  }

  private Frame<Metrics> top() {
    return stack.get(stack.size() - 1);
  }

  private final class SliceBuilder {
    private SumTree<Metrics, Data> result = SumTree.empty(ops);
    private ArrayList<Data> pending = new ArrayList<>();

    void add(Object child, Metrics metrics) {
      if (child instanceof SumTree.Node) {
        flush();
        //noinspection unchecked
        result = result.append(new SumTree<>((SumTree.Node<Metrics>)child, ops));
      }
      else {
        //noinspection unchecked
        pending.add((Data)child);
      }
    }

    SumTree<Metrics, Data> build() {
      flush();
      return result;
    }

    private void flush() {
      if (!pending.isEmpty()) {
        result = result.append(SumTree.fromItems(pending, ops));
        pending = new ArrayList<>();
      }
    }
  }
}
