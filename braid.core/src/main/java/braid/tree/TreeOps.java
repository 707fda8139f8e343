package braid.tree;

import java.util.List;

/**
 * Describes how a {@link SumTree} summarizes its items.
 * <p>
 * {@link #rf(Object, Object)} must be associative and {@link #emptyMetrics()} must be its identity,
 * otherwise summaries cached in inner nodes stop matching the summary of their items.
 *
 * @param <Metrics> summary type
 * @param <Data>    item type
 */
public interface TreeOps<Metrics, Data> {

  Metrics calculateMetrics(Data data);

  Metrics emptyMetrics();

  /*
   * maximum number of children in a node, nodes are split in halves above it
   * */
  int splitThreshold();

  Metrics rf(Metrics m1, Metrics m2);

  default Metrics rf(List<Metrics> metrics) {
    Metrics r = emptyMetrics();
    for (Metrics m : metrics) {
      r = rf(r, m);
    }
    return r;
  }
}
