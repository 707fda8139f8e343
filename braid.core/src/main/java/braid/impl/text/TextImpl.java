package braid.impl.text;

import braid.impl.util.BraidProperties;
import braid.text.Point;
import braid.text.PointUtf16;
import braid.text.TextSummary;
import braid.tree.Bias;
import braid.tree.TreeOps;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

@SuppressWarnings("WeakerAccess")
public class TextImpl {
  private TextImpl() {}

  public static final TextOps DEFAULT_OPS = new TextOps(BraidProperties.treeBranching(), BraidProperties.chunkBase());

  /**
   * Shape of a rope's tree: node fan-out and leaf size.
   * Small values are only useful to exercise multi-chunk and multi-level paths in tests.
   */
  public static class TextOps implements TreeOps<TextSummary, Chunk> {

    public final int splitThresh;
    public final int chunkBase;

    public TextOps(int branching, int chunkBase) {
      if (branching < BraidProperties.MIN_TREE_BRANCHING) {
        throw new IllegalArgumentException("branching " + branching + " < " + BraidProperties.MIN_TREE_BRANCHING);
      }
      if (chunkBase < BraidProperties.MIN_ROPE_CHUNK_BASE) {
        throw new IllegalArgumentException("chunk base " + chunkBase + " < " + BraidProperties.MIN_ROPE_CHUNK_BASE);
      }
      this.splitThresh = branching;
      this.chunkBase = chunkBase;
    }

    public int maxChunkLength() {
      return 2 * chunkBase;
    }

    @Override
    public TextSummary calculateMetrics(Chunk data) {
      return data.summary();
    }

    @Override
    public TextSummary emptyMetrics() {
      return TextSummary.EMPTY;
    }

    @Override
    public TextSummary rf(TextSummary o1, TextSummary o2) {
      return o1.add(o2);
    }

    @Override
    public int splitThreshold() {
      return splitThresh;
    }

    @Override
    public String toString() {
      return "TextOps{branching=" + splitThresh + ", chunkBase=" + chunkBase + '}';
    }
  }

  /*
   * cuts bytes[from, to) into chunks of at most maxChunkLength bytes, never inside a character
   * every chunk but the last one is filled to within 3 bytes of the limit
   * */
  public static List<Chunk> splitIntoChunks(byte[] bytes, int from, int to, TextOps ops) {
    int max = ops.maxChunkLength();
    ArrayList<Chunk> chunks = new ArrayList<>((to - from) / Math.max(1, max - 3) + 1);
    int start = from;
    while (start < to) {
      int end = Math.min(start + max, to);
      while (end < to && Utf8.isContinuation(bytes[end])) {
        end--;
      }
      chunks.add(Chunk.of(bytes, start, end));
      start = end;
    }
    return chunks;
  }

  public static List<Chunk> splitIntoChunks(Chunk chunk, TextOps ops) {
    return splitIntoChunks(chunk.bytes, 0, chunk.bytes.length, ops);
  }

  /*
   * split point for `text` (at most 4 * chunkBase bytes) leaving both halves within maxChunkLength,
   * nearest to the middle
   * */
  public static int findSplitIx(byte[] text, int length, TextOps ops) {
    int max = ops.maxChunkLength();
    int lo = Math.max(0, length - max);
    int hi = Math.min(length, max);
    int mid = length / 2;
    for (int delta = 0; mid - delta >= lo || mid + delta <= hi; delta++) {
      int right = mid + delta;
      if (right <= hi && right >= lo && Utf8.isCharBoundary(text, length, right)) {
        return right;
      }
      int left = mid - delta;
      if (left >= lo && left <= hi && Utf8.isCharBoundary(text, length, left)) {
        return left;
      }
    }
    throw new IllegalStateException("no char boundary in [" + lo + ", " + hi + "] of " + length + " bytes");
  }

  /*
   * redistributes two adjacent chunks whose total exceeds maxChunkLength into two chunks of about equal size
   * the seam between `left` and `right` is always a candidate, so a split point exists
   * */
  public static Chunk[] rebalance(Chunk left, Chunk right, TextOps ops) {
    Chunk joined = left.concat(right);
    int splitIx = findSplitIx(joined.bytes, joined.bytes.length, ops);
    return new Chunk[]{joined.slice(0, splitIx), joined.slice(splitIx, joined.bytes.length)};
  }

  /*
   * predicates to seek a tree cursor by one of the summary dimensions
   *
   * RIGHT stops at the chunk that starts at the target when the target is on a chunk boundary,
   * LEFT stops at the chunk that ends there
   *
   * <|> (a, b) (c, d) -> offsetPredicate(2, RIGHT) -> (a, b) <|>(c, d)
   * <|> (a, b) (c, d) -> offsetPredicate(2, LEFT)  -> <|>(a, b) (c, d)
   * */
  public static BiFunction<TextSummary, TextSummary, Boolean> offsetPredicate(long offset, Bias bias) {
    return bias == Bias.LEFT
           ? (acc, next) -> offset <= acc.bytes + next.bytes
           : (acc, next) -> offset < acc.bytes + next.bytes;
  }

  public static BiFunction<TextSummary, TextSummary, Boolean> offsetUtf16Predicate(long offset, Bias bias) {
    return bias == Bias.LEFT
           ? (acc, next) -> offset <= acc.lenUtf16 + next.lenUtf16
           : (acc, next) -> offset < acc.lenUtf16 + next.lenUtf16;
  }

  public static BiFunction<TextSummary, TextSummary, Boolean> pointPredicate(Point point, Bias bias) {
    return (acc, next) -> {
      int c = compare(point.row, point.column, acc.lines.row, acc.lines.column, next.lines.row, next.lines.column);
      return bias == Bias.LEFT ? c <= 0 : c < 0;
    };
  }

  public static BiFunction<TextSummary, TextSummary, Boolean> pointUtf16Predicate(PointUtf16 point, Bias bias) {
    return (acc, next) -> {
      int c = compare(point.row, point.column,
                      acc.linesUtf16.row, acc.linesUtf16.column,
                      next.linesUtf16.row, next.linesUtf16.column);
      return bias == Bias.LEFT ? c <= 0 : c < 0;
    };
  }

  /*
   * compares (row, column) with the end of a run summarized as `acc` followed by `next`, without allocating the sum
   * */
  private static int compare(int row, int column, int accRow, int accColumn, int nextRow, int nextColumn) {
    int endRow = accRow + nextRow;
    int endColumn = nextRow == 0 ? accColumn + nextColumn : nextColumn;
    int r = Integer.compare(row, endRow);
    return r != 0 ? r : Integer.compare(column, endColumn);
  }
}
