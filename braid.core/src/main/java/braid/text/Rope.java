package braid.text;

import braid.impl.text.Chunk;
import braid.impl.text.TextImpl;
import braid.impl.text.TextImpl.TextOps;
import braid.tree.Bias;
import braid.tree.SumTree;
import braid.tree.TreeCursor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PrimitiveIterator;

/**
 * Mutable text backed by a persistent tree of UTF-8 chunks.
 * <p>
 * Offsets are UTF-8 byte offsets. Besides them the rope is addressable by {@link Point} (row and byte column)
 * and {@link PointUtf16} (row and UTF-16 column), and it keeps a {@link TextSummary} of the whole text up to date
 * after every edit.
 * <p>
 * A rope exclusively owns a reference to an immutable tree. Edits build a new tree out of slices of the old one
 * plus freshly cut chunks, so an edit costs time proportional to the inserted text and the logarithm of the
 * document size, and {@link #copy()} is O(1): copies share all nodes and never observe each other's edits.
 * <p>
 * Preconditions are the caller's responsibility. Conversions throw {@link IllegalArgumentException} for
 * coordinates that fall inside a character or past the end of a line; coordinates coming from outside must go
 * through {@link #clipOffset}, {@link #clipPoint} or {@link #clipPointUtf16} first. Ranges outside the rope throw
 * {@link IndexOutOfBoundsException}.
 * <p>
 * Not thread safe. Views ({@link Cursor}, {@link Chunks}, {@link Bytes}, ...) read the tree the rope had when they
 * were created.
 */
public final class Rope {
  private static final Logger log = LoggerFactory.getLogger(Rope.class);

  SumTree<TextSummary, Chunk> chunks;
  final TextOps ops;

  public Rope() {
    this(TextImpl.DEFAULT_OPS);
  }

  public Rope(TextOps ops) {
    this(SumTree.empty(ops), ops);
  }

  Rope(SumTree<TextSummary, Chunk> chunks, TextOps ops) {
    this.chunks = chunks;
    this.ops = ops;
  }

  public static Rope from(String text) {
    return from(text, TextImpl.DEFAULT_OPS);
  }

  public static Rope from(String text, TextOps ops) {
    Rope rope = new Rope(ops);
    rope.push(text);
    return rope;
  }

  public static Rope from(Iterable<String> texts) {
    Rope rope = new Rope();
    for (String text : texts) {
      rope.push(text);
    }
    return rope;
  }

  public TextOps ops() {
    return ops;
  }

  public Rope copy() {
    return new Rope(chunks, ops);
  }

  public void push(String text) {
    if (text.isEmpty()) {
      return;
    }
    byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
    List<Chunk> newChunks = TextImpl.splitIntoChunks(utf8, 0, utf8.length, ops);
    if (log.isTraceEnabled() && newChunks.size() > 1) {
      log.trace("pushing {} bytes as {} chunks", utf8.length, newChunks.size());
    }
    pushChunks(newChunks);
  }

  void pushChunk(Chunk chunk) {
    if (!chunk.isEmpty()) {
      pushChunks(Collections.singletonList(chunk));
    }
  }

  /*
   * the first new chunk is merged into the last one when both fit in a single chunk,
   * otherwise the two are rebalanced around their middle so neither stays undersized
   * */
  private void pushChunks(List<Chunk> newChunks) {
    Chunk last = chunks.last();
    if (last != null) {
      Chunk first = newChunks.get(0);
      if (last.length() + first.length() <= ops.maxChunkLength()) {
        chunks = chunks.updateLast(c -> c.concat(first));
        newChunks = newChunks.subList(1, newChunks.size());
      }
      else {
        Chunk[] halves = TextImpl.rebalance(last, first, ops);
        if (log.isTraceEnabled()) {
          log.trace("rebalanced {} + {} bytes into {} + {}",
                    last.length(), first.length(), halves[0].length(), halves[1].length());
        }
        chunks = chunks.updateLast(c -> halves[0]);
        ArrayList<Chunk> rest = new ArrayList<>(newChunks);
        rest.set(0, halves[1]);
        newChunks = rest;
      }
    }
    if (!newChunks.isEmpty()) {
      chunks = chunks.extend(newChunks);
    }
    assert checkInvariants();
  }

  /*
   * O(log n) when both ropes share their chunk size: only the two chunks meeting at the seam may be rewritten,
   * every other subtree of `other` is reused
   * */
  public void append(Rope other) {
    if (other.chunks.isEmpty()) {
      return;
    }
    if (other.ops.chunkBase != ops.chunkBase) {
      for (Chunk chunk : other.chunks.items()) {
        pushChunks(TextImpl.splitIntoChunks(chunk, ops));
      }
      return;
    }
    TreeCursor<TextSummary, Chunk> cursor = other.chunks.cursor();
    Chunk first = cursor.item();
    Chunk last = chunks.last();
    if ((last != null && last.length() < ops.chunkBase) || first.length() < ops.chunkBase) {
      pushChunk(first);
      cursor.next();
    }
    chunks = chunks.append(cursor.suffix());
    assert checkInvariants();
  }

  public void pushFront(String text) {
    Rope front = Rope.from(text, ops);
    front.append(this);
    this.chunks = front.chunks;
  }

  /*
   * replaces bytes [start, end) with `text`
   * */
  public void replace(long start, long end, String text) {
    checkRange(start, end);
    Rope result = new Rope(ops);
    Cursor cursor = cursor(0);
    result.append(cursor.slice(start));
    cursor.seekForward(end);
    result.push(text);
    result.append(cursor.suffix());
    this.chunks = result.chunks;
  }

  public Rope slice(long start, long end) {
    checkRange(start, end);
    Cursor cursor = cursor(0);
    cursor.seekForward(start);
    return cursor.slice(end);
  }

  public Rope sliceRows(int startRow, int endRow) {
    long start = pointToOffset(new Point(startRow, 0));
    long end = pointToOffset(new Point(endRow, 0));
    return slice(start, end);
  }

  public TextSummary summary() {
    return chunks.metrics;
  }

  public long len() {
    return chunks.metrics.bytes;
  }

  public boolean isEmpty() {
    return len() == 0;
  }

  public Point maxPoint() {
    return chunks.metrics.lines;
  }

  public PointUtf16 maxPointUtf16() {
    return chunks.metrics.linesUtf16;
  }

  /*
   * byte length of `row` excluding its newline, rows past the end report the last row
   * */
  public int lineLen(int row) {
    return clipPoint(new Point(row, Integer.MAX_VALUE), Bias.LEFT).column;
  }

  public Cursor cursor(long offset) {
    if (offset < 0 || offset > len()) {
      throw new IndexOutOfBoundsException("offset " + offset + " is out of rope of length " + len());
    }
    return new Cursor(this, offset);
  }

  public Chunks chunks() {
    return chunksInRange(0, len());
  }

  public Chunks chunksInRange(long start, long end) {
    checkRange(start, end);
    return new Chunks(chunks, start, end, false);
  }

  public Chunks reversedChunksInRange(long start, long end) {
    checkRange(start, end);
    return new Chunks(chunks, start, end, true);
  }

  public Bytes bytesInRange(long start, long end) {
    checkRange(start, end);
    return new Bytes(chunks, start, end, false);
  }

  public Bytes reversedBytesInRange(long start, long end) {
    checkRange(start, end);
    return new Bytes(chunks, start, end, true);
  }

  public PrimitiveIterator.OfInt codePoints() {
    return codePointsAt(0);
  }

  public PrimitiveIterator.OfInt codePointsAt(long start) {
    return new CodePoints(chunksInRange(start, len()), false);
  }

  public PrimitiveIterator.OfInt reversedCodePointsAt(long start) {
    return new CodePoints(reversedChunksInRange(0, start), true);
  }

  public Lines lines() {
    return chunks().lines();
  }

  public boolean isCharBoundary(long offset) {
    if (offset < 0 || offset > len()) {
      return false;
    }
    if (offset == 0 || offset == len()) {
      return true;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    return cursor.item().isCharBoundary((int)(offset - cursor.start().bytes));
  }

  public long floorCharBoundary(long offset) {
    return clipOffset(offset, Bias.LEFT);
  }

  public long ceilCharBoundary(long offset) {
    return clipOffset(offset, Bias.RIGHT);
  }

  public Point offsetToPoint(long offset) {
    checkOffset(offset);
    TextSummary summary = summary();
    if (offset >= summary.bytes) {
      return summary.lines;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.lines.add(cursor.item().offsetToPoint((int)(offset - start.bytes)));
  }

  public PointUtf16 offsetToPointUtf16(long offset) {
    checkOffset(offset);
    TextSummary summary = summary();
    if (offset >= summary.bytes) {
      return summary.linesUtf16;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.linesUtf16.add(cursor.item().offsetToPointUtf16((int)(offset - start.bytes)));
  }

  public long offsetToOffsetUtf16(long offset) {
    checkOffset(offset);
    TextSummary summary = summary();
    if (offset >= summary.bytes) {
      return summary.lenUtf16;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.lenUtf16 + cursor.item().offsetToOffsetUtf16((int)(offset - start.bytes));
  }

  public long offsetUtf16ToOffset(long offsetUtf16) {
    checkOffset(offsetUtf16);
    TextSummary summary = summary();
    if (offsetUtf16 >= summary.lenUtf16) {
      return summary.bytes;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetUtf16Predicate(offsetUtf16, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.bytes + cursor.item().offsetUtf16ToOffset((int)(offsetUtf16 - start.lenUtf16));
  }

  public long pointToOffset(Point point) {
    TextSummary summary = summary();
    if (point.compareTo(summary.lines) >= 0) {
      return summary.bytes;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.pointPredicate(point, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.bytes + cursor.item().pointToOffset(point.subtract(start.lines));
  }

  public PointUtf16 pointToPointUtf16(Point point) {
    TextSummary summary = summary();
    if (point.compareTo(summary.lines) >= 0) {
      return summary.linesUtf16;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.pointPredicate(point, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.linesUtf16.add(cursor.item().pointToPointUtf16(point.subtract(start.lines)));
  }

  public long pointUtf16ToOffset(PointUtf16 point) {
    return pointUtf16ToOffset(point, false);
  }

  /*
   * like pointUtf16ToOffset, but columns past the line end or inside a surrogate pair are clipped
   * */
  public long unclippedPointUtf16ToOffset(PointUtf16 point) {
    return pointUtf16ToOffset(point, true);
  }

  private long pointUtf16ToOffset(PointUtf16 point, boolean clip) {
    TextSummary summary = summary();
    if (point.compareTo(summary.linesUtf16) >= 0) {
      return summary.bytes;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.pointUtf16Predicate(point, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.bytes + cursor.item().pointUtf16ToOffset(point.subtract(start.linesUtf16), clip);
  }

  public Point pointUtf16ToPoint(PointUtf16 point) {
    return pointUtf16ToPoint(point, false);
  }

  public Point unclippedPointUtf16ToPoint(PointUtf16 point) {
    return pointUtf16ToPoint(point, true);
  }

  private Point pointUtf16ToPoint(PointUtf16 point, boolean clip) {
    TextSummary summary = summary();
    if (point.compareTo(summary.linesUtf16) >= 0) {
      return summary.lines;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.pointUtf16Predicate(point, Bias.LEFT));
    TextSummary start = cursor.start();
    return start.lines.add(cursor.item().pointUtf16ToPoint(point.subtract(start.linesUtf16), clip));
  }

  /*
   * nearest char boundary in [0, len()], any input accepted
   * */
  public long clipOffset(long offset, Bias bias) {
    if (offset <= 0) {
      return 0;
    }
    if (offset >= len()) {
      return len();
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    Chunk chunk = cursor.item();
    long chunkStart = cursor.start().bytes;
    int ix = (int)(offset - chunkStart);
    while (!chunk.isCharBoundary(ix)) {
      ix += bias == Bias.LEFT ? -1 : 1;
    }
    return chunkStart + ix;
  }

  public long clipOffsetUtf16(long offsetUtf16, Bias bias) {
    if (offsetUtf16 <= 0) {
      return 0;
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    if (!cursor.seek(TextImpl.offsetUtf16Predicate(offsetUtf16, Bias.RIGHT))) {
      return summary().lenUtf16;
    }
    long chunkStart = cursor.start().lenUtf16;
    return chunkStart + cursor.item().clipOffsetUtf16((int)(offsetUtf16 - chunkStart), bias);
  }

  public Point clipPoint(Point point, Bias bias) {
    if (point.row < 0) {
      return Point.ZERO;
    }
    if (point.column < 0) {
      point = new Point(point.row, 0);
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    if (!cursor.seek(TextImpl.pointPredicate(point, Bias.RIGHT))) {
      return summary().lines;
    }
    Point start = cursor.start().lines;
    return start.add(cursor.item().clipPoint(point.subtract(start), bias));
  }

  public PointUtf16 clipPointUtf16(PointUtf16 point, Bias bias) {
    if (point.row < 0) {
      return PointUtf16.ZERO;
    }
    if (point.column < 0) {
      point = new PointUtf16(point.row, 0);
    }
    TreeCursor<TextSummary, Chunk> cursor = chunks.cursor();
    if (!cursor.seek(TextImpl.pointUtf16Predicate(point, Bias.RIGHT))) {
      return summary().linesUtf16;
    }
    PointUtf16 start = cursor.start().linesUtf16;
    return start.add(cursor.item().clipPointUtf16(point.subtract(start), bias));
  }

  /*
   * every chunk fits the limit, only the last one may be undersized (up to 3 bytes of slack for a character
   * pushed to the next chunk), and the cached summary matches the chunks
   * runs under `assert` only
   * */
  boolean checkInvariants() {
    List<Chunk> items = chunks.items();
    TextSummary expected = TextSummary.EMPTY;
    for (int i = 0; i < items.size(); i++) {
      Chunk chunk = items.get(i);
      if (chunk.isEmpty()) {
        return invariantViolated("chunk " + i + " is empty");
      }
      if (chunk.length() > ops.maxChunkLength()) {
        return invariantViolated("chunk " + i + " has " + chunk.length() + " bytes, limit is " + ops.maxChunkLength());
      }
      if (i < items.size() - 1 && chunk.length() + 3 < ops.chunkBase) {
        return invariantViolated("chunk " + i + " of " + items.size() + " is underflown: " + chunk.length() + " bytes");
      }
      expected = expected.add(chunk.summary());
    }
    if (!expected.equals(chunks.metrics)) {
      return invariantViolated("cached summary " + chunks.metrics + " differs from " + expected);
    }
    return true;
  }

  private static boolean invariantViolated(String message) {
    log.error("Rope invariant violated: {}", message);
    throw new AssertionError(message);
  }

  private void checkRange(long start, long end) {
    if (start < 0 || start > end || end > len()) {
      throw new IndexOutOfBoundsException("range " + start + ".." + end + " is out of rope of length " + len());
    }
  }

  private static void checkOffset(long offset) {
    if (offset < 0) {
      throw new IndexOutOfBoundsException("negative offset " + offset);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Rope other = (Rope)o;
    if (other.chunks == chunks) return true;
    if (len() != other.len()) return false;
    Bytes mine = bytesInRange(0, len());
    Bytes theirs = other.bytesInRange(0, other.len());
    byte[] a = new byte[1024];
    byte[] b = new byte[1024];
    for (int n = mine.read(a, 0, a.length); n != -1; n = mine.read(a, 0, a.length)) {
      if (theirs.readNBytes(b, 0, n) != n || !Arrays.equals(a, 0, n, b, 0, n)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = 1;
    Bytes bytes = bytesInRange(0, len());
    while (bytes.hasNext()) {
      ByteBuffer buffer = bytes.next();
      while (buffer.hasRemaining()) {
        h = 31 * h + buffer.get();
      }
    }
    return h;
  }

  @NotNull
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder((int)Math.min(Integer.MAX_VALUE, len()));
    Chunks it = chunks();
    while (it.hasNext()) {
      sb.append(it.next());
    }
    return sb.toString();
  }
}
