package braid.text;

import braid.impl.text.Chunk;
import braid.impl.text.TextImpl;
import braid.tree.Bias;
import braid.tree.SumTree;
import braid.tree.TreeCursor;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates the text of a byte range as the pieces the rope stores it in, front to back or back to front.
 * Every piece is whole characters; the first and last ones are cut to the range.
 * <p>
 * Unlike a plain iterator it can {@link #peek()} and {@link #seek(long)} anywhere within its range,
 * in either direction.
 */
public final class Chunks implements Iterator<String> {
  private final SumTree<TextSummary, Chunk> tree;
  private final TreeCursor<TextSummary, Chunk> chunks;
  private long start;
  private long end;
  private final boolean reversed;
  private long offset;

  Chunks(SumTree<TextSummary, Chunk> tree, long start, long end, boolean reversed) {
    this.tree = tree;
    this.chunks = tree.cursor();
    this.start = start;
    this.end = end;
    this.reversed = reversed;
    if (reversed) {
      chunks.seek(TextImpl.offsetPredicate(end, Bias.LEFT));
      offset = end;
    }
    else {
      chunks.seek(TextImpl.offsetPredicate(start, Bias.RIGHT));
      offset = start;
    }
    checkCharBoundary(reversed ? start : end);
    checkCharBoundary(offset);
  }

  public long offset() {
    return offset;
  }

  public boolean isReversed() {
    return reversed;
  }

  /*
   * moves to `offset` clamped to the range, the next piece starts (or, reversed, ends) there
   * */
  public void seek(long offset) {
    offset = Math.max(start, Math.min(end, offset));
    long chunkStart = chunks.start().bytes;
    long chunkEnd = chunks.end().bytes;
    if (reversed) {
      if (offset > chunkEnd) {
        chunks.seekForward(TextImpl.offsetPredicate(offset, Bias.LEFT));
      }
      else if (offset <= chunkStart) {
        chunks.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
      }
    }
    else {
      if (offset >= chunkEnd) {
        chunks.seekForward(TextImpl.offsetPredicate(offset, Bias.RIGHT));
      }
      else if (offset < chunkStart) {
        chunks.seek(TextImpl.offsetPredicate(offset, Bias.RIGHT));
      }
    }
    this.offset = offset;
  }

  /*
   * narrows or widens the iterated range and restarts iteration at its beginning (its end when reversed)
   * */
  public void setRange(long start, long end) {
    if (start < 0 || start > end || end > tree.metrics.bytes) {
      throw new IndexOutOfBoundsException("range " + start + ".." + end + " outside of 0.." + tree.metrics.bytes);
    }
    checkCharBoundary(start);
    checkCharBoundary(end);
    this.start = start;
    this.end = end;
    seek(reversed ? end : start);
  }

  /**
   * Moves to the start of the next line.
   *
   * @return false if there is no line start after the current offset within the range,
   * the offset is then moved to the end of the range
   */
  public boolean nextLine() {
    assert !reversed : "line navigation on reversed chunks";
    if (offset >= end) {
      return false;
    }
    int row = rowAt(offset);
    if (row < tree.metrics.lines.row) {
      long next = lineStart(row + 1);
      if (next <= end) {
        seek(next);
        return true;
      }
    }
    seek(end);
    return false;
  }

  /**
   * Moves to the start of the current line or, when already there, to the start of the previous one.
   * Never moves before the start of the range.
   *
   * @return whether the offset moved
   */
  public boolean prevLine() {
    assert !reversed : "line navigation on reversed chunks";
    int row = rowAt(offset);
    long target = lineStart(row);
    if (target == offset && row > 0) {
      target = lineStart(row - 1);
    }
    target = Math.max(target, start);
    if (target >= offset) {
      return false;
    }
    seek(target);
    return true;
  }

  @Nullable
  public String peek() {
    if (!offsetIsValid()) {
      return null;
    }
    Chunk chunk = chunks.item();
    if (chunk == null) {
      return null;
    }
    long chunkStart = chunks.start().bytes;
    long chunkEnd = chunkStart + chunk.length();
    if (reversed) {
      return chunk.text((int)(Math.max(chunkStart, start) - chunkStart), (int)(offset - chunkStart));
    }
    return chunk.text((int)(offset - chunkStart), (int)(Math.min(chunkEnd, end) - chunkStart));
  }

  @Override
  public boolean hasNext() {
    return offsetIsValid() && chunks.item() != null;
  }

  @Override
  public String next() {
    String piece = peek();
    if (piece == null) {
      throw new NoSuchElementException();
    }
    long chunkStart = chunks.start().bytes;
    if (reversed) {
      offset = Math.max(chunkStart, start);
      if (offset <= chunkStart) {
        chunks.prev();
      }
    }
    else {
      long chunkEnd = chunkStart + chunks.item().length();
      offset = Math.min(chunkEnd, end);
      if (offset >= chunkEnd) {
        chunks.next();
      }
    }
    return piece;
  }

  /*
   * whether the rest of the range (from the current offset on, in iteration order) reads exactly `text`
   * leaves this iterator where it is
   * */
  public boolean equalsString(String text) {
    Chunks rest = new Chunks(tree, start, end, reversed);
    rest.seek(offset);
    int ix = reversed ? text.length() : 0;
    while (rest.hasNext()) {
      String piece = rest.next();
      if (reversed) {
        int from = ix - piece.length();
        if (from < 0 || !text.regionMatches(from, piece, 0, piece.length())) {
          return false;
        }
        ix = from;
      }
      else {
        if (!text.regionMatches(ix, piece, 0, piece.length())) {
          return false;
        }
        ix += piece.length();
      }
    }
    return reversed ? ix == 0 : ix == text.length();
  }

  public Lines lines() {
    return new Lines(this);
  }

  private boolean offsetIsValid() {
    return reversed ? offset > start : offset < end;
  }

  private int rowAt(long offset) {
    if (offset >= tree.metrics.bytes) {
      return tree.metrics.lines.row;
    }
    TreeCursor<TextSummary, Chunk> cursor = tree.cursor();
    cursor.seek(TextImpl.offsetPredicate(offset, Bias.LEFT));
    TextSummary chunkStart = cursor.start();
    return chunkStart.lines.row + cursor.item().offsetToPoint((int)(offset - chunkStart.bytes)).row;
  }

  private long lineStart(int row) {
    Point point = new Point(row, 0);
    if (point.compareTo(tree.metrics.lines) >= 0) {
      return tree.metrics.bytes;
    }
    TreeCursor<TextSummary, Chunk> cursor = tree.cursor();
    cursor.seek(TextImpl.pointPredicate(point, Bias.LEFT));
    TextSummary chunkStart = cursor.start();
    return chunkStart.bytes + cursor.item().pointToOffset(point.subtract(chunkStart.lines));
  }

  private void checkCharBoundary(long offset) {
    TreeCursor<TextSummary, Chunk> cursor = tree.cursor();
    if (!cursor.seek(TextImpl.offsetPredicate(offset, Bias.RIGHT))) {
      return;
    }
    if (!cursor.item().isCharBoundary((int)(offset - cursor.start().bytes))) {
      throw new IllegalArgumentException("byte index " + offset + " is not a char boundary");
    }
  }
}
