package braid.impl.text;

import braid.text.Point;
import braid.text.PointUtf16;
import braid.text.TextSummary;
import braid.tree.Bias;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Leaf of a rope: an immutable run of well-formed UTF-8.
 * <p>
 * Chunks are created, merged and split at char boundaries only. The coordinate methods take positions relative
 * to the start of the chunk and scan it linearly; they throw {@link IllegalArgumentException} when the target
 * falls inside a character or past the end of a line. Callers are expected to clip external coordinates first.
 */
public final class Chunk {
  public static final Chunk EMPTY = new Chunk(new byte[0]);

  final byte[] bytes;

  Chunk(byte[] bytes) {
    this.bytes = bytes;
  }

  public static Chunk of(byte[] source, int from, int to) {
    byte[] copy = new byte[to - from];
    System.arraycopy(source, from, copy, 0, copy.length);
    return new Chunk(copy);
  }

  public static Chunk of(String text) {
    return new Chunk(text.getBytes(StandardCharsets.UTF_8));
  }

  public int length() {
    return bytes.length;
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }

  /*
   * read-only view of bytes[from, to) positioned at 0
   * */
  public ByteBuffer buffer(int from, int to) {
    return ByteBuffer.wrap(bytes, from, to - from).slice().asReadOnlyBuffer();
  }

  public String text() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  public String text(int from, int to) {
    checkCharBoundary(from);
    checkCharBoundary(to);
    return new String(bytes, from, to - from, StandardCharsets.UTF_8);
  }

  public boolean isCharBoundary(int ix) {
    return Utf8.isCharBoundary(bytes, bytes.length, ix);
  }

  public Chunk slice(int from, int to) {
    checkCharBoundary(from);
    checkCharBoundary(to);
    if (from == 0 && to == bytes.length) {
      return this;
    }
    return of(bytes, from, to);
  }

  public Chunk concat(Chunk other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    byte[] merged = new byte[bytes.length + other.bytes.length];
    System.arraycopy(bytes, 0, merged, 0, bytes.length);
    System.arraycopy(other.bytes, 0, merged, bytes.length, other.bytes.length);
    return new Chunk(merged);
  }

  public TextSummary summary() {
    return TextSummary.of(bytes, 0, bytes.length);
  }

  public TextSummary summary(int from, int to) {
    return TextSummary.of(bytes, from, to);
  }

  public Point offsetToPoint(int target) {
    checkCharBoundary(target);
    int row = 0;
    int column = 0;
    int ix = 0;
    while (ix < target) {
      byte b = bytes[ix];
      if (b == '\n') {
        row += 1;
        column = 0;
        ix += 1;
      }
      else {
        int width = Utf8.sequenceLength(b);
        column += width;
        ix += width;
      }
    }
    return new Point(row, column);
  }

  public PointUtf16 offsetToPointUtf16(int target) {
    checkCharBoundary(target);
    int row = 0;
    int column = 0;
    int ix = 0;
    while (ix < target) {
      byte b = bytes[ix];
      if (b == '\n') {
        row += 1;
        column = 0;
      }
      else {
        column += Utf8.utf16Length(b);
      }
      ix += Utf8.sequenceLength(b);
    }
    return new PointUtf16(row, column);
  }

  public int offsetToOffsetUtf16(int target) {
    checkCharBoundary(target);
    int units = 0;
    int ix = 0;
    while (ix < target) {
      byte b = bytes[ix];
      units += Utf8.utf16Length(b);
      ix += Utf8.sequenceLength(b);
    }
    return units;
  }

  public int offsetUtf16ToOffset(int target) {
    int units = 0;
    int ix = 0;
    while (units < target) {
      if (ix >= bytes.length) {
        throw new IllegalArgumentException("UTF-16 offset " + target + " is out of chunk of " + units + " code units");
      }
      byte b = bytes[ix];
      units += Utf8.utf16Length(b);
      ix += Utf8.sequenceLength(b);
    }
    if (units > target) {
      throw new IllegalArgumentException("UTF-16 offset " + target + " is inside of a surrogate pair");
    }
    return ix;
  }

  public int pointToOffset(Point target) {
    int row = 0;
    int column = 0;
    int ix = 0;
    while (ix < bytes.length) {
      int c = compare(row, column, target.row, target.column);
      if (c >= 0) {
        if (c > 0) {
          throw new IllegalArgumentException("point " + target + " is inside of a character");
        }
        break;
      }
      byte b = bytes[ix];
      if (b == '\n') {
        row += 1;
        if (row > target.row) {
          throw new IllegalArgumentException("point " + target + " is beyond the end of a line with length " + column);
        }
        column = 0;
        ix += 1;
      }
      else {
        int width = Utf8.sequenceLength(b);
        column += width;
        ix += width;
      }
    }
    checkReached(row, column, target.row, target.column, target);
    return ix;
  }

  public PointUtf16 pointToPointUtf16(Point target) {
    int row = 0;
    int column = 0;
    int columnUtf16 = 0;
    int ix = 0;
    while (ix < bytes.length) {
      int c = compare(row, column, target.row, target.column);
      if (c >= 0) {
        if (c > 0) {
          throw new IllegalArgumentException("point " + target + " is inside of a character");
        }
        break;
      }
      byte b = bytes[ix];
      if (b == '\n') {
        row += 1;
        if (row > target.row) {
          throw new IllegalArgumentException("point " + target + " is beyond the end of a line with length " + column);
        }
        column = 0;
        columnUtf16 = 0;
        ix += 1;
      }
      else {
        int width = Utf8.sequenceLength(b);
        column += width;
        columnUtf16 += width == 4 ? 2 : 1;
        ix += width;
      }
    }
    checkReached(row, column, target.row, target.column, target);
    return new PointUtf16(row, columnUtf16);
  }

  /*
   * with `clip` set, a column past the end of its line resolves to the line end
   * and a column inside a surrogate pair resolves to the end of the pair
   * */
  public int pointUtf16ToOffset(PointUtf16 target, boolean clip) {
    int row = 0;
    int column = 0;
    int ix = 0;
    while (ix < bytes.length) {
      int c = compare(row, column, target.row, target.column);
      if (c >= 0) {
        if (c > 0 && !clip) {
          throw new IllegalArgumentException("point " + target + " is inside of a character");
        }
        break;
      }
      byte b = bytes[ix];
      if (b == '\n') {
        if (row + 1 > target.row) {
          if (clip) {
            break;
          }
          throw new IllegalArgumentException("point " + target + " is beyond the end of a line with length " + column);
        }
        row += 1;
        column = 0;
        ix += 1;
      }
      else {
        column += Utf8.utf16Length(b);
        ix += Utf8.sequenceLength(b);
      }
    }
    if (!clip) {
      checkReached(row, column, target.row, target.column, target);
    }
    return ix;
  }

  public Point pointUtf16ToPoint(PointUtf16 target, boolean clip) {
    int row = 0;
    int column = 0;
    int columnUtf8 = 0;
    int ix = 0;
    while (ix < bytes.length) {
      int c = compare(row, column, target.row, target.column);
      if (c >= 0) {
        if (c > 0 && !clip) {
          throw new IllegalArgumentException("point " + target + " is inside of a character");
        }
        break;
      }
      byte b = bytes[ix];
      if (b == '\n') {
        if (row + 1 > target.row) {
          if (clip) {
            break;
          }
          throw new IllegalArgumentException("point " + target + " is beyond the end of a line with length " + column);
        }
        row += 1;
        column = 0;
        columnUtf8 = 0;
        ix += 1;
      }
      else {
        int width = Utf8.sequenceLength(b);
        column += width == 4 ? 2 : 1;
        columnUtf8 += width;
        ix += width;
      }
    }
    if (!clip) {
      checkReached(row, column, target.row, target.column, target);
    }
    return new Point(row, columnUtf8);
  }

  public Point clipPoint(Point target, Bias bias) {
    int lineStart = lineStart(target.row);
    int lineEnd = lineEnd(lineStart);
    int column = Math.min(target.column, lineEnd - lineStart);
    while (!isCharBoundary(lineStart + column)) {
      column += bias == Bias.LEFT ? -1 : 1;
    }
    return new Point(target.row, column);
  }

  public PointUtf16 clipPointUtf16(PointUtf16 target, Bias bias) {
    int lineStart = lineStart(target.row);
    int lineEnd = lineEnd(lineStart);
    int column = 0;
    int ix = lineStart;
    while (ix < lineEnd && column < target.column) {
      int units = Utf8.utf16Length(bytes[ix]);
      if (column + units > target.column) {
        // target splits a surrogate pair
        if (bias == Bias.RIGHT) {
          column += units;
        }
        return new PointUtf16(target.row, column);
      }
      column += units;
      ix += Utf8.sequenceLength(bytes[ix]);
    }
    return new PointUtf16(target.row, column);
  }

  public int clipOffsetUtf16(int target, Bias bias) {
    int units = 0;
    int ix = 0;
    while (ix < bytes.length && units < target) {
      int width = Utf8.utf16Length(bytes[ix]);
      if (units + width > target) {
        return bias == Bias.RIGHT ? units + width : units;
      }
      units += width;
      ix += Utf8.sequenceLength(bytes[ix]);
    }
    return units;
  }

  /*
   * index of the first byte of `row`, rows are relative to the chunk
   * */
  private int lineStart(int row) {
    int ix = 0;
    int r = 0;
    while (r < row) {
      while (ix < bytes.length && bytes[ix] != '\n') {
        ix++;
      }
      if (ix == bytes.length) {
        throw new IllegalArgumentException("row " + row + " is beyond the chunk with " + r + " newlines");
      }
      ix++;
      r++;
    }
    return ix;
  }

  private int lineEnd(int lineStart) {
    int ix = lineStart;
    while (ix < bytes.length && bytes[ix] != '\n') {
      ix++;
    }
    return ix;
  }

  private void checkCharBoundary(int ix) {
    if (ix < 0 || ix > bytes.length) {
      throw new IllegalArgumentException("byte index " + ix + " is out of chunk of " + bytes.length + " bytes");
    }
    if (!isCharBoundary(ix)) {
      throw new IllegalArgumentException("byte index " + ix + " is not a char boundary");
    }
  }

  private static void checkReached(int row, int column, int targetRow, int targetColumn, Object target) {
    if (compare(row, column, targetRow, targetColumn) < 0) {
      throw new IllegalArgumentException(target + " is beyond the end of the chunk");
    }
  }

  private static int compare(int row, int column, int targetRow, int targetColumn) {
    int r = Integer.compare(row, targetRow);
    return r != 0 ? r : Integer.compare(column, targetColumn);
  }

  @Override
  public String toString() {
    return "Chunk{" + text() + '}';
  }
}
