package braid.text;

import braid.impl.text.Utf8;

import java.nio.charset.StandardCharsets;

/**
 * Aggregate statistics of a run of text.
 * <p>
 * Summaries form a monoid under {@link #add(TextSummary)} with {@link #EMPTY} as identity:
 * for any split of a text into {@code a + b + c}, {@code of(a).add(of(b)).add(of(c))} equals {@code of(a + b + c)}.
 * This is what lets the rope cache a summary in every tree node and still answer queries about arbitrary prefixes.
 */
public final class TextSummary {
  public static final TextSummary EMPTY = new TextSummary(0, 0, 0, Point.ZERO, PointUtf16.ZERO, 0, 0, 0, 0);

  /* length in bytes */
  public final long bytes;
  /* number of unicode scalar values */
  public final long chars;
  /* length in UTF-16 code units */
  public final long lenUtf16;
  /* position right after the last byte: number of newlines and byte length of the last line */
  public final Point lines;
  /* same as `lines` with the last line measured in UTF-16 code units */
  public final PointUtf16 linesUtf16;
  public final int firstLineChars;
  public final int lastLineChars;
  /* first row among the longest ones */
  public final int longestRow;
  public final int longestRowChars;

  public TextSummary(long bytes,
                     long chars,
                     long lenUtf16,
                     Point lines,
                     PointUtf16 linesUtf16,
                     int firstLineChars,
                     int lastLineChars,
                     int longestRow,
                     int longestRowChars) {
    this.bytes = bytes;
    this.chars = chars;
    this.lenUtf16 = lenUtf16;
    this.lines = lines;
    this.linesUtf16 = linesUtf16;
    this.firstLineChars = firstLineChars;
    this.lastLineChars = lastLineChars;
    this.longestRow = longestRow;
    this.longestRowChars = longestRowChars;
  }

  public static TextSummary of(String text) {
    byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
    return of(utf8, 0, utf8.length);
  }

  /*
   * single pass over well-formed UTF-8 in bytes[from, to)
   * */
  public static TextSummary of(byte[] bytes, int from, int to) {
    long chars = 0;
    long lenUtf16 = 0;
    int row = 0;
    int column = 0;
    int columnUtf16 = 0;
    int firstLineChars = 0;
    int lastLineChars = 0;
    int longestRow = 0;
    int longestRowChars = 0;

    int ix = from;
    while (ix < to) {
      byte b = bytes[ix];
      int width = Utf8.sequenceLength(b);
      int widthUtf16 = width == 4 ? 2 : 1;
      chars += 1;
      lenUtf16 += widthUtf16;

      if (b == '\n') {
        row += 1;
        column = 0;
        columnUtf16 = 0;
        lastLineChars = 0;
      }
      else {
        column += width;
        columnUtf16 += widthUtf16;
        lastLineChars += 1;
      }

      if (row == 0) {
        firstLineChars = lastLineChars;
      }

      if (lastLineChars > longestRowChars) {
        longestRow = row;
        longestRowChars = lastLineChars;
      }
      ix += width;
    }

    return new TextSummary(to - from,
                           chars,
                           lenUtf16,
                           new Point(row, column),
                           new PointUtf16(row, columnUtf16),
                           firstLineChars,
                           lastLineChars,
                           longestRow,
                           longestRowChars);
  }

  /*
   * summary of this text immediately followed by `other`
   * the last line of this and the first line of `other` join into a single row
   * */
  public TextSummary add(TextSummary other) {
    if (other == EMPTY) {
      return this;
    }
    if (this == EMPTY) {
      return other;
    }
    int longestRow = this.longestRow;
    int longestRowChars = this.longestRowChars;

    int joinedChars = this.lastLineChars + other.firstLineChars;
    if (joinedChars > longestRowChars) {
      longestRow = this.lines.row;
      longestRowChars = joinedChars;
    }
    if (other.longestRowChars > longestRowChars) {
      longestRow = this.lines.row + other.longestRow;
      longestRowChars = other.longestRowChars;
    }

    int firstLineChars = this.lines.row == 0
                         ? this.firstLineChars + other.firstLineChars
                         : this.firstLineChars;
    int lastLineChars = other.lines.row == 0
                        ? this.lastLineChars + other.lastLineChars
                        : other.lastLineChars;

    return new TextSummary(this.bytes + other.bytes,
                           this.chars + other.chars,
                           this.lenUtf16 + other.lenUtf16,
                           this.lines.add(other.lines),
                           this.linesUtf16.add(other.linesUtf16),
                           firstLineChars,
                           lastLineChars,
                           longestRow,
                           longestRowChars);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TextSummary that = (TextSummary)o;
    return bytes == that.bytes &&
           chars == that.chars &&
           lenUtf16 == that.lenUtf16 &&
           firstLineChars == that.firstLineChars &&
           lastLineChars == that.lastLineChars &&
           longestRow == that.longestRow &&
           longestRowChars == that.longestRowChars &&
           lines.equals(that.lines) &&
           linesUtf16.equals(that.linesUtf16);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(bytes);
    result = 31 * result + Long.hashCode(chars);
    result = 31 * result + lines.hashCode();
    result = 31 * result + linesUtf16.hashCode();
    result = 31 * result + longestRow;
    result = 31 * result + longestRowChars;
    return result;
  }

  @Override
  public String toString() {
    return "TextSummary{" +
           "bytes=" + bytes +
           ", chars=" + chars +
           ", lenUtf16=" + lenUtf16 +
           ", lines=" + lines +
           ", linesUtf16=" + linesUtf16 +
           ", firstLineChars=" + firstLineChars +
           ", lastLineChars=" + lastLineChars +
           ", longestRow=" + longestRow +
           ", longestRowChars=" + longestRowChars +
           '}';
  }
}
