package braid.text;

import org.jetbrains.annotations.NotNull;

/**
 * A position in text as a zero-based row and a column counted in UTF-16 code units.
 */
public final class PointUtf16 implements Comparable<PointUtf16> {
  public static final PointUtf16 ZERO = new PointUtf16(0, 0);

  public final int row;
  public final int column;

  public PointUtf16(int row, int column) {
    this.row = row;
    this.column = column;
  }

  public boolean isZero() {
    return row == 0 && column == 0;
  }

  /*
   * the position reached by walking `other` starting from this one
   * */
  public PointUtf16 add(PointUtf16 other) {
    if (other.row == 0) {
      return new PointUtf16(row, column + other.column);
    }
    return new PointUtf16(row + other.row, other.column);
  }

  /*
   * inverse of add: `base.add(p.subtract(base))` is `p` for every `p >= base`
   * */
  public PointUtf16 subtract(PointUtf16 other) {
    assert compareTo(other) >= 0 : this + " < " + other;
    if (row == other.row) {
      return new PointUtf16(0, column - other.column);
    }
    return new PointUtf16(row - other.row, column);
  }

  @Override
  public int compareTo(@NotNull PointUtf16 o) {
    int r = Integer.compare(row, o.row);
    return r != 0 ? r : Integer.compare(column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PointUtf16 point = (PointUtf16)o;
    return row == point.row &&
           column == point.column;
  }

  @Override
  public int hashCode() {
    return 31 * row + column;
  }

  @Override
  public String toString() {
    return "PointUtf16{" +
           "row=" + row +
           ", column=" + column +
           '}';
  }
}
