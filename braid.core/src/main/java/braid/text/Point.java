package braid.text;

import org.jetbrains.annotations.NotNull;

/**
 * A position in text as a zero-based row and a column counted in UTF-8 bytes.
 */
public final class Point implements Comparable<Point> {
  public static final Point ZERO = new Point(0, 0);

  public final int row;
  public final int column;

  public Point(int row, int column) {
    this.row = row;
    this.column = column;
  }

  public boolean isZero() {
    return row == 0 && column == 0;
  }

  /*
   * the position reached by walking `other` starting from this one
   * */
  public Point add(Point other) {
    if (other.row == 0) {
      return new Point(row, column + other.column);
    }
    return new Point(row + other.row, other.column);
  }

  /*
   * inverse of add: `base.add(p.subtract(base))` is `p` for every `p >= base`
   * */
  public Point subtract(Point other) {
    assert compareTo(other) >= 0 : this + " < " + other;
    if (row == other.row) {
      return new Point(0, column - other.column);
    }
    return new Point(row - other.row, column);
  }

  @Override
  public int compareTo(@NotNull Point o) {
    int r = Integer.compare(row, o.row);
    return r != 0 ? r : Integer.compare(column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Point point = (Point)o;
    return row == point.row &&
           column == point.column;
  }

  @Override
  public int hashCode() {
    return 31 * row + column;
  }

  @Override
  public String toString() {
    return "Point{" +
           "row=" + row +
           ", column=" + column +
           '}';
  }
}
