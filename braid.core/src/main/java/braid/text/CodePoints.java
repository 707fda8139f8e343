package braid.text;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/*
 * unicode code points of a range, decoded piece by piece off a Chunks iterator
 * */
final class CodePoints implements PrimitiveIterator.OfInt {
  private final Chunks chunks;
  private final boolean reversed;
  private String piece = "";
  private int ix;

  CodePoints(Chunks chunks, boolean reversed) {
    this.chunks = chunks;
    this.reversed = reversed;
  }

  @Override
  public boolean hasNext() {
    while (reversed ? ix <= 0 : ix >= piece.length()) {
      if (!chunks.hasNext()) {
        return false;
      }
      piece = chunks.next();
      ix = reversed ? piece.length() : 0;
    }
    return true;
  }

  @Override
  public int nextInt() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    if (reversed) {
      int cp = piece.codePointBefore(ix);
      ix -= Character.charCount(cp);
      return cp;
    }
    int cp = piece.codePointAt(ix);
    ix += Character.charCount(cp);
    return cp;
  }
}
