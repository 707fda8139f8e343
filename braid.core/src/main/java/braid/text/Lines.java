package braid.text;

import braid.impl.text.Utf8;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lines of a range without their newlines, in the direction of the underlying {@link Chunks}.
 * A range ending with a newline yields a trailing empty line, an empty range yields a single empty line.
 */
public final class Lines implements Iterator<String> {
  private final Chunks chunks;
  private boolean done;

  Lines(Chunks chunks) {
    this.chunks = chunks;
  }

  public void seek(long offset) {
    chunks.seek(offset);
    done = false;
  }

  public long offset() {
    return chunks.offset();
  }

  @Override
  public boolean hasNext() {
    return !done;
  }

  @Override
  public String next() {
    if (done) {
      throw new NoSuchElementException();
    }
    StringBuilder line = new StringBuilder();
    String piece;
    while ((piece = chunks.peek()) != null) {
      if (chunks.isReversed()) {
        int nl = piece.lastIndexOf('\n');
        if (nl >= 0) {
          String tail = piece.substring(nl + 1);
          chunks.seek(chunks.offset() - Utf8.encodedLength(tail) - 1);
          return line.insert(0, tail).toString();
        }
        line.insert(0, piece);
      }
      else {
        int nl = piece.indexOf('\n');
        if (nl >= 0) {
          String head = piece.substring(0, nl);
          chunks.seek(chunks.offset() + Utf8.encodedLength(head) + 1);
          return line.append(head).toString();
        }
        line.append(piece);
      }
      chunks.next();
    }
    done = true;
    return line.toString();
  }
}
