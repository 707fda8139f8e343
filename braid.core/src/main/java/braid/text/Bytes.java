package braid.text;

import braid.impl.text.Chunk;
import braid.impl.text.TextImpl;
import braid.tree.Bias;
import braid.tree.SumTree;
import braid.tree.TreeCursor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Raw UTF-8 of a byte range, either as read-only buffers over the rope's storage ({@link #next()}) or as a
 * stream ({@link #read(byte[], int, int)}). A reversed instance walks the range back to front, and as a stream
 * it yields the bytes in reverse order.
 * <p>
 * Range endpoints need not be char boundaries. Reading never throws {@link java.io.IOException}.
 */
public final class Bytes extends InputStream implements Iterator<ByteBuffer> {
  private final TreeCursor<TextSummary, Chunk> chunks;
  private final boolean reversed;
  private long start;
  private long end;

  Bytes(SumTree<TextSummary, Chunk> tree, long start, long end, boolean reversed) {
    this.chunks = tree.cursor();
    this.start = start;
    this.end = end;
    this.reversed = reversed;
    if (reversed) {
      chunks.seek(TextImpl.offsetPredicate(end, Bias.LEFT));
    }
    else {
      chunks.seek(TextImpl.offsetPredicate(start, Bias.RIGHT));
    }
  }

  @Nullable
  public ByteBuffer peek() {
    Chunk chunk = chunks.item();
    if (chunk == null) {
      return null;
    }
    long chunkStart = chunks.start().bytes;
    long chunkEnd = chunkStart + chunk.length();
    if (start >= chunkEnd || end <= chunkStart) {
      return null;
    }
    int from = (int)(Math.max(chunkStart, start) - chunkStart);
    int to = (int)(Math.min(chunkEnd, end) - chunkStart);
    return from < to ? chunk.buffer(from, to) : null;
  }

  @Override
  public boolean hasNext() {
    return peek() != null;
  }

  @Override
  public ByteBuffer next() {
    ByteBuffer result = peek();
    if (result == null) {
      throw new NoSuchElementException();
    }
    long chunkStart = chunks.start().bytes;
    if (reversed) {
      end = Math.max(chunkStart, start);
    }
    else {
      start = Math.min(chunkStart + chunks.item().length(), end);
    }
    advance();
    return result;
  }

  @Override
  public int read() {
    byte[] single = new byte[1];
    return read(single, 0, 1) == -1 ? -1 : single[0] & 0xFF;
  }

  @Override
  public int read(@NotNull byte[] b, int off, int len) {
    if (off < 0 || len < 0 || len > b.length - off) {
      throw new IndexOutOfBoundsException("off=" + off + ", len=" + len + ", length=" + b.length);
    }
    if (len == 0) {
      return 0;
    }
    ByteBuffer chunk = peek();
    if (chunk == null) {
      return -1;
    }
    int available = chunk.remaining();
    int n = Math.min(len, available);
    if (reversed) {
      for (int i = 0; i < n; i++) {
        b[off + i] = chunk.get(available - 1 - i);
      }
      end -= n;
    }
    else {
      chunk.get(b, off, n);
      start += n;
    }
    if (n == available) {
      advance();
    }
    return n;
  }

  @Override
  public int readNBytes(@NotNull byte[] b, int off, int len) {
    Objects.checkFromIndexSize(off, len, b.length);
    int total = 0;
    while (total < len) {
      int n = read(b, off + total, len - total);
      if (n == -1) {
        break;
      }
      total += n;
    }
    return total;
  }

  @Override
  public int available() {
    return (int)Math.min(Integer.MAX_VALUE, Math.max(0, end - start));
  }

  private void advance() {
    if (reversed) {
      chunks.prev();
    }
    else {
      chunks.next();
    }
  }
}
