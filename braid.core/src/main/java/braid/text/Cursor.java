package braid.text;

import braid.impl.text.Chunk;
import braid.impl.text.TextImpl;
import braid.impl.text.TextImpl.TextOps;
import braid.tree.Bias;
import braid.tree.SumTree;
import braid.tree.TreeCursor;

/**
 * Forward-only navigator over a snapshot of a {@link Rope}, used to cut the rope into consecutive pieces
 * without restarting from the root for each of them.
 * <p>
 * A cursor positioned on a chunk boundary stands on the chunk that starts there.
 */
public final class Cursor {
  private final SumTree<TextSummary, Chunk> tree;
  private final TextOps ops;
  private final TreeCursor<TextSummary, Chunk> chunks;
  private long offset;

  Cursor(Rope rope, long offset) {
    this.tree = rope.chunks;
    this.ops = rope.ops;
    this.chunks = tree.cursor();
    this.chunks.seek(TextImpl.offsetPredicate(offset, Bias.RIGHT));
    this.offset = offset;
  }

  public long offset() {
    return offset;
  }

  public void seekForward(long endOffset) {
    assert endOffset >= offset : "cannot seek backwards from " + offset + " to " + endOffset;
    chunks.seekForward(TextImpl.offsetPredicate(endOffset, Bias.RIGHT));
    offset = endOffset;
  }

  /*
   * text between the current offset and `endOffset` as a new rope, leaves the cursor at `endOffset`
   * whole chunks in between are shared with the source rope
   * */
  public Rope slice(long endOffset) {
    assert endOffset >= offset : "cannot slice backwards from " + offset + " to " + endOffset;
    Rope slice = new Rope(ops);
    Chunk startChunk = chunks.item();
    if (startChunk != null) {
      long chunkStart = chunks.start().bytes;
      int startIx = (int)(offset - chunkStart);
      int endIx = (int)(Math.min(endOffset, chunkStart + startChunk.length()) - chunkStart);
      slice.pushChunk(startChunk.slice(startIx, endIx));
    }
    if (endOffset > chunks.end().bytes) {
      chunks.next();
      slice.append(new Rope(chunks.slice(TextImpl.offsetPredicate(endOffset, Bias.RIGHT)), ops));
      Chunk endChunk = chunks.item();
      if (endChunk != null) {
        int endIx = (int)(endOffset - chunks.start().bytes);
        slice.pushChunk(endChunk.slice(0, endIx));
      }
    }
    offset = endOffset;
    return slice;
  }

  public TextSummary summary(long endOffset) {
    assert endOffset >= offset : "cannot summarize backwards from " + offset + " to " + endOffset;
    TextSummary summary = TextSummary.EMPTY;
    Chunk startChunk = chunks.item();
    if (startChunk != null) {
      long chunkStart = chunks.start().bytes;
      int startIx = (int)(offset - chunkStart);
      int endIx = (int)(Math.min(endOffset, chunkStart + startChunk.length()) - chunkStart);
      summary = startChunk.summary(startIx, endIx);
    }
    if (endOffset > chunks.end().bytes) {
      chunks.next();
      summary = summary.add(chunks.summary(TextImpl.offsetPredicate(endOffset, Bias.RIGHT)));
      Chunk endChunk = chunks.item();
      if (endChunk != null) {
        int endIx = (int)(endOffset - chunks.start().bytes);
        summary = summary.add(endChunk.summary(0, endIx));
      }
    }
    offset = endOffset;
    return summary;
  }

  public <D> D summary(long endOffset, TextDimension<D> dimension) {
    return dimension.of(summary(endOffset));
  }

  /*
   * everything from the current offset to the end of the rope
   * */
  public Rope suffix() {
    return slice(tree.metrics.bytes);
  }
}
