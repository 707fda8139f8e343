package braid.impl.text;

import braid.text.Point;
import braid.text.PointUtf16;
import braid.text.TextSummary;
import braid.tree.Bias;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class ChunkTest {
  /* a0 b1 \n2 c3 d4 🧘5..8 \n9 €10..12 x13 */
  private final Chunk chunk = Chunk.of("ab\ncd🧘\n€x");

  @Test
  void testBasics() {
    assertEquals(14, chunk.length());
    assertEquals("ab\ncd🧘\n€x", chunk.text());
    assertEquals("🧘", chunk.text(5, 9));
    assertEquals("🧘", chunk.slice(5, 9).text());
    assertSame(chunk, chunk.slice(0, 14));
    assertThrows(IllegalArgumentException.class, () -> chunk.slice(6, 9));
    assertThrows(IllegalArgumentException.class, () -> chunk.slice(0, 15));
    assertTrue(chunk.isCharBoundary(9));
    assertFalse(chunk.isCharBoundary(11));
    assertEquals("ab\ncd🧘\n€xab", chunk.concat(Chunk.of("ab")).text());
    assertTrue(Chunk.EMPTY.isEmpty());
  }

  @Test
  void testSummary() {
    assertEquals(TextSummary.of("ab\ncd🧘\n€x"), chunk.summary());
    assertEquals(TextSummary.of("cd🧘"), chunk.summary(3, 9));
  }

  @Test
  void testBuffer() {
    ByteBuffer buffer = chunk.buffer(3, 5);
    assertEquals(2, buffer.remaining());
    assertEquals((byte)'c', buffer.get(0));
    assertTrue(buffer.isReadOnly());
  }

  @Test
  void testOffsetConversions() {
    assertEquals(new Point(1, 2), chunk.offsetToPoint(5));
    assertEquals(new Point(1, 6), chunk.offsetToPoint(9));
    assertEquals(new Point(2, 4), chunk.offsetToPoint(14));
    assertThrows(IllegalArgumentException.class, () -> chunk.offsetToPoint(6));

    assertEquals(new PointUtf16(1, 4), chunk.offsetToPointUtf16(9));
    assertEquals(new PointUtf16(2, 1), chunk.offsetToPointUtf16(13));

    assertEquals(7, chunk.offsetToOffsetUtf16(9));
    assertEquals(9, chunk.offsetUtf16ToOffset(7));
    assertThrows(IllegalArgumentException.class, () -> chunk.offsetUtf16ToOffset(6));
    assertThrows(IllegalArgumentException.class, () -> chunk.offsetUtf16ToOffset(100));
  }

  @Test
  void testPointConversions() {
    assertEquals(9, chunk.pointToOffset(new Point(1, 6)));
    assertEquals(14, chunk.pointToOffset(new Point(2, 4)));
    assertThrows(IllegalArgumentException.class, () -> chunk.pointToOffset(new Point(1, 3)));
    assertThrows(IllegalArgumentException.class, () -> chunk.pointToOffset(new Point(0, 5)));
    assertThrows(IllegalArgumentException.class, () -> chunk.pointToOffset(new Point(3, 0)));

    assertEquals(new PointUtf16(1, 4), chunk.pointToPointUtf16(new Point(1, 6)));
    assertEquals(new Point(1, 6), chunk.pointUtf16ToPoint(new PointUtf16(1, 4), false));
    assertEquals(9, chunk.pointUtf16ToOffset(new PointUtf16(1, 4), false));
  }

  @Test
  void testPointUtf16Clipping() {
    assertThrows(IllegalArgumentException.class, () -> chunk.pointUtf16ToOffset(new PointUtf16(1, 3), false));
    assertEquals(9, chunk.pointUtf16ToOffset(new PointUtf16(1, 3), true));
    assertEquals(2, chunk.pointUtf16ToOffset(new PointUtf16(0, 10), true));
    assertEquals(new Point(0, 2), chunk.pointUtf16ToPoint(new PointUtf16(0, 10), true));
    assertThrows(IllegalArgumentException.class, () -> chunk.pointUtf16ToPoint(new PointUtf16(0, 10), false));
  }

  @Test
  void testClip() {
    assertEquals(new Point(1, 2), chunk.clipPoint(new Point(1, 3), Bias.LEFT));
    assertEquals(new Point(1, 6), chunk.clipPoint(new Point(1, 3), Bias.RIGHT));
    assertEquals(new Point(0, 2), chunk.clipPoint(new Point(0, 99), Bias.LEFT));
    assertEquals(new Point(2, 4), chunk.clipPoint(new Point(2, 99), Bias.RIGHT));

    assertEquals(new PointUtf16(1, 2), chunk.clipPointUtf16(new PointUtf16(1, 3), Bias.LEFT));
    assertEquals(new PointUtf16(1, 4), chunk.clipPointUtf16(new PointUtf16(1, 3), Bias.RIGHT));
    assertEquals(new PointUtf16(0, 2), chunk.clipPointUtf16(new PointUtf16(0, 7), Bias.RIGHT));

    assertEquals(5, chunk.clipOffsetUtf16(6, Bias.LEFT));
    assertEquals(7, chunk.clipOffsetUtf16(6, Bias.RIGHT));
    assertEquals(10, chunk.clipOffsetUtf16(99, Bias.RIGHT));
  }
}
