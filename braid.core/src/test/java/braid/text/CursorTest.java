package braid.text;

import braid.impl.text.TextImpl.TextOps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CursorTest {
  private static final TextOps SMALL = new TextOps(4, 3);
  private static final String TEXT = "hello\nwörld 🧘\nthe end";

  @Test
  void testConsecutiveSlices() {
    Rope rope = Rope.from(TEXT, SMALL);
    Cursor cursor = rope.cursor(0);
    assertEquals("hello", cursor.slice(5).toString());
    assertEquals(5, cursor.offset());
    assertEquals("\nwörld", cursor.slice(12).toString());
    cursor.seekForward(13);
    assertEquals("🧘", cursor.slice(17).toString());
    assertEquals("\nthe end", cursor.suffix().toString());
    assertEquals(rope.len(), cursor.offset());
    assertEquals("", cursor.suffix().toString());
  }

  @Test
  void testSliceWithinOneChunk() {
    Rope rope = Rope.from(TEXT, SMALL);
    Cursor cursor = rope.cursor(1);
    assertEquals("el", cursor.slice(3).toString());
    assertEquals("", cursor.slice(3).toString());
  }

  @Test
  void testSummary() {
    Rope rope = Rope.from(TEXT, SMALL);
    Cursor cursor = rope.cursor(2);
    assertEquals(TextSummary.of("llo\nwörld"), cursor.summary(12));
    assertEquals(12, cursor.offset());
    assertEquals(new Point(1, 7), cursor.summary(rope.len(), TextDimension.POINT));

    assertEquals(7L, rope.cursor(0).summary(7, TextDimension.BYTES));
    assertEquals(new PointUtf16(1, 8), rope.cursor(0).summary(17, TextDimension.POINT_UTF16));
    assertEquals(14L, rope.cursor(0).summary(17, TextDimension.OFFSET_UTF16));
    assertEquals(13L, rope.cursor(0).summary(17, TextDimension.CHARS));
  }

  @Test
  void testCursorIsASnapshot() {
    Rope rope = Rope.from(TEXT, SMALL);
    Cursor cursor = rope.cursor(0);
    rope.replace(0, 5, "bye");
    assertEquals("hello", cursor.slice(5).toString());
    assertEquals("bye\nwörld 🧘\nthe end", rope.toString());
  }

  @Test
  void testBackwardsIsRejected() {
    Rope rope = Rope.from(TEXT, SMALL);
    Cursor cursor = rope.cursor(6);
    assertThrows(AssertionError.class, () -> cursor.seekForward(2));
    assertThrows(AssertionError.class, () -> cursor.slice(2));
    assertThrows(IndexOutOfBoundsException.class, () -> rope.cursor(rope.len() + 1));
  }
}
