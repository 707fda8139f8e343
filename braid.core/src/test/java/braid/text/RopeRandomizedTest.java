package braid.text;

import braid.impl.text.TextImpl.TextOps;
import braid.tree.Bias;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.arguments;

/*
 * random edits applied to a rope and to a String, the String being the reference
 * */
class RopeRandomizedTest {
  private static final String[] ALPHABET = {"a", "b", "c", " ", "\n", "\n", "é", "€", "🧘", "😀"};

  static Stream<Arguments> data() {
    return Stream.of(
      arguments(1L, new TextOps(4, 2)),
      arguments(2L, new TextOps(4, 3)),
      arguments(3L, new TextOps(5, 5)),
      arguments(4L, new TextOps(8, 16)),
      arguments(5L, new TextOps(32, 64))
    );
  }

  private static String randomText(Random random, int maxCodePoints) {
    StringBuilder sb = new StringBuilder();
    int n = random.nextInt(maxCodePoints + 1);
    for (int i = 0; i < n; i++) {
      sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
    }
    return sb.toString();
  }

  private static int utf8Length(String s) {
    return s.getBytes(StandardCharsets.UTF_8).length;
  }

  /* random String index that does not split a surrogate pair */
  private static int randomCharIndex(Random random, String text) {
    int ix = random.nextInt(text.length() + 1);
    if (ix > 0 && ix < text.length() && Character.isLowSurrogate(text.charAt(ix))) {
      ix--;
    }
    return ix;
  }

  private static void assertMatches(String expected, Rope rope) {
    assertEquals(expected, rope.toString());
    assertEquals(utf8Length(expected), rope.len());
    assertEquals(TextSummary.of(expected), rope.summary());
    assertTrue(rope.checkInvariants());
  }

  @ParameterizedTest
  @MethodSource("data")
  void testRandomEdits(long seed, TextOps ops) {
    Random random = new Random(seed);
    Rope rope = new Rope(ops);
    String reference = "";
    for (int step = 0; step < 300; step++) {
      int start = randomCharIndex(random, reference);
      int end = randomCharIndex(random, reference);
      if (end < start) {
        int tmp = start;
        start = end;
        end = tmp;
      }
      String text = randomText(random, 12);
      long startOffset = utf8Length(reference.substring(0, start));
      long endOffset = utf8Length(reference.substring(0, end));
      rope.replace(startOffset, endOffset, text);
      reference = reference.substring(0, start) + text + reference.substring(end);
      assertMatches(reference, rope);
    }
  }

  @ParameterizedTest
  @MethodSource("data")
  void testOffsetPointDuality(long seed, TextOps ops) {
    Random random = new Random(seed);
    for (int round = 0; round < 10; round++) {
      String text = randomText(random, 120);
      Rope rope = Rope.from(text, ops);
      int row = 0;
      int column = 0;
      int columnUtf16 = 0;
      long offset = 0;
      for (int ix = 0; ; ) {
        Point point = new Point(row, column);
        PointUtf16 pointUtf16 = new PointUtf16(row, columnUtf16);
        assertEquals(point, rope.offsetToPoint(offset));
        assertEquals(offset, rope.pointToOffset(point));
        assertEquals(pointUtf16, rope.offsetToPointUtf16(offset));
        assertEquals(offset, rope.pointUtf16ToOffset(pointUtf16));
        assertEquals(pointUtf16, rope.pointToPointUtf16(point));
        assertEquals(point, rope.pointUtf16ToPoint(pointUtf16));
        assertEquals(ix, rope.offsetToOffsetUtf16(offset));
        assertEquals(offset, rope.offsetUtf16ToOffset(ix));
        assertTrue(rope.isCharBoundary(offset));
        if (ix == text.length()) {
          break;
        }
        int cp = text.codePointAt(ix);
        int width = utf8Length(new String(Character.toChars(cp)));
        if (cp == '\n') {
          row++;
          column = 0;
          columnUtf16 = 0;
        }
        else {
          column += width;
          columnUtf16 += Character.charCount(cp);
        }
        offset += width;
        ix += Character.charCount(cp);
      }
      assertEquals(new Point(row, column), rope.maxPoint());
      assertEquals(new PointUtf16(row, columnUtf16), rope.maxPointUtf16());
    }
  }

  @ParameterizedTest
  @MethodSource("data")
  void testClipBoundedness(long seed, TextOps ops) {
    Random random = new Random(seed);
    for (int round = 0; round < 10; round++) {
      Rope rope = Rope.from(randomText(random, 80), ops);
      long len = rope.len();
      for (long offset = -3; offset <= len + 3; offset++) {
        for (Bias bias : Bias.values()) {
          long clipped = rope.clipOffset(offset, bias);
          assertTrue(clipped >= 0 && clipped <= len);
          assertTrue(rope.isCharBoundary(clipped));
          if (offset >= 0 && offset <= len) {
            assertTrue(bias == Bias.LEFT ? clipped <= offset : clipped >= offset);
          }
        }
      }
      Point max = rope.maxPoint();
      for (int row = 0; row <= max.row + 1; row++) {
        for (int column = 0; column < 12; column++) {
          for (Bias bias : Bias.values()) {
            Point clipped = rope.clipPoint(new Point(row, column), bias);
            assertTrue(clipped.compareTo(max) <= 0);
            long offset = rope.pointToOffset(clipped);
            assertEquals(clipped, rope.offsetToPoint(offset));

            PointUtf16 clippedUtf16 = rope.clipPointUtf16(new PointUtf16(row, column), bias);
            assertTrue(clippedUtf16.compareTo(rope.maxPointUtf16()) <= 0);
            long offsetUtf16 = rope.pointUtf16ToOffset(clippedUtf16);
            assertEquals(clippedUtf16, rope.offsetToPointUtf16(offsetUtf16));
          }
        }
      }
      long lenUtf16 = rope.summary().lenUtf16;
      for (long u = 0; u <= lenUtf16 + 2; u++) {
        for (Bias bias : Bias.values()) {
          long clipped = rope.clipOffsetUtf16(u, bias);
          assertTrue(clipped >= 0 && clipped <= lenUtf16);
          long offset = rope.offsetUtf16ToOffset(clipped);
          assertEquals(clipped, rope.offsetToOffsetUtf16(offset));
        }
      }
    }
  }

  @ParameterizedTest
  @MethodSource("data")
  void testSliceAndAppendConsistency(long seed, TextOps ops) {
    Random random = new Random(seed);
    for (int round = 0; round < 50; round++) {
      String left = randomText(random, 60);
      String right = randomText(random, 60);
      Rope a = Rope.from(left, ops);
      Rope b = Rope.from(right, ops);
      Rope c = a.copy();
      c.append(b);
      assertMatches(left + right, c);
      assertEquals(left, c.slice(0, a.len()).toString());
      assertEquals(right, c.slice(a.len(), c.len()).toString());
      assertEquals(c, c.slice(0, c.len()));

      String whole = left + right;
      int from = randomCharIndex(random, whole);
      int to = randomCharIndex(random, whole);
      if (from > to) {
        int tmp = from;
        from = to;
        to = tmp;
      }
      Rope slice = c.slice(utf8Length(whole.substring(0, from)), utf8Length(whole.substring(0, to)));
      assertMatches(whole.substring(from, to), slice);
    }
  }

  @ParameterizedTest
  @MethodSource("data")
  void testLongestRow(long seed, TextOps ops) {
    Random random = new Random(seed);
    for (int round = 0; round < 30; round++) {
      String text = randomText(random, 100);
      Rope rope = Rope.from(text, ops);
      String[] rows = text.split("\n", -1);
      int max = 0;
      for (int r = 0; r < rows.length; r++) {
        int chars = rows[r].codePointCount(0, rows[r].length());
        max = Math.max(max, chars);
        assertEquals(utf8Length(rows[r]), rope.lineLen(r));
      }
      assertEquals(max, rope.summary().longestRowChars);
      String longest = rows[rope.summary().longestRow];
      assertEquals(max, longest.codePointCount(0, longest.length()));
    }
  }
}
