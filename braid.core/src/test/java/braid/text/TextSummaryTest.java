package braid.text;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TextSummaryTest {
  private static final String[] ALPHABET = {"a", "b", "\n", "é", "€", "🧘", " "};

  static String randomText(Random random, int codePoints) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < codePoints; i++) {
      sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
    }
    return sb.toString();
  }

  @Test
  void testEmpty() {
    assertEquals(TextSummary.EMPTY, TextSummary.of(""));
    TextSummary s = TextSummary.of("a\nb");
    assertSame(s, s.add(TextSummary.EMPTY));
    assertSame(s, TextSummary.EMPTY.add(s));
  }

  @Test
  void testOf() {
    TextSummary s = TextSummary.of("a\nbc\n🧘x");
    assertEquals(10, s.bytes);
    assertEquals(7, s.chars);
    assertEquals(8, s.lenUtf16);
    assertEquals(new Point(2, 5), s.lines);
    assertEquals(new PointUtf16(2, 3), s.linesUtf16);
    assertEquals(1, s.firstLineChars);
    assertEquals(2, s.lastLineChars);
    assertEquals(1, s.longestRow);
    assertEquals(2, s.longestRowChars);
  }

  @Test
  void testMultiByte() {
    TextSummary s = TextSummary.of("héllo");
    assertEquals(6, s.bytes);
    assertEquals(5, s.chars);
    assertEquals(new PointUtf16(0, 5), s.linesUtf16);
    assertEquals(new Point(0, 6), s.lines);
  }

  @Test
  void testJoinedLineBecomesLongest() {
    TextSummary left = TextSummary.of("aaaa\nbbb");
    TextSummary right = TextSummary.of("ccc\nd");
    TextSummary sum = left.add(right);
    assertEquals(TextSummary.of("aaaa\nbbbccc\nd"), sum);
    assertEquals(1, sum.longestRow);
    assertEquals(6, sum.longestRowChars);
  }

  @Test
  void testAssociativity() {
    Random random = new Random(7);
    for (int round = 0; round < 300; round++) {
      String text = randomText(random, random.nextInt(40));
      int[] cuts = new int[]{0, 0};
      int cpCount = text.codePointCount(0, text.length());
      if (cpCount > 0) {
        cuts[0] = random.nextInt(cpCount + 1);
        cuts[1] = cuts[0] + random.nextInt(cpCount - cuts[0] + 1);
      }
      int i = text.offsetByCodePoints(0, cuts[0]);
      int j = text.offsetByCodePoints(0, cuts[1]);
      TextSummary a = TextSummary.of(text.substring(0, i));
      TextSummary b = TextSummary.of(text.substring(i, j));
      TextSummary c = TextSummary.of(text.substring(j));
      TextSummary whole = TextSummary.of(text);
      assertEquals(whole, a.add(b).add(c), text);
      assertEquals(whole, a.add(b.add(c)), text);
    }
  }

  @Test
  void testLongestRow() {
    Random random = new Random(11);
    for (int round = 0; round < 200; round++) {
      String text = randomText(random, random.nextInt(60));
      TextSummary s = TextSummary.of(text);
      String[] rows = text.split("\n", -1);
      int max = 0;
      int maxRow = 0;
      for (int r = 0; r < rows.length; r++) {
        int chars = rows[r].codePointCount(0, rows[r].length());
        if (chars > max) {
          max = chars;
          maxRow = r;
        }
      }
      assertEquals(max, s.longestRowChars, text);
      assertEquals(maxRow, s.longestRow, text);
    }
  }
}
