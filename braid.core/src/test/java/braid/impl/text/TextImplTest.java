package braid.impl.text;

import braid.impl.text.TextImpl.TextOps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TextImplTest {

  private static String join(List<Chunk> chunks) {
    StringBuilder sb = new StringBuilder();
    for (Chunk chunk : chunks) {
      sb.append(chunk.text());
    }
    return sb.toString();
  }

  @Test
  void testOpsValidation() {
    assertThrows(IllegalArgumentException.class, () -> new TextOps(3, 8));
    assertThrows(IllegalArgumentException.class, () -> new TextOps(8, 1));
    TextOps ops = new TextOps(4, 3);
    assertEquals(6, ops.maxChunkLength());
    assertEquals(4, ops.splitThreshold());
  }

  @Test
  void testSplitIntoChunksNeverCutsCharacters() {
    TextOps ops = new TextOps(4, 3);
    byte[] bytes = "🧘🧘🧘".getBytes(StandardCharsets.UTF_8);
    List<Chunk> chunks = TextImpl.splitIntoChunks(bytes, 0, bytes.length, ops);
    assertEquals(3, chunks.size());
    for (Chunk chunk : chunks) {
      assertEquals("🧘", chunk.text());
    }
  }

  @Test
  void testSplitIntoChunksFillsChunks() {
    TextOps ops = new TextOps(4, 3);
    byte[] bytes = "abcdefghijklmno".getBytes(StandardCharsets.UTF_8);
    List<Chunk> chunks = TextImpl.splitIntoChunks(bytes, 2, bytes.length, ops);
    assertEquals("cdefghijklmno", join(chunks));
    assertEquals(3, chunks.size());
    assertEquals(6, chunks.get(0).length());
    assertEquals(6, chunks.get(1).length());
    assertEquals(1, chunks.get(2).length());
  }

  @Test
  void testFindSplitIxPrefersMiddle() {
    TextOps ops = new TextOps(4, 4);
    byte[] bytes = "abcdefghij".getBytes(StandardCharsets.UTF_8);
    assertEquals(5, TextImpl.findSplitIx(bytes, bytes.length, ops));
    byte[] wide = "ab🧘cdefg".getBytes(StandardCharsets.UTF_8);
    // middle byte 5 is inside the emoji, 6 is the nearest boundary
    assertEquals(6, TextImpl.findSplitIx(wide, wide.length, ops));
  }

  /*
   * heavily 4-byte text: any two adjacent chunks rebalance into halves that fit a chunk
   * and are not undersized, whatever their sizes were
   * */
  @ParameterizedTest
  @ValueSource(ints = {2, 3, 4, 5, 7, 16})
  void testRebalanceMultiByte(int chunkBase) {
    TextOps ops = new TextOps(4, chunkBase);
    String[] alphabet = {"🧘", "🧘", "🧘", "€", "é", "a"};
    Random random = new Random(chunkBase);
    for (int round = 0; round < 500; round++) {
      Chunk left = randomChunk(random, alphabet, ops);
      Chunk right = randomChunk(random, alphabet, ops);
      if (left.length() + right.length() <= ops.maxChunkLength()) {
        continue;
      }
      Chunk[] halves = TextImpl.rebalance(left, right, ops);
      assertEquals(left.text() + right.text(), halves[0].text() + halves[1].text());
      for (Chunk half : halves) {
        assertTrue(half.length() <= ops.maxChunkLength(), half.toString());
        assertTrue(half.length() + 3 >= chunkBase, half.toString());
      }
    }
  }

  private static Chunk randomChunk(Random random, String[] alphabet, TextOps ops) {
    StringBuilder sb = new StringBuilder();
    int bytes = 0;
    while (true) {
      String next = alphabet[random.nextInt(alphabet.length)];
      int width = next.getBytes(StandardCharsets.UTF_8).length;
      if (bytes + width > ops.maxChunkLength() || (bytes > 0 && random.nextInt(4) == 0)) {
        break;
      }
      sb.append(next);
      bytes += width;
    }
    return Chunk.of(sb.toString());
  }
}
