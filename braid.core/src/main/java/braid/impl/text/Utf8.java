package braid.impl.text;

/*
 * byte level helpers over well-formed UTF-8
 * */
public final class Utf8 {
  private Utf8() {}

  public static boolean isContinuation(byte b) {
    return (b & 0xC0) == 0x80;
  }

  /*
   * `ix == length` counts as a boundary, anything outside [0, length] does not
   * */
  public static boolean isCharBoundary(byte[] bytes, int length, int ix) {
    if (ix == 0 || ix == length) {
      return true;
    }
    if (ix < 0 || ix > length) {
      return false;
    }
    return !isContinuation(bytes[ix]);
  }

  public static int sequenceLength(byte lead) {
    if ((lead & 0x80) == 0) {
      return 1;
    }
    if ((lead & 0xE0) == 0xC0) {
      return 2;
    }
    if ((lead & 0xF0) == 0xE0) {
      return 3;
    }
    return 4;
  }

  /*
   * code units taken by the character starting with `lead`: only 4-byte sequences need a surrogate pair
   * */
  public static int utf16Length(byte lead) {
    return sequenceLength(lead) == 4 ? 2 : 1;
  }

  /*
   * number of bytes `text` takes once encoded, unpaired surrogates count as the 3 bytes of a replacement char
   * */
  public static int encodedLength(CharSequence text) {
    int length = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        length += 1;
      }
      else if (c < 0x800) {
        length += 2;
      }
      else if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
        length += 4;
        i++;
      }
      else {
        length += 3;
      }
    }
    return length;
  }
}
