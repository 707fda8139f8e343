package braid.text;

/**
 * A quantity that can be read off a {@link TextSummary}, used to ask a {@link Cursor} for a single measure
 * of a range.
 */
@FunctionalInterface
public interface TextDimension<D> {
  TextDimension<Long> BYTES = s -> s.bytes;
  TextDimension<Long> CHARS = s -> s.chars;
  TextDimension<Long> OFFSET_UTF16 = s -> s.lenUtf16;
  TextDimension<Point> POINT = s -> s.lines;
  TextDimension<PointUtf16> POINT_UTF16 = s -> s.linesUtf16;
  TextDimension<TextSummary> SUMMARY = s -> s;

  D of(TextSummary summary);
}
