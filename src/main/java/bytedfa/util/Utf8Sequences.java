package bytedfa.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterator over the byte sequences matching the UTF-8 encoding of a range of
 * code points.
 *
 * <p>The sequences are yielded in ascending order, they never overlap, and
 * together they match exactly the UTF-8 encodings of the non-surrogate code
 * points in the range. The range is first split at the surrogate block and at
 * the boundaries between 1, 2, 3, and 4 byte encodings. Each piece is then
 * split until every continuation byte position either varies over all of
 * {@code 0x80-0xBF} or is governed by a single leading prefix, at which point
 * the encodings of its two endpoints give the byte ranges directly.
 */
public final class Utf8Sequences implements Iterator<Utf8Sequence> {

  public static final int MAX_UTF8_BYTES = 4;

  private static final int MIN_SURROGATE = 0xD800;
  private static final int MAX_SURROGATE = 0xDFFF;

  /**
   * Largest scalar value with an encoding of {@code i + 1} bytes.
   */
  private static final int[] MAX_SCALAR = { 0x7F, 0x7FF, 0xFFFF, 0x10FFFF };

  private final ArrayDeque<int[]> rangeStack = new ArrayDeque<>();
  private Utf8Sequence next = null;

  /**
   * @param startCodePoint first code point (inclusive)
   * @param endCodePoint last code point (inclusive)
   */
  public Utf8Sequences(int startCodePoint, int endCodePoint) {
    if (startCodePoint < 0 || endCodePoint > MAX_SCALAR[MAX_UTF8_BYTES - 1]) {
      throw new IllegalArgumentException(
        "Code point range out of bounds: " + startCodePoint + ".." + endCodePoint
      );
    }
    push(startCodePoint, endCodePoint);
  }

  /**
   * Collect all of the sequences for a code point range.
   *
   * @param codePoints range of code points
   * @return sequences in ascending order
   */
  public static List<Utf8Sequence> of(IntRange codePoints) {
    final var sequences = new ArrayList<Utf8Sequence>();
    new Utf8Sequences(codePoints.lowerBound(), codePoints.upperBound())
      .forEachRemaining(sequences::add);
    return sequences;
  }

  @Override
  public boolean hasNext() {
    if (next == null) {
      next = advance();
    }
    return next != null;
  }

  @Override
  public Utf8Sequence next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Utf8Sequence result = next;
    next = null;
    return result;
  }

  private void push(int start, int end) {
    rangeStack.push(new int[] { start, end });
  }

  private Utf8Sequence advance() {
    top:
    while (!rangeStack.isEmpty()) {
      final int[] range = rangeStack.pop();
      int start = range[0];
      int end = range[1];

      inner:
      while (true) {
        // Split off the surrogate block
        if (start < MAX_SURROGATE + 1 && end > MIN_SURROGATE - 1) {
          push(MAX_SURROGATE + 1, end);
          end = MIN_SURROGATE - 1;
          continue inner;
        }
        if (start > end) {
          continue top;
        }

        // Split at encoding length boundaries
        for (int i = 0; i < MAX_UTF8_BYTES - 1; i++) {
          final int max = MAX_SCALAR[i];
          if (start <= max && max < end) {
            push(max + 1, end);
            end = max;
            continue inner;
          }
        }

        if (end <= MAX_SCALAR[0]) {
          return new Utf8Sequence(List.of(IntRange.between(start, end)));
        }

        // Split until each continuation byte position is either full or fixed
        for (int i = 1; i < MAX_UTF8_BYTES; i++) {
          final int mask = (1 << (6 * i)) - 1;
          if ((start & ~mask) != (end & ~mask)) {
            if ((start & mask) != 0) {
              push((start | mask) + 1, end);
              end = start | mask;
              continue inner;
            }
            if ((end & mask) != mask) {
              push(end & ~mask, end);
              end = (end & ~mask) - 1;
              continue inner;
            }
          }
        }

        final byte[] startBytes = new byte[MAX_UTF8_BYTES];
        final byte[] endBytes = new byte[MAX_UTF8_BYTES];
        final int length = encode(start, startBytes);
        encode(end, endBytes);

        final var byteRanges = new ArrayList<IntRange>(length);
        for (int i = 0; i < length; i++) {
          byteRanges.add(IntRange.between(startBytes[i] & 0xFF, endBytes[i] & 0xFF));
        }
        return new Utf8Sequence(byteRanges);
      }
    }
    return null;
  }

  /**
   * UTF-8 encode a scalar value.
   *
   * @param codePoint non-surrogate code point
   * @param output buffer of at least 4 bytes into which the encoding is written
   * @return number of bytes written
   */
  public static int encode(int codePoint, byte[] output) {
    if (codePoint < 0 || codePoint > MAX_SCALAR[MAX_UTF8_BYTES - 1]
        || (MIN_SURROGATE <= codePoint && codePoint <= MAX_SURROGATE)) {
      throw new IllegalArgumentException("Not a Unicode scalar value: " + codePoint);
    }
    if (codePoint <= MAX_SCALAR[0]) {
      output[0] = (byte) codePoint;
      return 1;
    } else if (codePoint <= MAX_SCALAR[1]) {
      output[0] = (byte) (0xC0 | (codePoint >> 6));
      output[1] = (byte) (0x80 | (codePoint & 0x3F));
      return 2;
    } else if (codePoint <= MAX_SCALAR[2]) {
      output[0] = (byte) (0xE0 | (codePoint >> 12));
      output[1] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
      output[2] = (byte) (0x80 | (codePoint & 0x3F));
      return 3;
    } else {
      output[0] = (byte) (0xF0 | (codePoint >> 18));
      output[1] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
      output[2] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
      output[3] = (byte) (0x80 | (codePoint & 0x3F));
      return 4;
    }
  }

  /**
   * Is the code point a surrogate (and therefore not encodable)?
   */
  public static boolean isSurrogate(int codePoint) {
    return MIN_SURROGATE <= codePoint && codePoint <= MAX_SURROGATE;
  }
}
