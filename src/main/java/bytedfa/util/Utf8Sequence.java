package bytedfa.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sequence of one to four byte ranges matching a contiguous block of UTF-8
 * encoded scalar values.
 *
 * <p>A byte string of the same length matches the sequence if its {@code i}th
 * byte is in the {@code i}th range.
 *
 * @param byteRanges ranges of bytes, each a subrange of {@code 0x00-0xFF}
 */
public record Utf8Sequence(List<IntRange> byteRanges) {

  public Utf8Sequence {
    if (byteRanges.isEmpty() || byteRanges.size() > Utf8Sequences.MAX_UTF8_BYTES) {
      throw new IllegalArgumentException("UTF-8 sequences have 1 to 4 bytes: " + byteRanges);
    }
    byteRanges = List.copyOf(byteRanges);
  }

  public int length() {
    return byteRanges.size();
  }

  /**
   * Does the byte string match this sequence?
   *
   * @param bytes bytes to check
   */
  public boolean matches(byte[] bytes) {
    if (bytes.length != byteRanges.size()) {
      return false;
    }
    for (int i = 0; i < bytes.length; i++) {
      if (!byteRanges.get(i).contains(bytes[i] & 0xFF)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return byteRanges
      .stream()
      .map(r -> r.lowerBound() == r.upperBound()
        ? String.format("[%02X]", r.lowerBound())
        : String.format("[%02X-%02X]", r.lowerBound(), r.upperBound()))
      .collect(Collectors.joining(""));
  }
}
