package bytedfa;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits input into consecutive longest matches of a {@link ByteMatcher}.
 *
 * <p>Where nothing matches (which, for a complete segmentation pattern, only
 * happens on invalid UTF-8), a single byte is split off as its own segment.
 */
public final class Segmenter {

  private final ByteMatcher matcher;

  public Segmenter(ByteMatcher matcher) {
    this.matcher = matcher;
  }

  /**
   * Offsets of segment boundaries, starting with {@code 0} and ending with
   * the input length.
   *
   * @param input bytes to segment
   * @return increasing boundary offsets
   */
  public List<Integer> boundaries(byte[] input) {
    final var boundaries = new ArrayList<Integer>();
    boundaries.add(0);
    int offset = 0;
    while (offset < input.length) {
      final int length = matcher.matchLength(input, offset, input.length);
      offset += Math.max(length, 1);
      boundaries.add(offset);
    }
    return boundaries;
  }

  /**
   * Split input into segments.
   *
   * @param input bytes to segment
   * @return non-empty segments which concatenate back into the input
   */
  public List<byte[]> segments(byte[] input) {
    final List<Integer> boundaries = boundaries(input);
    final var segments = new ArrayList<byte[]>(boundaries.size() - 1);
    for (int i = 1; i < boundaries.size(); i++) {
      final int from = boundaries.get(i - 1);
      final int to = boundaries.get(i);
      final byte[] segment = new byte[to - from];
      System.arraycopy(input, from, segment, 0, segment.length);
      segments.add(segment);
    }
    return segments;
  }
}
