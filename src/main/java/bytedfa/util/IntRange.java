package bytedfa.util;

/**
 * Non-empty, inclusive range of integers: code points before UTF-8 encoding,
 * bytes after.
 *
 * @param lowerBound first integer in the range
 * @param upperBound last integer in the range
 */
public record IntRange(
  int lowerBound,
  int upperBound
) implements Comparable<IntRange> {

  public IntRange {
    if (lowerBound > upperBound) {
      throw new IllegalArgumentException("Empty range " + lowerBound + ".." + upperBound);
    }
  }

  public static IntRange between(int lowerBound, int upperBound) {
    return new IntRange(lowerBound, upperBound);
  }

  public static IntRange single(int value) {
    return new IntRange(value, value);
  }

  public long size() {
    return (long) upperBound - lowerBound + 1;
  }

  public boolean contains(int value) {
    return lowerBound <= value && value <= upperBound;
  }

  public boolean overlapsWith(IntRange other) {
    return lowerBound <= other.upperBound && other.lowerBound <= upperBound;
  }

  /**
   * Integers in both ranges.
   *
   * @param other range to intersect with
   * @return common range, or {@code null} if the ranges are disjoint
   */
  public IntRange intersect(IntRange other) {
    if (!overlapsWith(other)) {
      return null;
    }
    return new IntRange(Math.max(lowerBound, other.lowerBound), Math.min(upperBound, other.upperBound));
  }

  /**
   * Orders by lower bound, then by upper bound.
   */
  @Override
  public int compareTo(IntRange other) {
    final int byLower = Integer.compare(lowerBound, other.lowerBound);
    return byLower != 0 ? byLower : Integer.compare(upperBound, other.upperBound);
  }

  @Override
  public String toString() {
    return lowerBound == upperBound ? Integer.toString(lowerBound) : lowerBound + ".." + upperBound;
  }
}
