package bytedfa.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Immutable set of integers, stored as ranges.
 *
 * <p>The ranges are sorted and neither overlap nor touch, so every set has a
 * single representation and {@code equals} compares contents. Use
 * {@link #unionOf} to build a set from ranges not in that form.
 *
 * @param ranges sorted, disjoint, non-adjacent ranges
 */
public record IntRangeSet(List<IntRange> ranges) {

  public static final IntRangeSet EMPTY = new IntRangeSet(List.of());

  public IntRangeSet {
    for (int i = 1; i < ranges.size(); i++) {
      final IntRange before = ranges.get(i - 1);
      final IntRange after = ranges.get(i);
      if ((long) before.upperBound() + 1 >= after.lowerBound()) {
        throw new IllegalArgumentException(
          "Ranges must be sorted and separated, but got " + before + " then " + after
        );
      }
    }
    ranges = List.copyOf(ranges);
  }

  /**
   * @param ranges ranges already sorted and separated
   * @throws IllegalArgumentException if they are not
   */
  public static IntRangeSet of(IntRange... ranges) {
    return new IntRangeSet(Arrays.asList(ranges));
  }

  /**
   * Union of any ranges, in any order.
   */
  public static IntRangeSet unionOf(Collection<IntRange> ranges) {
    final IntRange[] sorted = ranges.toArray(new IntRange[0]);
    Arrays.sort(sorted);

    final var merged = new ArrayList<IntRange>();
    for (IntRange range : sorted) {
      final int last = merged.size() - 1;
      if (last >= 0 && (long) merged.get(last).upperBound() + 1 >= range.lowerBound()) {
        final IntRange previous = merged.get(last);
        if (range.upperBound() > previous.upperBound()) {
          merged.set(last, IntRange.between(previous.lowerBound(), range.upperBound()));
        }
      } else {
        merged.add(range);
      }
    }
    return new IntRangeSet(merged);
  }

  /**
   * Integers of a range satisfying a predicate.
   *
   * <p>The predicate is tested once on every integer of the range.
   */
  public static IntRangeSet matching(IntRange range, IntPredicate condition) {
    final var matched = new ArrayList<IntRange>();
    int runStart = -1;
    boolean inRun = false;
    for (long n = range.lowerBound(); n <= range.upperBound(); n++) {
      final boolean test = condition.test((int) n);
      if (test && !inRun) {
        runStart = (int) n;
      } else if (!test && inRun) {
        matched.add(IntRange.between(runStart, (int) n - 1));
      }
      inRun = test;
    }
    if (inRun) {
      matched.add(IntRange.between(runStart, range.upperBound()));
    }
    return new IntRangeSet(matched);
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  /**
   * Number of integers in the set.
   */
  public long size() {
    long size = 0;
    for (IntRange range : ranges) {
      size += range.size();
    }
    return size;
  }

  /**
   * Membership test, by binary search over the ranges.
   */
  public boolean contains(int n) {
    int low = 0;
    int high = ranges.size() - 1;
    while (low <= high) {
      final int middle = (low + high) >>> 1;
      final IntRange range = ranges.get(middle);
      if (n < range.lowerBound()) {
        high = middle - 1;
      } else if (n > range.upperBound()) {
        low = middle + 1;
      } else {
        return true;
      }
    }
    return false;
  }

  public IntRangeSet union(IntRangeSet other) {
    if (other.isEmpty()) {
      return this;
    } else if (isEmpty()) {
      return other;
    }
    final var all = new ArrayList<IntRange>(ranges);
    all.addAll(other.ranges);
    return unionOf(all);
  }

  public IntRangeSet intersection(IntRangeSet other) {
    final var common = new ArrayList<IntRange>();
    int i = 0;
    int j = 0;
    while (i < ranges.size() && j < other.ranges.size()) {
      final IntRange mine = ranges.get(i);
      final IntRange theirs = other.ranges.get(j);
      final IntRange overlap = mine.intersect(theirs);
      if (overlap != null) {
        common.add(overlap);
      }
      // The range ending first cannot overlap anything further along
      if (mine.upperBound() < theirs.upperBound()) {
        i++;
      } else {
        j++;
      }
    }
    return new IntRangeSet(common);
  }

  /**
   * Integers in this set but not in {@code other}.
   */
  public IntRangeSet difference(IntRangeSet other) {
    final var remaining = new ArrayList<IntRange>();
    int j = 0;
    for (IntRange range : ranges) {
      long next = range.lowerBound();
      while (j < other.ranges.size() && other.ranges.get(j).upperBound() < next) {
        j++;
      }
      int k = j;
      while (k < other.ranges.size() && other.ranges.get(k).lowerBound() <= range.upperBound()) {
        final IntRange removed = other.ranges.get(k);
        if (removed.lowerBound() > next) {
          remaining.add(IntRange.between((int) next, removed.lowerBound() - 1));
        }
        next = (long) removed.upperBound() + 1;
        k++;
      }
      if (next <= range.upperBound()) {
        remaining.add(IntRange.between((int) next, range.upperBound()));
      }
    }
    return new IntRangeSet(remaining);
  }

  /**
   * Integers of {@code universe} not in this set.
   */
  public IntRangeSet complement(IntRange universe) {
    return of(universe).difference(this);
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("IntRangeSet.of(");
    for (int i = 0; i < ranges.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(ranges.get(i));
    }
    return builder.append(')').toString();
  }
}
