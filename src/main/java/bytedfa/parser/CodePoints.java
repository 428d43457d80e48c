package bytedfa.parser;

import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Utility class for computing sets of code points.
 */
public final class CodePoints {

  private CodePoints() { }

  /**
   * Range of unicode code points: {@code U+0000-U+10FFFF}.
   */
  public static final IntRange UNICODE_RANGE =
    IntRange.between(Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);

  /**
   * Range of surrogate code points, which have no UTF-8 encoding: {@code U+D800-U+DFFF}.
   */
  public static final IntRange SURROGATE_RANGE =
    IntRange.between(Character.MIN_SURROGATE, Character.MAX_SURROGATE);

  public static IntRangeSet scriptCodePoints(Character.UnicodeScript script) {
    return IntRangeSet.matching(
      UNICODE_RANGE,
      codePoint -> script.equals(Character.UnicodeScript.of(codePoint))
    );
  }

  public static IntRangeSet blockCodePoints(Character.UnicodeBlock block) {
    return IntRangeSet.matching(
      UNICODE_RANGE,
      codePoint -> block.equals(Character.UnicodeBlock.of(codePoint))
    );
  }

  /**
   * Tabulate the set of code points in any of several general categories.
   *
   * @param categories {@code Character.getType} constants
   * @return set of code points whose type is one of the categories
   */
  public static IntRangeSet categoryCodePoints(int... categories) {
    return IntRangeSet.matching(
      UNICODE_RANGE,
      codePoint -> {
        final int type = Character.getType(codePoint);
        for (int category : categories) {
          if (type == category) {
            return true;
          }
        }
        return false;
      }
    );
  }

  /**
   * Close a set of code points under ASCII case folding.
   *
   * @param codePoints input set
   * @return input set plus the other case of every ASCII letter in it
   */
  public static IntRangeSet asciiCaseInsensitive(IntRangeSet codePoints) {
    final var extra = new ArrayList<IntRange>(codePoints.ranges());
    final var lower = IntRange.between('a', 'z');
    final var upper = IntRange.between('A', 'Z');
    for (IntRange range : codePoints.ranges()) {
      final IntRange lowerPart = range.intersect(lower);
      if (lowerPart != null) {
        extra.add(IntRange.between(lowerPart.lowerBound() - 32, lowerPart.upperBound() - 32));
      }
      final IntRange upperPart = range.intersect(upper);
      if (upperPart != null) {
        extra.add(IntRange.between(upperPart.lowerBound() + 32, upperPart.upperBound() + 32));
      }
    }
    return IntRangeSet.unionOf(extra);
  }

  /**
   * Normalize a property or value name for loose matching (UAX44-LM3): case,
   * whitespace, underscores, and hyphens are ignored.
   *
   * @param name property or value name
   * @return normalized name
   */
  public static String looseName(String name) {
    final var builder = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c != '_' && c != '-' && !Character.isWhitespace(c)) {
        builder.append(c);
      }
    }
    return builder.toString().toLowerCase(Locale.ROOT);
  }
}
