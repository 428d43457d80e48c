package bytedfa.parser;

import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.util.regex.Pattern;

/**
 * Shorthand classes {@code \d \D \s \S \w \W}.
 *
 * <p>These are ASCII-only, as in {@code java.util.regex.Pattern} without
 * {@code UNICODE_CHARACTER_CLASS}. Case-insensitivity does not change them.
 */
public enum BuiltinClass {
  DIGIT('d'),
  NON_DIGIT('D'),

  /**
   * {@code [ \t\n\x0B\f\r]}
   */
  WHITE_SPACE('s'),
  NON_WHITE_SPACE('S'),

  /**
   * {@code [a-zA-Z_0-9]}
   */
  WORD('w'),
  NON_WORD('W');

  /**
   * Letter following the backslash.
   */
  public final char escape;

  BuiltinClass(char escape) {
    this.escape = escape;
  }

  public IntRangeSet codePoints() {
    switch (this) {
      case DIGIT:
        return digits();
      case NON_DIGIT:
        return digits().complement(CodePoints.UNICODE_RANGE);
      case WHITE_SPACE:
        return whiteSpace();
      case NON_WHITE_SPACE:
        return whiteSpace().complement(CodePoints.UNICODE_RANGE);
      case WORD:
        return word();
      case NON_WORD:
        return word().complement(CodePoints.UNICODE_RANGE);
      default:
        throw new IllegalStateException("Unknown class " + this);
    }
  }

  /**
   * Class for an escape letter.
   *
   * @param escape letter following the backslash
   * @throws IllegalArgumentException if no class uses that letter
   */
  public static BuiltinClass forEscape(char escape) {
    for (BuiltinClass cls : values()) {
      if (cls.escape == escape) {
        return cls;
      }
    }
    throw new IllegalArgumentException("No builtin class for \\" + escape);
  }

  /**
   * Code points matched by {@code .}: everything but line terminators, or
   * everything in {@code DOTALL} mode.
   *
   * @param flags bitmask of {@code Pattern} flags
   */
  public static IntRangeSet dot(int flags) {
    final IntRangeSet all = IntRangeSet.of(CodePoints.UNICODE_RANGE);
    return (flags & Pattern.DOTALL) != 0 ? all : all.difference(lineTerminators(flags));
  }

  /**
   * {@code \n}, and unless in {@code UNIX_LINES} mode also {@code \r},
   * {@code U+0085}, {@code U+2028}, and {@code U+2029}.
   */
  static IntRangeSet lineTerminators(int flags) {
    if ((flags & Pattern.UNIX_LINES) != 0) {
      return IntRangeSet.of(IntRange.single('\n'));
    }
    return IntRangeSet.of(
      IntRange.single('\n'),
      IntRange.single('\r'),
      IntRange.single(0x85),
      IntRange.between(0x2028, 0x2029)
    );
  }

  private static IntRangeSet digits() {
    return IntRangeSet.of(IntRange.between('0', '9'));
  }

  private static IntRangeSet whiteSpace() {
    return IntRangeSet.of(IntRange.between('\t', '\r'), IntRange.single(' '));
  }

  private static IntRangeSet word() {
    return IntRangeSet.of(
      IntRange.between('0', '9'),
      IntRange.between('A', 'Z'),
      IntRange.single('_'),
      IntRange.between('a', 'z')
    );
  }
}
