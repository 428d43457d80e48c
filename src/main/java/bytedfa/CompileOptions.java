package bytedfa;

import bytedfa.parser.PropertyResolver;

/**
 * Settings for compiling a pattern into a DFA.
 *
 * @param flags bitmask of {@code java.util.regex.Pattern} flags
 * @param properties resolver for Unicode properties such as {@code \p{gcb=LF}}
 * @param minimize whether to minimize the DFA after building it
 * @param reverse whether the DFA recognizes reversed matches, for scanning
 *   input from its end with {@link ByteMatcher#reverseMatchLength}
 */
public record CompileOptions(
  int flags,
  PropertyResolver properties,
  boolean minimize,
  boolean reverse
) {

  /**
   * No flags, no extra properties, minimized forward output.
   */
  public static final CompileOptions DEFAULT =
    new CompileOptions(0, PropertyResolver.NONE, true, false);

  public CompileOptions withFlags(int flags) {
    return new CompileOptions(flags, properties, minimize, reverse);
  }

  public CompileOptions withProperties(PropertyResolver properties) {
    return new CompileOptions(flags, properties, minimize, reverse);
  }

  public CompileOptions withMinimize(boolean minimize) {
    return new CompileOptions(flags, properties, minimize, reverse);
  }

  public CompileOptions withReverse(boolean reverse) {
    return new CompileOptions(flags, properties, minimize, reverse);
  }
}
