package bytedfa.parser;

import bytedfa.ast.Regex;
import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.util.ArrayList;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive descent parser from pattern text to a {@link Regex} AST.
 *
 * <p>The accepted syntax is that of {@link java.util.regex.Pattern}, without
 * backreferences, lookaround, or possessive quantifiers. Bracket classes,
 * escapes, and properties are resolved into sets of code points as they are
 * parsed, so the AST never holds an unresolved class. Properties written as
 * {@code \p{key=value}} or {@code \p{name}} are looked up in the
 * {@link PropertyResolver} first, then as general categories, scripts, and
 * blocks.
 *
 * <p>Boundaries ({@code ^ $ \b \B \A \Z \z}) parse into
 * {@link Regex.Anchor}: rejecting them is left to the NFA compiler.
 */
public final class RegexParser {

  private final String pattern;
  private final PropertyResolver properties;

  private int cursor = 0;
  private int capturingGroups = 0;

  // Changes as inline flags like `(?i)` are parsed
  private int flags;

  /**
   * Code point or set of code points, as found at one position inside or
   * outside a bracket class.
   *
   * <p>Only single code points can be the ends of a class range.
   */
  private record ClassItem(int codePoint, IntRangeSet codePoints) {
    static ClassItem single(int codePoint) {
      return new ClassItem(codePoint, null);
    }

    static ClassItem set(IntRangeSet codePoints) {
      return new ClassItem(-1, codePoints);
    }

    boolean isSingle() {
      return codePoints == null;
    }
  }

  private RegexParser(String pattern, int flags, PropertyResolver properties) {
    this.pattern = pattern;
    this.flags = flags;
    this.properties = properties;
  }

  /**
   * Parse a pattern.
   *
   * @param pattern regular expression
   * @param flags bitmask of {@code Pattern} flags ({@code CASE_INSENSITIVE},
   *   {@code COMMENTS}, {@code DOTALL}, {@code UNIX_LINES}, {@code LITERAL})
   * @param properties resolver for Unicode properties
   * @return root of the AST
   * @throws PatternSyntaxException if the pattern is malformed
   * @throws UnsupportedPatternSyntaxException if the pattern uses lookaround,
   *   backreferences, possessive quantifiers or the {@code u} and {@code U} flags
   */
  public static Regex parse(
    String pattern,
    int flags,
    PropertyResolver properties
  ) throws PatternSyntaxException {
    final var parser = new RegexParser(pattern, flags, properties);
    if ((flags & Pattern.UNICODE_CASE) != 0) {
      throw parser.unsupported("Unicode case flags `u`");
    } else if ((flags & Pattern.UNICODE_CHARACTER_CLASS) != 0) {
      throw parser.unsupported("Unicode character class flags `U`");
    } else if ((flags & Pattern.CANON_EQ) != 0) {
      throw parser.unsupported("Canonical equivalence flags");
    }
    if ((flags & Pattern.LITERAL) != 0) {
      return parser.literal(pattern);
    }
    final Regex regex = parser.alternation();
    if (!parser.atEnd()) {
      throw parser.error("Unmatched closing parenthesis");
    }
    return regex;
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, pattern, cursor);
  }

  private PatternSyntaxException error(String message, int index) {
    return new PatternSyntaxException(message, pattern, index);
  }

  private UnsupportedPatternSyntaxException unsupported(String featureCategory) {
    return new UnsupportedPatternSyntaxException(featureCategory, pattern, cursor);
  }

  private boolean hasFlag(int flag) {
    return (flags & flag) != 0;
  }

  /**
   * In comments mode, move past whitespace and {@code #} comments.
   */
  private void skipIgnorable() {
    if (!hasFlag(Pattern.COMMENTS)) {
      return;
    }
    while (cursor < pattern.length()) {
      final int c = pattern.codePointAt(cursor);
      if (c == '#') {
        while (cursor < pattern.length() && pattern.charAt(cursor) != '\n' && pattern.charAt(cursor) != '\r') {
          cursor++;
        }
      } else if (Character.isWhitespace(c)) {
        cursor += Character.charCount(c);
      } else {
        return;
      }
    }
  }

  /**
   * Next significant character, without consuming it.
   *
   * @return next character, or {@code -1} at the end of the pattern
   */
  private int peek() {
    skipIgnorable();
    return cursor < pattern.length() ? pattern.charAt(cursor) : -1;
  }

  private boolean atEnd() {
    return peek() == -1;
  }

  /**
   * Consume the next significant character if it is the expected one.
   */
  private boolean accept(char expected) {
    if (peek() == expected) {
      cursor++;
      return true;
    }
    return false;
  }

  private Regex alternation() {
    final var branches = new ArrayList<Regex>();
    branches.add(sequence());
    while (accept('|')) {
      branches.add(sequence());
    }
    return branches.size() == 1 ? branches.get(0) : new Regex.Alternation(branches);
  }

  /**
   * Concatenation of repeated atoms, up to the next {@code |} or {@code )}.
   */
  private Regex sequence() {
    final var items = new ArrayList<Regex>();
    int c;
    while ((c = peek()) != -1 && c != '|' && c != ')') {
      addSequenceItem(items, repeated());
    }
    return sequenceOf(items);
  }

  private static void addSequenceItem(ArrayList<Regex> items, Regex item) {
    if (item instanceof Regex.Concat concat) {
      items.addAll(concat.items());
    } else if (!(item instanceof Regex.Empty)) {
      items.add(item);
    }
  }

  private static Regex sequenceOf(ArrayList<Regex> items) {
    if (items.isEmpty()) {
      return new Regex.Empty();
    }
    return items.size() == 1 ? items.get(0) : new Regex.Concat(items);
  }

  /**
   * An atom followed by any number of quantifiers.
   */
  private Regex repeated() {
    Regex repeated = atom();

    while (true) {
      final int min;
      final OptionalInt max;
      switch (peek()) {
        case '*':
          cursor++;
          min = 0;
          max = OptionalInt.empty();
          break;

        case '+':
          cursor++;
          min = 1;
          max = OptionalInt.empty();
          break;

        case '?':
          cursor++;
          min = 0;
          max = OptionalInt.of(1);
          break;

        case '{':
          final int openBrace = cursor;
          cursor++;
          if (!isAsciiDigit(peek())) {
            throw error("Expected a repetition count");
          }
          min = decimal();
          if (accept(',')) {
            max = peek() == '}' ? OptionalInt.empty() : OptionalInt.of(decimal());
          } else {
            max = OptionalInt.of(min);
          }
          if (!accept('}')) {
            throw error("Expected `}` to close the repetition opened at " + openBrace);
          }
          if (max.isPresent() && max.getAsInt() < min) {
            throw error("Repetition maximum is smaller than its minimum", openBrace);
          }
          break;

        default:
          return repeated;
      }

      // A `?` suffix makes the quantifier lazy
      final boolean greedy = !accept('?');
      if (greedy && peek() == '+') {
        throw unsupported("Possessive quantifiers");
      }
      repeated = new Regex.Repetition(repeated, min, max, greedy);
    }
  }

  private Regex atom() {
    final int c = peek();
    switch (c) {
      case '(':
        return group();

      case '^':
        cursor++;
        return new Regex.Anchor(Boundary.BEGINNING_OF_LINE);

      case '$':
        cursor++;
        return new Regex.Anchor(Boundary.END_OF_LINE);

      case '*':
      case '+':
      case '?':
        throw error("Dangling meta character `" + (char) c + "`");

      case '\\':
        // Read raw: `\ ` and `\#` are escapes even in comments mode
        if (cursor + 1 < pattern.length()) {
          final char escaped = pattern.charAt(cursor + 1);
          final Boundary boundary = Boundary.CHARACTERS.get(escaped);
          if (boundary != null) {
            cursor += 2;
            return new Regex.Anchor(boundary);
          }
          if (escaped == 'Q') {
            cursor += 2;
            return literal(quotedString());
          }
        }
        return characterClass(classItem(false, false));

      default:
        return characterClass(classItem(false, false));
    }
  }

  /**
   * Literal code points or a set of code points, outside of brackets.
   */
  private Regex characterClass(ClassItem item) {
    return characterClass(item.isSingle() ? codePointSet(item.codePoint(), item.codePoint()) : item.codePoints());
  }

  private static Regex characterClass(IntRangeSet codePoints) {
    final var ranges = codePoints.ranges();
    if (ranges.size() == 1 && ranges.get(0).lowerBound() == ranges.get(0).upperBound()) {
      return new Regex.Literal(ranges.get(0).lowerBound());
    }
    return new Regex.CodePointClass(codePoints);
  }

  /**
   * Sequence matching a string literally (modulo case-insensitivity).
   */
  private Regex literal(String text) {
    final var items = new ArrayList<Regex>();
    text.codePoints().forEach(codePoint -> items.add(characterClass(codePointSet(codePoint, codePoint))));
    return sequenceOf(items);
  }

  private Regex group() {
    final int openParen = cursor;
    cursor++;

    final int outerFlags = flags;
    boolean capturing = true;

    if (accept('?')) {
      switch (peek()) {
        case -1:
          // Reported below as an unclosed group
          break;

        case '=':
        case '!':
        case '<':
        case '>':
          throw unsupported("Lookaround groups");

        default:
          capturing = false;
          int groupFlags = flags | inlineFlags();
          if (accept('-')) {
            groupFlags &= ~inlineFlags();
          }
          if (accept(')')) {
            // `(?i)` applies to the rest of the enclosing group
            flags = groupFlags;
            return new Regex.Empty();
          }
          if (!accept(':') && !atEnd()) {
            throw error("Expected `:` or `)` after the flags of the group opened at " + openParen);
          }
          flags = groupFlags;
      }
    }

    final OptionalInt captureIndex = capturing
      ? OptionalInt.of(capturingGroups++)
      : OptionalInt.empty();
    final Regex body = alternation();
    if (!accept(')')) {
      throw error("Unclosed group (expected `)` for the group opened at " + openParen + ")");
    }
    flags = outerFlags;
    return new Regex.Group(body, captureIndex);
  }

  /**
   * Parse what can appear at one position of a class: a code point, an
   * escape, a nested bracket class, or (outside brackets) {@code .}.
   *
   * @param insideClass whether this is inside a bracket class
   * @param endOfRange whether this is the upper end of a range like {@code a-z}
   */
  private ClassItem classItem(boolean insideClass, boolean endOfRange) {
    switch (peek()) {
      case -1:
        throw error("Unexpected end of pattern");

      case '.':
        cursor++;
        return insideClass ? ClassItem.single('.') : ClassItem.set(BuiltinClass.dot(flags));

      case '[':
        if (endOfRange) {
          throw error("Cannot end class range with `[`");
        }
        return ClassItem.set(bracketClass());

      case '\\':
        cursor++;
        return escape(insideClass, endOfRange);

      default:
        final int codePoint = pattern.codePointAt(cursor);
        cursor += Character.charCount(codePoint);
        return ClassItem.single(codePoint);
    }
  }

  private IntRangeSet bracketClass() {
    final int openBracket = cursor;
    cursor++;

    final boolean negated = accept('^');
    if (atEnd()) {
      throw error("Unclosed character class (opened at " + openBracket + ")");
    }
    final IntRangeSet codePoints = classIntersection();
    if (!accept(']')) {
      throw error("Unclosed character class (opened at " + openBracket + ")");
    }
    return negated ? codePoints.complement(CodePoints.UNICODE_RANGE) : codePoints;
  }

  private boolean atIntersection() {
    return peek() == '&' && cursor + 1 < pattern.length() && pattern.charAt(cursor + 1) == '&';
  }

  private IntRangeSet classIntersection() {
    IntRangeSet codePoints = classUnion();
    while (atIntersection()) {
      cursor += 2;
      codePoints = codePoints.intersection(classUnion());
    }
    return codePoints;
  }

  /**
   * Union of class ranges, up to {@code ]} or {@code &&}.
   *
   * <p>The first range is always parsed, so {@code []a]} includes {@code ]}.
   */
  private IntRangeSet classUnion() {
    IntRangeSet codePoints = classRange();
    int c;
    while ((c = peek()) != -1 && c != ']' && !atIntersection()) {
      codePoints = codePoints.union(classRange());
    }
    return codePoints;
  }

  private IntRangeSet classRange() {
    final ClassItem first = classItem(true, false);
    if (!first.isSingle()) {
      return first.codePoints();
    }
    final int low = first.codePoint();

    if (peek() == '-' && cursor + 1 < pattern.length()) {
      final int dash = cursor;
      final char afterDash = pattern.charAt(cursor + 1);
      if (afterDash == '[') {
        throw error("Invalid character range, missing right hand side");
      }
      // Before `]` or `&&`, the dash is literal
      final boolean beforeIntersection = afterDash == '&'
        && cursor + 2 < pattern.length()
        && pattern.charAt(cursor + 2) == '&';
      if (afterDash != ']' && !beforeIntersection) {
        cursor++;
        final ClassItem last = classItem(true, true);
        if (!last.isSingle()) {
          throw error("Cannot end class range with a set of characters", dash);
        }
        if (last.codePoint() < low) {
          throw error("Illegal character range", dash);
        }
        return codePointSet(low, last.codePoint());
      }
    }
    return codePointSet(low, low);
  }

  private IntRangeSet codePointSet(int low, int high) {
    final var codePoints = IntRangeSet.of(IntRange.between(low, high));
    return hasFlag(Pattern.CASE_INSENSITIVE)
      ? CodePoints.asciiCaseInsensitive(codePoints)
      : codePoints;
  }

  /**
   * Parse the escape following a backslash.
   */
  private ClassItem escape(boolean insideClass, boolean endOfRange) {
    if (cursor >= pattern.length()) {
      throw error("Pattern may not end with backslash");
    }
    final char c = pattern.charAt(cursor++);

    switch (c) {
      case 'd':
      case 'D':
      case 's':
      case 'S':
      case 'w':
      case 'W':
        if (endOfRange) {
          throw error("Cannot end class range with a character class");
        }
        return ClassItem.set(BuiltinClass.forEscape(c).codePoints());

      case 'a':
        return ClassItem.single(0x07);
      case 'e':
        return ClassItem.single(0x1B);
      case 'f':
        return ClassItem.single('\f');
      case 't':
        return ClassItem.single('\t');
      case 'n':
        return ClassItem.single('\n');
      case 'r':
        return ClassItem.single('\r');

      case 'c':
        return ClassItem.single(controlEscape());

      case 'x':
        return ClassItem.single(hexEscape());

      case 'u':
        return ClassItem.single(hexDigits(4));

      case '0':
        return ClassItem.single(octalEscape());

      case 'N':
        return ClassItem.single(namedCharacter());

      case 'p':
      case 'P':
        if (endOfRange) {
          throw error("Cannot end class range with a property class");
        }
        return ClassItem.set(property(c == 'P'));

      case 'Q':
        final String quoted = quotedString();
        final int count = quoted.codePointCount(0, quoted.length());
        if (count == 0) {
          throw unsupported("Empty literal escapes in character classes");
        } else if (count == 1) {
          return ClassItem.single(quoted.codePointAt(0));
        }
        IntRangeSet codePoints = IntRangeSet.EMPTY;
        for (int codePoint : quoted.codePoints().toArray()) {
          codePoints = codePoints.union(codePointSet(codePoint, codePoint));
        }
        return ClassItem.set(codePoints);

      case '1':
      case '2':
      case '3':
      case '4':
      case '5':
      case '6':
      case '7':
      case '8':
      case '9':
      case 'k':
        throw unsupported("Backreferences");

      case 'b':
      case 'B':
      case 'A':
      case 'Z':
      case 'z':
        // Outside of brackets, these were already parsed as anchors
        throw error("Cannot use boundary escapes in character class");

      default:
        if (c < 128 && Character.isLetter(c)) {
          throw error("Unknown escape sequence: \\" + c);
        }
        // Any other escaped character stands for itself
        cursor--;
        final int codePoint = pattern.codePointAt(cursor);
        cursor += Character.charCount(codePoint);
        return ClassItem.single(codePoint);
    }
  }

  /**
   * {@code \cX}: the control character {@code X ^ 64}.
   */
  private int controlEscape() {
    if (cursor >= pattern.length()) {
      throw error("Expected control character escape but got end of pattern");
    }
    final char control = pattern.charAt(cursor);
    if (control < 32 || control > 127) {
      throw error("Expected control escape letter in printable ASCII range");
    }
    cursor++;
    return control ^ 64;
  }

  /**
   * {@code \xhh} or {@code \x{h...h}}.
   */
  private int hexEscape() {
    if (cursor >= pattern.length() || pattern.charAt(cursor) != '{') {
      return hexDigits(2);
    }
    final int close = pattern.indexOf('}', cursor);
    if (close < 0) {
      throw error("Expected `}` to close hexadecimal escape");
    }
    cursor++;
    if (cursor == close) {
      throw error("Expected a hexadecimal digit");
    }
    int codePoint = 0;
    while (cursor < close) {
      codePoint = (codePoint << 4) | hexDigit();
      if (codePoint > Character.MAX_CODE_POINT) {
        throw error("Hexadecimal escape overflowed max code point");
      }
    }
    cursor++;
    return codePoint;
  }

  private int hexDigits(int count) {
    int value = 0;
    for (int i = 0; i < count; i++) {
      value = (value << 4) | hexDigit();
    }
    return value;
  }

  // Whitespace is significant inside escapes
  private int hexDigit() {
    final int digit = cursor < pattern.length() ? asciiDigit(pattern.charAt(cursor), 16) : -1;
    if (digit < 0) {
      throw error("Expected a hexadecimal digit");
    }
    cursor++;
    return digit;
  }

  /**
   * {@code \0o}, {@code \0oo}, or {@code \0ooo}.
   */
  private int octalEscape() {
    int value = cursor < pattern.length() ? asciiDigit(pattern.charAt(cursor), 8) : -1;
    if (value < 0) {
      throw error("Expected an octal digit");
    }
    cursor++;
    for (int i = 0; i < 2 && cursor < pattern.length(); i++) {
      final int digit = asciiDigit(pattern.charAt(cursor), 8);
      if (digit < 0) {
        break;
      }
      value = (value << 3) | digit;
      cursor++;
    }
    return value;
  }

  /**
   * {@code \N{name}}, a code point by its Unicode name.
   */
  private int namedCharacter() {
    if (cursor >= pattern.length() || pattern.charAt(cursor) != '{') {
      throw error("Expected `{` after \\N");
    }
    final int close = pattern.indexOf('}', cursor);
    if (close < 0) {
      throw error("Expected `}` to close character name");
    }
    final String name = pattern.substring(cursor + 1, close);
    try {
      final int codePoint = Character.codePointOf(name);
      cursor = close + 1;
      return codePoint;
    } catch (IllegalArgumentException err) {
      throw error("Unknown character name: " + name);
    }
  }

  /**
   * {@code \p{...}} or {@code \pX}, after the {@code p} or {@code P}.
   */
  private IntRangeSet property(boolean negated) {
    if (cursor >= pattern.length()) {
      throw error("Expected property name but got end of pattern");
    }
    final int nameStart;
    final String name;
    if (pattern.charAt(cursor) == '{') {
      final int close = pattern.indexOf('}', cursor);
      if (close < 0) {
        throw error("Expected `}` to close property name");
      }
      nameStart = cursor + 1;
      name = pattern.substring(nameStart, close);
      cursor = close + 1;
    } else {
      nameStart = cursor;
      name = pattern.substring(cursor, cursor + 1);
      cursor++;
    }

    final IntRangeSet codePoints = name.indexOf('=') < 0
      ? namedProperty(name, nameStart)
      : keyedProperty(name, nameStart);
    return negated ? codePoints.complement(CodePoints.UNICODE_RANGE) : codePoints;
  }

  /**
   * {@code key=value}: resolver properties, then blocks, scripts, and general categories.
   */
  private IntRangeSet keyedProperty(String name, int nameStart) {
    final int equals = name.indexOf('=');
    final String key = name.substring(0, equals).trim();
    final String value = name.substring(equals + 1).trim();
    final int valueStart = nameStart + equals + 1;

    final Optional<IntRangeSet> resolved;
    try {
      resolved = properties.enumerated(key, value);
    } catch (IllegalArgumentException err) {
      throw error(err.getMessage(), valueStart);
    }
    if (resolved.isPresent()) {
      return resolved.get();
    }

    switch (CodePoints.looseName(key)) {
      case "blk":
      case "block":
        return block(value, valueStart);

      case "sc":
      case "script":
        return script(value)
          .orElseThrow(() -> error("Unknown unicode script: " + value, valueStart));

      case "gc":
      case "generalcategory":
        return GeneralCategory
          .forName(value)
          .orElseThrow(() -> error("Unknown general category: " + value, valueStart))
          .codePoints();

      default:
        throw error("Unknown property class key: " + key, nameStart);
    }
  }

  /**
   * Bare name: resolver binary properties, then general categories,
   * {@code InBlock}, and {@code IsScript} or {@code Script}.
   */
  private IntRangeSet namedProperty(String name, int nameStart) {
    final Optional<IntRangeSet> binary = properties.binary(name);
    if (binary.isPresent()) {
      return binary.get();
    }

    final Optional<GeneralCategory> category = GeneralCategory.forName(name);
    if (category.isPresent()) {
      return category.get().codePoints();
    }

    if (name.startsWith("In")) {
      return block(name.substring(2), nameStart);
    }
    return script(name.startsWith("Is") ? name.substring(2) : name)
      .orElseThrow(() -> error("Unknown property " + name, nameStart));
  }

  private IntRangeSet block(String name, int nameStart) {
    try {
      return CodePoints.blockCodePoints(Character.UnicodeBlock.forName(name));
    } catch (IllegalArgumentException err) {
      throw error("Unknown unicode block: " + name, nameStart);
    }
  }

  private static Optional<IntRangeSet> script(String name) {
    try {
      return Optional.of(CodePoints.scriptCodePoints(Character.UnicodeScript.forName(name)));
    } catch (IllegalArgumentException err) {
      return Optional.empty();
    }
  }

  /**
   * Text up to the next {@code \E}, or to the end of the pattern.
   *
   * <p>Comments mode does not apply inside.
   */
  private String quotedString() {
    final int end = pattern.indexOf("\\E", cursor);
    final String quoted;
    if (end < 0) {
      quoted = pattern.substring(cursor);
      cursor = pattern.length();
    } else {
      quoted = pattern.substring(cursor, end);
      cursor = end + 2;
    }
    return quoted;
  }

  private static boolean isAsciiDigit(int c) {
    return '0' <= c && c <= '9';
  }

  /**
   * Value of an ASCII digit in some radix, or {@code -1}.
   *
   * <p>Unlike {@link Character#digit(char, int)}, this rejects digits from
   * other scripts and fullwidth forms.
   */
  private static int asciiDigit(char c, int radix) {
    return c < 0x80 ? Character.digit(c, radix) : -1;
  }

  private int decimal() {
    long value = 0;
    int c;
    while (isAsciiDigit(c = peek())) {
      value = 10 * value + (c - '0');
      if (value > Integer.MAX_VALUE) {
        throw error("Decimal integer overflowed");
      }
      cursor++;
    }
    return (int) value;
  }

  /**
   * Flags in an inline group like {@code (?ix)} or {@code (?i-x:...)}.
   */
  private int inlineFlags() {
    int parsed = 0;
    while (true) {
      switch (peek()) {
        case 'i':
          parsed |= Pattern.CASE_INSENSITIVE;
          break;
        case 'm':
          parsed |= Pattern.MULTILINE;
          break;
        case 's':
          parsed |= Pattern.DOTALL;
          break;
        case 'd':
          parsed |= Pattern.UNIX_LINES;
          break;
        case 'x':
          parsed |= Pattern.COMMENTS;
          break;
        case 'u':
          throw unsupported("Unicode case flags `u`");
        case 'U':
          throw unsupported("Unicode character class flags `U`");
        default:
          return parsed;
      }
      cursor++;
    }
  }
}
