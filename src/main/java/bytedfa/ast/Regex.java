package bytedfa.ast;

import bytedfa.parser.Boundary;
import bytedfa.parser.PropertyResolver;
import bytedfa.parser.RegexParser;
import bytedfa.util.IntRangeSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Parsed regular expression.
 *
 * <p>Literals and classes are over Unicode code points unless they are
 * explicitly byte-level ({@link ByteLiteral}, {@link ByteClass}), in which
 * case they match raw bytes regardless of UTF-8 validity.
 */
public interface Regex {

  /**
   * Parse a pattern into an AST.
   *
   * @param pattern regular expression
   * @param flags bitmask of {@code java.util.regex.Pattern} flags
   * @param properties resolver for Unicode properties
   * @return root of the AST
   */
  static Regex parse(
    String pattern,
    int flags,
    PropertyResolver properties
  ) throws PatternSyntaxException {
    return RegexParser.parse(pattern, flags, properties);
  }

  static Regex parse(String pattern) throws PatternSyntaxException {
    return parse(pattern, 0, PropertyResolver.NONE);
  }

  /**
   * Matches only the empty string.
   */
  record Empty() implements Regex {
    @Override
    public String toString() {
      return "";
    }
  }

  /**
   * Matches the UTF-8 encoding of one code point.
   */
  record Literal(int codePoint) implements Regex {
    @Override
    public String toString() {
      return String.format("\\x{%X}", codePoint);
    }
  }

  /**
   * Matches one byte.
   */
  record ByteLiteral(int value) implements Regex {
    public ByteLiteral {
      if (value < 0 || value > 0xFF) {
        throw new IllegalArgumentException("Byte out of range: " + value);
      }
    }

    @Override
    public String toString() {
      return String.format("(?-u:\\x%02X)", value);
    }
  }

  /**
   * Matches the UTF-8 encoding of any code point in a set.
   */
  record CodePointClass(IntRangeSet codePoints) implements Regex {
    @Override
    public String toString() {
      return codePoints
        .ranges()
        .stream()
        .map(r -> r.lowerBound() == r.upperBound()
          ? String.format("\\x{%X}", r.lowerBound())
          : String.format("\\x{%X}-\\x{%X}", r.lowerBound(), r.upperBound()))
        .collect(Collectors.joining("", "[", "]"));
    }
  }

  /**
   * Matches any byte in a set.
   */
  record ByteClass(IntRangeSet bytes) implements Regex {
    public ByteClass {
      if (!bytes.isEmpty()) {
        final var ranges = bytes.ranges();
        if (ranges.get(0).lowerBound() < 0 || ranges.get(ranges.size() - 1).upperBound() > 0xFF) {
          throw new IllegalArgumentException("Byte class out of range: " + bytes);
        }
      }
    }

    @Override
    public String toString() {
      return bytes
        .ranges()
        .stream()
        .map(r -> r.lowerBound() == r.upperBound()
          ? String.format("\\x%02X", r.lowerBound())
          : String.format("\\x%02X-\\x%02X", r.lowerBound(), r.upperBound()))
        .collect(Collectors.joining("", "(?-u:[", "])"));
    }
  }

  record Concat(List<Regex> items) implements Regex {
    public Concat {
      items = List.copyOf(items);
    }

    @Override
    public String toString() {
      return items.stream().map(Regex::toString).collect(Collectors.joining());
    }
  }

  /**
   * Matches any of the branches.
   */
  record Alternation(List<Regex> branches) implements Regex {
    public Alternation {
      branches = List.copyOf(branches);
    }

    @Override
    public String toString() {
      return branches.stream().map(Regex::toString).collect(Collectors.joining("|", "(?:", ")"));
    }
  }

  /**
   * Matches the body between {@code min} and {@code max} (inclusive) times.
   *
   * @param body repeated expression
   * @param min minimum number of repetitions
   * @param max maximum number of repetitions, or unbounded if empty
   * @param greedy prefer more repetitions to fewer
   */
  record Repetition(Regex body, int min, OptionalInt max, boolean greedy) implements Regex {
    public Repetition {
      if (min < 0 || (max.isPresent() && max.getAsInt() < min)) {
        throw new IllegalArgumentException("Invalid repetition bounds {" + min + "," + max + "}");
      }
    }

    @Override
    public String toString() {
      final String bounds = "{" + min + (max.isPresent()
        ? (max.getAsInt() == min ? "" : "," + max.getAsInt())
        : ",") + "}";
      return "(?:" + body + ")" + bounds + (greedy ? "" : "?");
    }
  }

  /**
   * Parenthesized expression.
   *
   * @param body grouped expression
   * @param captureIndex capture index, if the group was capturing
   */
  record Group(Regex body, OptionalInt captureIndex) implements Regex {
    @Override
    public String toString() {
      return (captureIndex.isPresent() ? "(" : "(?:") + body + ")";
    }
  }

  /**
   * Zero-width assertion.
   */
  record Anchor(Boundary boundary) implements Regex {
    @Override
    public String toString() {
      switch (boundary) {
        case BEGINNING_OF_LINE:
          return "^";
        case END_OF_LINE:
          return "$";
        case WORD_BOUNDARY:
          return "\\b";
        case NON_WORD_BOUNDARY:
          return "\\B";
        case BEGINNING_OF_INPUT:
          return "\\A";
        case END_OF_INPUT_OR_TERMINATOR:
          return "\\Z";
        default:
          return "\\z";
      }
    }
  }
}
