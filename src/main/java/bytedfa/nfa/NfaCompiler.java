package bytedfa.nfa;

import bytedfa.ast.Regex;
import bytedfa.parser.UnsupportedPatternSyntaxException;
import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import bytedfa.util.Utf8Sequence;
import bytedfa.util.Utf8Sequences;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thompson construction of a byte-level NFA from a regex AST.
 *
 * <p>Every AST node compiles to a {@link ThompsonRef} fragment. Fragments are
 * joined by patching the exit of one to the entry of the next. Code point
 * literals and classes are expanded into the byte sequences of their UTF-8
 * encodings.
 *
 * <p>In reverse mode, the NFA matches the byte-wise reversal of every string
 * the pattern matches: concatenations and UTF-8 encodings are laid out back
 * to front. A DFA built from it recognizes a match by reading the input from
 * its end, which is how match starts and preceding boundaries are found.
 */
public final class NfaCompiler {

  private static final Logger logger = LoggerFactory.getLogger(NfaCompiler.class);

  private final Nfa nfa = new Nfa();
  private final String pattern;
  private final boolean reverse;
  private final byte[] utf8Buffer = new byte[Utf8Sequences.MAX_UTF8_BYTES];

  private NfaCompiler(String pattern, boolean reverse) {
    this.pattern = pattern;
    this.reverse = reverse;
  }

  public static Nfa compile(Regex regex) throws UnsupportedPatternSyntaxException {
    return compile(regex, false);
  }

  /**
   * Compile an AST into an NFA.
   *
   * <p>State {@code 0} of the output is the start state and exactly one state
   * is {@link NfaState.Match}.
   *
   * @param regex AST to compile
   * @param reverse whether to match the reversed byte strings of the pattern
   * @return compiled NFA
   * @throws UnsupportedPatternSyntaxException if the AST contains boundary assertions
   */
  public static Nfa compile(Regex regex, boolean reverse) throws UnsupportedPatternSyntaxException {
    final var compiler = new NfaCompiler(regex.toString(), reverse);
    final ThompsonRef compiled = compiler.compileRegex(regex);
    final int match = compiler.nfa.addMatch();
    compiler.nfa.patch(Nfa.START, compiled.start());
    compiler.nfa.patch(compiled.end(), match);
    logger.debug("Compiled {}NFA with {} states", reverse ? "reverse " : "", compiler.nfa.size());
    return compiler.nfa;
  }

  private ThompsonRef compileRegex(Regex regex) {
    if (regex instanceof Regex.Empty) {
      return empty();
    } else if (regex instanceof Regex.Literal literal) {
      return codePoint(literal.codePoint());
    } else if (regex instanceof Regex.ByteLiteral byteLiteral) {
      final int id = nfa.addRange(byteLiteral.value(), byteLiteral.value());
      return new ThompsonRef(id, id);
    } else if (regex instanceof Regex.CodePointClass cls) {
      return codePointClass(cls.codePoints());
    } else if (regex instanceof Regex.ByteClass cls) {
      return byteClass(cls.bytes());
    } else if (regex instanceof Regex.Concat concat) {
      return concatenation(concat.items());
    } else if (regex instanceof Regex.Alternation alternation) {
      final List<Regex> branches = alternation.branches();
      return alternation(branches.size(), i -> compileRegex(branches.get(i)));
    } else if (regex instanceof Regex.Repetition repetition) {
      return repetition(repetition);
    } else if (regex instanceof Regex.Group group) {
      return compileRegex(group.body());
    } else if (regex instanceof Regex.Anchor anchor) {
      throw new UnsupportedPatternSyntaxException(
        anchor.boundary().featureCategory,
        pattern,
        -1
      );
    } else {
      throw new IllegalArgumentException("Unknown regex node " + regex.getClass());
    }
  }

  private ThompsonRef empty() {
    final int id = nfa.addEmpty();
    return new ThompsonRef(id, id);
  }

  private ThompsonRef codePoint(int codePoint) {
    if (Utf8Sequences.isSurrogate(codePoint)) {
      // No encoding, so nothing can match
      return alternation(0, i -> empty());
    }
    final int length = Utf8Sequences.encode(codePoint, utf8Buffer);
    int start = -1;
    int end = -1;
    for (int i = 0; i < length; i++) {
      final int value = utf8Buffer[reverse ? length - 1 - i : i] & 0xFF;
      final int next = nfa.addRange(value, value);
      if (start < 0) {
        start = next;
      } else {
        nfa.patch(end, next);
      }
      end = next;
    }
    return new ThompsonRef(start, end);
  }

  private ThompsonRef byteSequence(Utf8Sequence sequence) {
    final List<IntRange> ranges = sequence.byteRanges();
    final int length = ranges.size();
    int start = -1;
    int end = -1;
    for (int i = 0; i < length; i++) {
      final IntRange range = ranges.get(reverse ? length - 1 - i : i);
      final int next = nfa.addRange(range.lowerBound(), range.upperBound());
      if (start < 0) {
        start = next;
      } else {
        nfa.patch(end, next);
      }
      end = next;
    }
    return new ThompsonRef(start, end);
  }

  private ThompsonRef codePointClass(IntRangeSet codePoints) {
    final var sequences = new ArrayList<Utf8Sequence>();
    for (IntRange range : codePoints.ranges()) {
      sequences.addAll(Utf8Sequences.of(range));
    }
    if (sequences.size() == 1) {
      return byteSequence(sequences.get(0));
    }
    return alternation(sequences.size(), i -> byteSequence(sequences.get(i)));
  }

  private ThompsonRef byteClass(IntRangeSet bytes) {
    final List<IntRange> ranges = bytes.ranges();
    if (ranges.size() == 1) {
      final int id = nfa.addRange(ranges.get(0).lowerBound(), ranges.get(0).upperBound());
      return new ThompsonRef(id, id);
    }
    return alternation(ranges.size(), i -> {
      final int id = nfa.addRange(ranges.get(i).lowerBound(), ranges.get(i).upperBound());
      return new ThompsonRef(id, id);
    });
  }

  private ThompsonRef concatenation(List<Regex> items) {
    if (items.isEmpty()) {
      return empty();
    }
    final int count = items.size();
    final ThompsonRef first = compileRegex(items.get(reverse ? count - 1 : 0));
    int end = first.end();
    for (int i = 1; i < count; i++) {
      final ThompsonRef next = compileRegex(items.get(reverse ? count - 1 - i : i));
      nfa.patch(end, next.start());
      end = next.end();
    }
    return new ThompsonRef(first.start(), end);
  }

  /**
   * One union branching to every alternative, with all alternatives rejoining
   * at a shared empty exit state.
   *
   * <p>With zero alternatives, the fragment matches nothing.
   *
   * @param count number of alternatives
   * @param branch compiles the {@code i}th alternative
   */
  private ThompsonRef alternation(int count, IntFunction<ThompsonRef> branch) {
    final int union = nfa.addUnion();
    final int end = nfa.addEmpty();
    for (int i = 0; i < count; i++) {
      final ThompsonRef compiled = branch.apply(i);
      nfa.patch(union, compiled.start());
      nfa.patch(compiled.end(), end);
    }
    return new ThompsonRef(union, end);
  }

  private ThompsonRef repetition(Regex.Repetition repetition) {
    final Regex body = repetition.body();
    final int min = repetition.min();
    final boolean greedy = repetition.greedy();

    if (repetition.max().isEmpty()) {
      return atLeast(body, min, greedy);
    }

    final int max = repetition.max().getAsInt();
    final ThompsonRef prefix = exactly(body, min);
    int end = prefix.end();
    for (int i = min; i < max; i++) {
      final ThompsonRef optional = zeroOrOne(body, greedy);
      nfa.patch(end, optional.start());
      end = optional.end();
    }
    return new ThompsonRef(prefix.start(), end);
  }

  private ThompsonRef exactly(Regex body, int count) {
    if (count == 0) {
      return empty();
    }
    final ThompsonRef first = compileRegex(body);
    int end = first.end();
    for (int i = 1; i < count; i++) {
      final ThompsonRef next = compileRegex(body);
      nfa.patch(end, next.start());
      end = next.end();
    }
    return new ThompsonRef(first.start(), end);
  }

  private ThompsonRef zeroOrOne(Regex body, boolean greedy) {
    final int union = greedy ? nfa.addUnion() : nfa.addReverseUnion();
    final ThompsonRef compiled = compileRegex(body);
    final int end = nfa.addEmpty();
    nfa.patch(union, compiled.start());
    nfa.patch(union, end);
    nfa.patch(compiled.end(), end);
    return new ThompsonRef(union, end);
  }

  /**
   * Unbounded repetition.
   *
   * <p>The exit is a union looping back to the body: patching the exit adds
   * the way out as the last alternate (or the first, if lazy).
   */
  private ThompsonRef atLeast(Regex body, int min, boolean greedy) {
    if (min == 0) {
      final int union = greedy ? nfa.addUnion() : nfa.addReverseUnion();
      final ThompsonRef compiled = compileRegex(body);
      nfa.patch(union, compiled.start());
      nfa.patch(compiled.end(), union);
      return new ThompsonRef(union, union);
    }

    final ThompsonRef prefix = (min > 1) ? exactly(body, min - 1) : null;
    final ThompsonRef last = compileRegex(body);
    final int union = greedy ? nfa.addUnion() : nfa.addReverseUnion();
    nfa.patch(last.end(), union);
    nfa.patch(union, last.start());
    if (prefix == null) {
      return new ThompsonRef(last.start(), union);
    }
    nfa.patch(prefix.end(), last.start());
    return new ThompsonRef(prefix.start(), union);
  }
}
