package bytedfa.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import bytedfa.ByteMatcher;
import bytedfa.CompileOptions;
import bytedfa.DfaCompiler;
import bytedfa.dfa.Dfa;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import org.junit.Test;

public class CompiledDfaTest {

  private static final List<String> PATTERNS = List.of(
    "a",
    "abc|abd|ab",
    "[a-c]+x?|b{2,4}",
    "[\\x00-\\x7F]+",
    "[^a]",
    "[\\u0080-\\uFFFF]+|[\\x20-\\x2F\\x3A-\\x40]",
    "(?:a|b)*abb",
    "(?i)hello(?: world)?",
    "[\\x00-\\x05\\x10\\x12\\x7E-\\xFF]"
  );

  private static void assertAgrees(String pattern, Dfa dfa, ByteMatcher compiled, byte[] input) {
    for (int offset = 0; offset <= input.length; offset++) {
      assertThat(
        pattern + " at " + offset,
        compiled.matchLength(input, offset, input.length),
        is(dfa.matchLength(input, offset, input.length))
      );
    }
    for (int end = 0; end <= input.length; end++) {
      assertThat(
        pattern + " backwards from " + end,
        compiled.reverseMatchLength(input, 0, end),
        is(dfa.reverseMatchLength(input, 0, end))
      );
    }
  }

  @Test
  public void agreesWithDfaOnRandomInputs() {
    final var random = new Random(7);
    for (String pattern : PATTERNS) {
      for (CompileOptions options : List.of(
        CompileOptions.DEFAULT,
        CompileOptions.DEFAULT.withMinimize(false),
        CompileOptions.DEFAULT.withReverse(true)
      )) {
        final Dfa dfa = DfaCompiler.compile(pattern, options);
        final ByteMatcher compiled = CompiledDfa.compile(dfa);
        for (int i = 0; i < 200; i++) {
          final byte[] input = new byte[random.nextInt(12)];
          for (int j = 0; j < input.length; j++) {
            // Skew towards a small alphabet so that the matches are not all trivial
            input[j] = random.nextBoolean()
              ? (byte) "abcdxhelo w".charAt(random.nextInt(11))
              : (byte) random.nextInt(256);
          }
          assertAgrees(pattern, dfa, compiled, input);
        }
      }
    }
  }

  @Test
  public void agreesOnText() {
    final byte[] input = "hello world, HELLO WORLD: \u00e9t\u00e9 \u4e2d\u6587 abb aabb"
      .getBytes(StandardCharsets.UTF_8);
    for (String pattern : PATTERNS) {
      final Dfa dfa = DfaCompiler.compile(pattern);
      assertAgrees(pattern, dfa, CompiledDfa.compile(dfa), input);
    }
  }

  @Test
  public void longestMatch() {
    final ByteMatcher compiled = CompiledDfa.compile(DfaCompiler.compile("ab|abcde"));
    final byte[] input = "abcdx".getBytes(StandardCharsets.US_ASCII);
    assertThat(compiled.matchLength(input, 0, input.length), is(2));
    assertThat(compiled.matchLength(input, 0, 1), is(-1));
    assertThat(compiled.matchLength(input, 1, input.length), is(-1));
  }

  @Test
  public void reverseLongestMatch() {
    final Dfa dfa = DfaCompiler.compile("ab|xyab", CompileOptions.DEFAULT.withReverse(true));
    final ByteMatcher compiled = CompiledDfa.compile(dfa);
    final byte[] input = "zxyab".getBytes(StandardCharsets.US_ASCII);
    assertThat(compiled.reverseMatchLength(input, 0, input.length), is(4));
    assertThat(compiled.reverseMatchLength(input, 2, input.length), is(2));
    assertThat(compiled.reverseMatchLength(input, 0, 4), is(-1));
  }

  @Test
  public void emptyMatchAtStartIsNotReported() {
    final ByteMatcher compiled = CompiledDfa.compile(DfaCompiler.compile("a*"));
    final byte[] input = "aab".getBytes(StandardCharsets.US_ASCII);
    assertThat(compiled.matchLength(input, 0, input.length), is(2));
    assertThat(compiled.matchLength(input, 2, input.length), is(-1));
    assertThat(compiled.matchLength(input, 3, input.length), is(-1));
  }

  @Test
  public void matchesNothing() {
    final Dfa dfa = DfaCompiler.compile("[^\\x00-\\x{10FFFF}]");
    final ByteMatcher compiled = CompiledDfa.compile(dfa);
    final byte[] input = "abc".getBytes(StandardCharsets.US_ASCII);
    assertThat(compiled.matchLength(input, 0, input.length), is(-1));

    final Dfa surrogate = DfaCompiler.compile("\\uD800");
    assertThat(surrogate.start(), is(Dfa.DEAD));
    assertThat(CompiledDfa.compile(surrogate).matchLength(input, 0, input.length), is(-1));
  }

  @Test
  public void independentInstances() {
    final ByteMatcher digits = CompiledDfa.compile(DfaCompiler.compile("[0-9]+"));
    final ByteMatcher letters = CompiledDfa.compile(DfaCompiler.compile("[a-z]+"));
    final byte[] input = "123abc".getBytes(StandardCharsets.US_ASCII);
    assertThat(digits.matchLength(input, 0, input.length), is(3));
    assertThat(letters.matchLength(input, 0, input.length), is(-1));
    assertThat(letters.matchLength(input, 3, input.length), is(3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooLargeForOneMethod() {
    CompiledDfa.compile(DfaCompiler.compile("a{20000}", CompileOptions.DEFAULT.withMinimize(false)));
  }
}
