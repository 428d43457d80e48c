package bytedfa.dfa;

import static bytedfa.dfa.DfaBuilderTest.build;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import bytedfa.ast.Regex;
import bytedfa.nfa.NfaCompiler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Test;

public class MinimizerTest {

  private static final List<String> PATTERNS = List.of(
    "ac|bc",
    "a|zz|z",
    "(?:a|b)*abb",
    "[a-c]+x?|b{2,4}",
    "\\p{L}+",
    "[\\u0080-\\u07FF]|[\\u0800-\\uFFFF]{2}",
    "(?:\\r\\n|[\\x00-\\x1F])|[^\\x00-\\x1F]+"
  );

  /**
   * All byte strings up to some length over a small alphabet, plus random
   * strings mixing in multi-byte UTF-8.
   */
  private static List<byte[]> inputs() {
    final byte[] alphabet = { 'a', 'b', 'c', 'x', 'z', '\r', '\n', 0x01, (byte) 0xC3, (byte) 0xA9 };
    final var inputs = new ArrayList<byte[]>();
    inputs.add(new byte[0]);
    List<byte[]> previous = List.of(new byte[0]);
    for (int length = 1; length <= 3; length++) {
      final var next = new ArrayList<byte[]>();
      for (byte[] prefix : previous) {
        for (byte b : alphabet) {
          final byte[] extended = new byte[length];
          System.arraycopy(prefix, 0, extended, 0, prefix.length);
          extended[length - 1] = b;
          next.add(extended);
        }
      }
      inputs.addAll(next);
      previous = next;
    }

    final var random = new Random(42);
    for (int i = 0; i < 500; i++) {
      final var builder = new StringBuilder();
      final int length = random.nextInt(8);
      for (int j = 0; j < length; j++) {
        final int codePoint = random.nextBoolean()
          ? 'a' + random.nextInt(4)
          : 0x80 + random.nextInt(0x2000);
        builder.appendCodePoint(codePoint);
      }
      inputs.add(builder.toString().getBytes(StandardCharsets.UTF_8));
    }
    return inputs;
  }

  @Test
  public void preservesLanguage() {
    final List<byte[]> inputs = inputs();
    for (String pattern : PATTERNS) {
      final Dfa original = build(pattern);
      final Dfa minimized = build(pattern);
      Minimizer.minimize(minimized);

      for (byte[] input : inputs) {
        assertThat(
          pattern,
          minimized.matchLength(input, 0, input.length),
          is(original.matchLength(input, 0, input.length))
        );
      }
    }
  }

  @Test
  public void neverGrowsAndIsIdempotent() {
    for (String pattern : PATTERNS) {
      final Dfa original = build(pattern);
      final Dfa dfa = build(pattern);
      Minimizer.minimize(dfa);
      assertThat(pattern, dfa.stateCount(), lessThanOrEqualTo(original.stateCount()));

      final String once = dfa.toString();
      Minimizer.minimize(dfa);
      assertThat(pattern, dfa.toString(), is(once));
    }
  }

  @Test
  public void mergesEquivalentStates() {
    final Dfa dfa = build("ac|bc");
    Minimizer.minimize(dfa);
    assertThat(dfa.stateCount(), is(4));

    final Dfa star = build("(?:a|b)*abb");
    Minimizer.minimize(star);
    // The textbook minimal DFA has 4 states, plus the dead state
    assertThat(star.stateCount(), is(5));
  }

  @Test
  public void deadStateKeepsItsId() {
    final Dfa dfa = build("[a-c]+x?|b{2,4}");
    Minimizer.minimize(dfa);
    assertThat(dfa.isMatch(Dfa.DEAD), is(false));
    for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
      assertThat(dfa.next(Dfa.DEAD, b), is(Dfa.DEAD));
    }
  }

  @Test(expected = IllegalStateException.class)
  public void rejectsDfaWithoutMatchingStates() {
    Minimizer.minimize(DfaBuilder.build(NfaCompiler.compile(new Regex.Literal(0xD800))));
  }
}
