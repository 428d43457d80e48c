package bytedfa.nfa;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import bytedfa.ast.Regex;
import bytedfa.parser.UnsupportedPatternSyntaxException;
import java.util.List;
import org.junit.Test;

public class NfaCompilerTest {

  private static NfaState.Union union(boolean reverse, Integer... alternates) {
    return new NfaState.Union(List.of(alternates), reverse);
  }

  @Test
  public void literal() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a"));
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range('a', 'a', 2),
      new NfaState.Match()
    )));
  }

  @Test
  public void multiByteLiteral() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("\\u00e9"));
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range(0xC3, 0xC3, 2),
      new NfaState.Range(0xA9, 0xA9, 3),
      new NfaState.Match()
    )));
  }

  @Test
  public void reverseConcatenationStartsFromTheEnd() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("ab"), true);
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range('b', 'b', 2),
      new NfaState.Range('a', 'a', 3),
      new NfaState.Match()
    )));
  }

  @Test
  public void reverseLiteralReadsUtf8Backwards() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("\\u00e9"), true);
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range(0xA9, 0xA9, 2),
      new NfaState.Range(0xC3, 0xC3, 3),
      new NfaState.Match()
    )));
  }

  @Test
  public void reverseClassReadsUtf8Backwards() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("[\\u0080-\\u07ff]"), true);
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range(0x80, 0xBF, 2),
      new NfaState.Range(0xC2, 0xDF, 3),
      new NfaState.Match()
    )));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void unionAlternatesAreReadOnly() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a|b"));
    ((NfaState.Union) nfa.state(1)).alternates().add(9);
  }

  @Test
  public void alternationRejoinsAtSharedExit() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a|b"));
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      union(false, 3, 4),
      new NfaState.Empty(5),
      new NfaState.Range('a', 'a', 2),
      new NfaState.Range('b', 'b', 2),
      new NfaState.Match()
    )));
  }

  @Test
  public void lazyStarPrefersExit() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a*?"));
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      union(true, 3, 2),
      new NfaState.Range('a', 'a', 1),
      new NfaState.Match()
    )));
  }

  @Test
  public void plusReusesBodyAsPrefix() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a+"));
    assertThat(nfa.states(), is(List.<NfaState>of(
      new NfaState.Empty(1),
      new NfaState.Range('a', 'a', 2),
      union(false, 1, 3),
      new NfaState.Match()
    )));
  }

  @Test
  public void boundedRepetitionIsUnrolled() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("a{2,3}"));
    final long ranges = nfa.states().stream().filter(s -> s instanceof NfaState.Range).count();
    assertThat(ranges, is(3L));
  }

  @Test
  public void surrogateMatchesNothing() {
    final Nfa nfa = NfaCompiler.compile(new Regex.Literal(0xD800));
    assertThat(nfa.states().stream().anyMatch(s -> s instanceof NfaState.Range), is(false));
    assertThat(nfa.state(1), is(union(false)));
  }

  @Test
  public void exactlyOneMatchState() {
    final Nfa nfa = NfaCompiler.compile(Regex.parse("(?:ab|[c-e]f*)+x?"));
    final long matches = nfa.states().stream().filter(s -> s instanceof NfaState.Match).count();
    assertThat(matches, is(1L));
    assertThat(nfa.state(Nfa.START) instanceof NfaState.Empty, is(true));
  }

  @Test(expected = UnsupportedPatternSyntaxException.class)
  public void anchorsAreRejected() {
    NfaCompiler.compile(Regex.parse("^a"));
  }

  @Test
  public void wordBoundariesAreRejected() {
    try {
      NfaCompiler.compile(Regex.parse("a\\b"));
      fail("expected an exception");
    } catch (UnsupportedPatternSyntaxException e) {
      assertThat(e.unsupportedFeatureCategory, is("Word boundary assertions"));
    }
  }
}
