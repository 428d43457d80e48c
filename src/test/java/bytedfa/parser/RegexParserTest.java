package bytedfa.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import bytedfa.ast.Regex;
import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.junit.Test;

public class RegexParserTest {

  private static Regex lit(char c) {
    return new Regex.Literal(c);
  }

  private static IntRangeSet codePoints(Regex regex) {
    assertThat(regex, instanceOf(Regex.CodePointClass.class));
    return ((Regex.CodePointClass) regex).codePoints();
  }

  @Test
  public void concatenationIsFlattened() {
    assertThat(
      Regex.parse("abc"),
      is(new Regex.Concat(List.of(lit('a'), lit('b'), lit('c'))))
    );
  }

  @Test
  public void alternationIsFlattened() {
    assertThat(
      Regex.parse("a|zz|z"),
      is(new Regex.Alternation(List.of(
        lit('a'),
        new Regex.Concat(List.of(lit('z'), lit('z'))),
        lit('z')
      )))
    );
  }

  @Test
  public void quantifiers() {
    assertThat(
      Regex.parse("a*"),
      is(new Regex.Repetition(lit('a'), 0, OptionalInt.empty(), true))
    );
    assertThat(
      Regex.parse("a+?"),
      is(new Regex.Repetition(lit('a'), 1, OptionalInt.empty(), false))
    );
    assertThat(
      Regex.parse("a{2,5}"),
      is(new Regex.Repetition(lit('a'), 2, OptionalInt.of(5), true))
    );
    assertThat(
      Regex.parse("a{3}"),
      is(new Regex.Repetition(lit('a'), 3, OptionalInt.of(3), true))
    );
  }

  @Test
  public void groups() {
    assertThat(
      Regex.parse("(a)(?:b)"),
      is(new Regex.Concat(List.of(
        new Regex.Group(lit('a'), OptionalInt.of(0)),
        new Regex.Group(lit('b'), OptionalInt.empty())
      )))
    );
  }

  @Test
  public void bracketClasses() {
    assertThat(
      codePoints(Regex.parse("[a-cx]")),
      is(IntRangeSet.of(IntRange.between('a', 'c'), IntRange.single('x')))
    );
    assertThat(
      codePoints(Regex.parse("[a-z&&[^m-z]]")),
      is(IntRangeSet.of(IntRange.between('a', 'l')))
    );
    assertThat(
      codePoints(Regex.parse("[^\\x00-\\x{10FFFF}a]")),
      is(IntRangeSet.EMPTY)
    );
  }

  @Test
  public void escapes() {
    assertThat(Regex.parse("\\t"), is(lit('\t')));
    assertThat(Regex.parse("\\x41"), is(lit('A')));
    assertThat(Regex.parse("\\u00e9"), is(new Regex.Literal(0xE9)));
    assertThat(Regex.parse("\\x{1F600}"), is(new Regex.Literal(0x1F600)));
    assertThat(
      Regex.parse("\\Q*+\\E"),
      is(new Regex.Concat(List.of(lit('*'), lit('+'))))
    );
  }

  @Test
  public void commentsMode() {
    assertThat(
      Regex.parse("(?x) a  b # trailing comment\n c"),
      is(new Regex.Concat(List.of(lit('a'), lit('b'), lit('c'))))
    );
  }

  @Test
  public void asciiCaseInsensitive() {
    assertThat(
      codePoints(Regex.parse("(?i)a")),
      is(IntRangeSet.of(IntRange.single('A'), IntRange.single('a')))
    );
  }

  @Test
  public void builtinClasses() {
    final IntRangeSet digits = codePoints(Regex.parse("\\d"));
    assertThat(digits.contains('0'), is(true));
    assertThat(digits.contains('a'), is(false));

    final IntRangeSet dot = codePoints(Regex.parse("."));
    assertThat(dot.contains('a'), is(true));
    assertThat(dot.contains('\n'), is(false));
  }

  @Test
  public void generalCategoryAndScript() {
    final IntRangeSet upper = codePoints(Regex.parse("\\p{Lu}"));
    assertThat(upper.contains('A'), is(true));
    assertThat(upper.contains('a'), is(false));

    final IntRangeSet greek = codePoints(Regex.parse("\\p{IsGreek}"));
    assertThat(greek.contains(0x3B1), is(true));
    assertThat(greek.contains('a'), is(false));
  }

  @Test
  public void resolvedProperties() {
    final IntRangeSet letters = IntRangeSet.of(IntRange.between('x', 'z'));
    final PropertyResolver resolver = new PropertyResolver() {
      @Override
      public Optional<IntRangeSet> enumerated(String property, String value) {
        if (!property.equals("demo")) {
          return Optional.empty();
        }
        if (!value.equals("xyz")) {
          throw new IllegalArgumentException("Unknown value " + value);
        }
        return Optional.of(letters);
      }

      @Override
      public Optional<IntRangeSet> binary(String property) {
        return property.equals("Xyz") ? Optional.of(letters) : Optional.empty();
      }
    };

    assertThat(codePoints(Regex.parse("\\p{demo=xyz}", 0, resolver)), is(letters));
    assertThat(codePoints(Regex.parse("\\p{Xyz}", 0, resolver)), is(letters));
    assertThat(
      codePoints(Regex.parse("[\\P{Xyz}&&[a-z]]", 0, resolver)),
      is(IntRangeSet.of(IntRange.between('a', 'w')))
    );
  }

  @Test(expected = PatternSyntaxException.class)
  public void unknownPropertyValue() {
    final PropertyResolver resolver = new PropertyResolver() {
      @Override
      public Optional<IntRangeSet> enumerated(String property, String value) {
        throw new IllegalArgumentException("Unknown value " + value);
      }

      @Override
      public Optional<IntRangeSet> binary(String property) {
        return Optional.empty();
      }
    };
    Regex.parse("\\p{gcb=Nope}", 0, resolver);
  }

  @Test(expected = PatternSyntaxException.class)
  public void unknownPropertyKey() {
    Regex.parse("\\p{gcb=LF}");
  }

  @Test
  public void anchorsParse() {
    assertThat(
      Regex.parse("^a"),
      is(new Regex.Concat(List.of(new Regex.Anchor(Boundary.BEGINNING_OF_LINE), lit('a'))))
    );
  }

  @Test(expected = UnsupportedPatternSyntaxException.class)
  public void lookaroundIsUnsupported() {
    Regex.parse("(?=a)");
  }

  @Test(expected = UnsupportedPatternSyntaxException.class)
  public void backreferencesAreUnsupported() {
    Regex.parse("(a)\\1");
  }

  @Test(expected = PatternSyntaxException.class)
  public void unclosedGroup() {
    Regex.parse("(ab");
  }

  @Test(expected = PatternSyntaxException.class)
  public void danglingQuantifier() {
    Regex.parse("*a");
  }

  @Test(expected = PatternSyntaxException.class)
  public void invertedRepetition() {
    Regex.parse("a{3,2}");
  }

  @Test
  public void unicodeCaseFlagIsUnsupported() {
    try {
      Regex.parse("(?u)a");
      fail("expected an exception");
    } catch (UnsupportedPatternSyntaxException e) {
      assertThat(e.unsupportedFeatureCategory, is("Unicode case flags `u`"));
      assertThat(e.getIndex(), is(2));
    }
  }

  @Test
  public void unicodeCharacterClassFlagIsUnsupported() {
    try {
      Regex.parse("(?iU:a)");
      fail("expected an exception");
    } catch (UnsupportedPatternSyntaxException e) {
      assertThat(e.unsupportedFeatureCategory, is("Unicode character class flags `U`"));
    }
  }

  @Test(expected = UnsupportedPatternSyntaxException.class)
  public void unicodeCaseFlagArgumentIsUnsupported() {
    Regex.parse("a", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE, PropertyResolver.NONE);
  }

  @Test(expected = PatternSyntaxException.class)
  public void repetitionCountMustBeAsciiDigits() {
    Regex.parse("a{\u0663}");
  }

  @Test(expected = PatternSyntaxException.class)
  public void repetitionBoundMustBeAsciiDigits() {
    Regex.parse("a{1,\uff12}");
  }

  @Test(expected = PatternSyntaxException.class)
  public void hexEscapeMustBeAsciiDigits() {
    Regex.parse("\\x\u0663\u0663");
  }
}
