package bytedfa.conformance;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

import bytedfa.ByteMatcher;
import bytedfa.CompileOptions;
import bytedfa.DfaCompiler;
import bytedfa.Segmenter;
import bytedfa.dfa.Dfa;
import bytedfa.table.DfaTableWriter;
import bytedfa.table.SerializedDfa;
import bytedfa.table.StateIdWidth;
import bytedfa.table.TableLayout;
import bytedfa.table.TableOptions;
import bytedfa.ucd.UcdProperties;
import bytedfa.ucd.UcdTestData;
import java.io.IOException;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * Extended grapheme cluster segmentation checked against the UCD break tests.
 */
public class GraphemeClusterConformanceTest {

  static final String GRAPHEME_CLUSTER = String.join("\n",
    "(?x)",
    "(?:",
    "  \\p{gcb=CR}\\p{gcb=LF}",
    "  | [\\p{gcb=Control}\\p{gcb=CR}\\p{gcb=LF}]",
    "  | \\p{gcb=Prepend}*",
    "    (?:",
    "      (?:",
    "        (?: \\p{gcb=L}* (?:\\p{gcb=V}+|\\p{gcb=LV}\\p{gcb=V}*|\\p{gcb=LVT}) \\p{gcb=T}* )",
    "        | \\p{gcb=L}+",
    "        | \\p{gcb=T}+",
    "      )",
    "      | \\p{gcb=RI}\\p{gcb=RI}",
    "      | \\p{Extended_Pictographic}(?:\\p{gcb=Extend}*\\p{gcb=ZWJ}\\p{Extended_Pictographic})*",
    "      | [^\\p{gcb=Control}\\p{gcb=CR}\\p{gcb=LF}]",
    "    )",
    "    [\\p{gcb=Extend}\\p{gcb=ZWJ}\\p{gcb=SpacingMark}]*",
    ")"
  );

  private static Dfa dfa;
  private static List<BreakTestReader.BreakCase> cases;

  @BeforeClass
  public static void compile() throws IOException {
    final UcdProperties properties = UcdProperties.load(UcdTestData.directory());
    dfa = DfaCompiler.compile(GRAPHEME_CLUSTER, CompileOptions.DEFAULT.withProperties(properties));
    cases = BreakTestReader.read(UcdTestData.directory().resolve("GraphemeBreakTest.txt"));
  }

  private static void assertSegments(ByteMatcher matcher) {
    assertThat(cases.size(), greaterThan(500));
    final var segmenter = new Segmenter(matcher);
    final var failures = new ArrayList<String>();
    for (BreakTestReader.BreakCase breakCase : cases) {
      final List<Integer> actual = segmenter.boundaries(breakCase.input());
      if (!actual.equals(breakCase.boundaries())) {
        failures.add("line " + breakCase.line() + ": expected " + breakCase.boundaries() + " but got " + actual);
      }
    }
    assertThat(failures, is(empty()));
  }

  @Test
  public void inMemoryDfa() {
    assertSegments(dfa);
  }

  @Test
  public void serializedDfa() {
    final var options = new TableOptions(TableLayout.SPARSE, StateIdWidth.U16);
    assertSegments(SerializedDfa.fromBytes(DfaTableWriter.toBytes(dfa, options, ByteOrder.LITTLE_ENDIAN)));
  }

  /**
   * Every expected cluster, read backwards from its end, is matched whole by
   * the reverse DFA.
   */
  @Test
  public void reverseDfaMatchesEveryClusterFromItsEnd() throws IOException {
    final UcdProperties properties = UcdProperties.load(UcdTestData.directory());
    final Dfa reverse = DfaCompiler.compile(
      GRAPHEME_CLUSTER,
      CompileOptions.DEFAULT.withProperties(properties).withReverse(true)
    );
    final var failures = new ArrayList<String>();
    for (BreakTestReader.BreakCase breakCase : cases) {
      final List<Integer> boundaries = breakCase.boundaries();
      for (int i = boundaries.size() - 1; i > 0; i--) {
        final int start = boundaries.get(i - 1);
        final int end = boundaries.get(i);
        final int length = reverse.reverseMatchLength(breakCase.input(), start, end);
        if (length != end - start) {
          failures.add("line " + breakCase.line() + ": cluster " + start + ".." + end + " matched " + length);
        }
      }
    }
    assertThat(failures, is(empty()));
  }
}
