package bytedfa;

import bytedfa.ast.Regex;
import bytedfa.dfa.Dfa;
import bytedfa.dfa.DfaBuilder;
import bytedfa.dfa.Minimizer;
import bytedfa.nfa.Nfa;
import bytedfa.nfa.NfaCompiler;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline from pattern text to DFA: parse, build the Thompson NFA, run the
 * subset construction, and (optionally) minimize.
 */
public final class DfaCompiler {

  private static final Logger logger = LoggerFactory.getLogger(DfaCompiler.class);

  private DfaCompiler() { }

  public static Dfa compile(String pattern) throws PatternSyntaxException {
    return compile(pattern, CompileOptions.DEFAULT);
  }

  /**
   * Compile a pattern into a DFA.
   *
   * @param pattern regular expression
   * @param options flags, property data, minimization and direction
   * @return compiled DFA
   * @throws PatternSyntaxException if the pattern is malformed or uses
   *   unsupported features (anchors, lookaround, ...)
   */
  public static Dfa compile(String pattern, CompileOptions options) throws PatternSyntaxException {
    final Regex regex = Regex.parse(pattern, options.flags(), options.properties());
    return compile(regex, options);
  }

  /**
   * Compile an AST into a DFA.
   *
   * <p>A DFA that matches nothing is not minimized, since it has no matching
   * state to anchor the partition on.
   *
   * @param regex parsed pattern
   * @param options whether to minimize the DFA and whether it runs in reverse
   * @return compiled DFA
   */
  public static Dfa compile(Regex regex, CompileOptions options) throws PatternSyntaxException {
    final Nfa nfa = NfaCompiler.compile(regex, options.reverse());
    final Dfa dfa = DfaBuilder.build(nfa);
    if (options.minimize()) {
      if (dfa.matchCount() == 0) {
        logger.warn("Pattern matches nothing, skipping minimization: {}", regex);
      } else {
        Minimizer.minimize(dfa);
      }
    }
    logger.debug(
      "Compiled `{}` into a {}DFA with {} states",
      regex,
      options.reverse() ? "reverse " : "",
      dfa.stateCount()
    );
    return dfa;
  }
}
