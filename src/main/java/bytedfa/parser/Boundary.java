package bytedfa.parser;

import java.util.Map;

/**
 * Zero-width boundary assertions.
 *
 * <p>These parse, but no automaton can be built for them: the compiled DFAs
 * have no notion of look-behind or look-ahead context.
 */
public enum Boundary {
  BEGINNING_OF_LINE("Anchors"),
  END_OF_LINE("Anchors"),
  WORD_BOUNDARY("Word boundary assertions"),
  NON_WORD_BOUNDARY("Word boundary assertions"),
  BEGINNING_OF_INPUT("Anchors"),

  /**
   * End of input, save for an optional final line terminator
   */
  END_OF_INPUT_OR_TERMINATOR("Anchors"),
  END_OF_INPUT("Anchors");

  /**
   * Name of the unsupported feature category, for error messages.
   */
  public final String featureCategory;

  Boundary(String featureCategory) {
    this.featureCategory = featureCategory;
  }

  /**
   * Mapping from the escaped character representing the boundary to the boundary.
   */
  public static final Map<Character, Boundary> CHARACTERS = Map.of(
    'b', Boundary.WORD_BOUNDARY,
    'B', Boundary.NON_WORD_BOUNDARY,
    'A', Boundary.BEGINNING_OF_INPUT,
    'Z', Boundary.END_OF_INPUT_OR_TERMINATOR,
    'z', Boundary.END_OF_INPUT
  );
}
