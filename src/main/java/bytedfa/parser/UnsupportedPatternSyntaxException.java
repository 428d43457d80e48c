package bytedfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs which are valid regular expressions
 * but cannot be compiled into a byte-level DFA.
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 4218803522746517164L;

  /**
   * (Capitalized, plural) name of the unsupported feature category.
   */
  public final String unsupportedFeatureCategory;

  /**
   * @param unsupportedFeatureCategory category of the feature, eg. "Anchors"
   * @param regex pattern (or a rendering of the AST) containing the feature
   * @param index position of the feature, or {@code -1} if unknown
   */
  public UnsupportedPatternSyntaxException(
    String unsupportedFeatureCategory,
    String regex,
    int index
  ) {
    super(unsupportedFeatureCategory + " are not supported", regex, index);
    this.unsupportedFeatureCategory = unsupportedFeatureCategory;
  }
}
