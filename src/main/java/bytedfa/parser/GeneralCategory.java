package bytedfa.parser;

import bytedfa.util.IntRangeSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unicode general categories, as tabulated by {@code Character.getType}.
 *
 * <p>Single letter categories are the union of their two letter
 * subcategories.
 */
public enum GeneralCategory {
  LU("Lu", "Uppercase_Letter", Character.UPPERCASE_LETTER),
  LL("Ll", "Lowercase_Letter", Character.LOWERCASE_LETTER),
  LT("Lt", "Titlecase_Letter", Character.TITLECASE_LETTER),
  LM("Lm", "Modifier_Letter", Character.MODIFIER_LETTER),
  LO("Lo", "Other_Letter", Character.OTHER_LETTER),
  L(
    "L",
    "Letter",
    Character.UPPERCASE_LETTER,
    Character.LOWERCASE_LETTER,
    Character.TITLECASE_LETTER,
    Character.MODIFIER_LETTER,
    Character.OTHER_LETTER
  ),
  LC(
    "LC",
    "Cased_Letter",
    Character.UPPERCASE_LETTER,
    Character.LOWERCASE_LETTER,
    Character.TITLECASE_LETTER
  ),

  MN("Mn", "Nonspacing_Mark", Character.NON_SPACING_MARK),
  MC("Mc", "Spacing_Mark", Character.COMBINING_SPACING_MARK),
  ME("Me", "Enclosing_Mark", Character.ENCLOSING_MARK),
  M(
    "M",
    "Mark",
    Character.NON_SPACING_MARK,
    Character.COMBINING_SPACING_MARK,
    Character.ENCLOSING_MARK
  ),

  ND("Nd", "Decimal_Number", Character.DECIMAL_DIGIT_NUMBER),
  NL("Nl", "Letter_Number", Character.LETTER_NUMBER),
  NO("No", "Other_Number", Character.OTHER_NUMBER),
  N(
    "N",
    "Number",
    Character.DECIMAL_DIGIT_NUMBER,
    Character.LETTER_NUMBER,
    Character.OTHER_NUMBER
  ),

  PC("Pc", "Connector_Punctuation", Character.CONNECTOR_PUNCTUATION),
  PD("Pd", "Dash_Punctuation", Character.DASH_PUNCTUATION),
  PS("Ps", "Open_Punctuation", Character.START_PUNCTUATION),
  PE("Pe", "Close_Punctuation", Character.END_PUNCTUATION),
  PI("Pi", "Initial_Punctuation", Character.INITIAL_QUOTE_PUNCTUATION),
  PF("Pf", "Final_Punctuation", Character.FINAL_QUOTE_PUNCTUATION),
  PO("Po", "Other_Punctuation", Character.OTHER_PUNCTUATION),
  P(
    "P",
    "Punctuation",
    Character.CONNECTOR_PUNCTUATION,
    Character.DASH_PUNCTUATION,
    Character.START_PUNCTUATION,
    Character.END_PUNCTUATION,
    Character.INITIAL_QUOTE_PUNCTUATION,
    Character.FINAL_QUOTE_PUNCTUATION,
    Character.OTHER_PUNCTUATION
  ),

  SM("Sm", "Math_Symbol", Character.MATH_SYMBOL),
  SC("Sc", "Currency_Symbol", Character.CURRENCY_SYMBOL),
  SK("Sk", "Modifier_Symbol", Character.MODIFIER_SYMBOL),
  SO("So", "Other_Symbol", Character.OTHER_SYMBOL),
  S(
    "S",
    "Symbol",
    Character.MATH_SYMBOL,
    Character.CURRENCY_SYMBOL,
    Character.MODIFIER_SYMBOL,
    Character.OTHER_SYMBOL
  ),

  ZS("Zs", "Space_Separator", Character.SPACE_SEPARATOR),
  ZL("Zl", "Line_Separator", Character.LINE_SEPARATOR),
  ZP("Zp", "Paragraph_Separator", Character.PARAGRAPH_SEPARATOR),
  Z(
    "Z",
    "Separator",
    Character.SPACE_SEPARATOR,
    Character.LINE_SEPARATOR,
    Character.PARAGRAPH_SEPARATOR
  ),

  CC("Cc", "Control", Character.CONTROL),
  CF("Cf", "Format", Character.FORMAT),
  CS("Cs", "Surrogate", Character.SURROGATE),
  CO("Co", "Private_Use", Character.PRIVATE_USE),
  CN("Cn", "Unassigned", Character.UNASSIGNED),
  C(
    "C",
    "Other",
    Character.CONTROL,
    Character.FORMAT,
    Character.SURROGATE,
    Character.PRIVATE_USE,
    Character.UNASSIGNED
  );

  public final String abbreviation;
  public final String longName;
  private final int[] types;

  GeneralCategory(String abbreviation, String longName, int... types) {
    this.abbreviation = abbreviation;
    this.longName = longName;
    this.types = types;
  }

  /**
   * Tabulate the code points in the category.
   */
  public IntRangeSet codePoints() {
    return CodePoints.categoryCodePoints(types);
  }

  private static final Map<String, GeneralCategory> BY_NAME = new HashMap<>();
  static {
    for (GeneralCategory category : values()) {
      BY_NAME.put(category.abbreviation, category);
      BY_NAME.put(CodePoints.looseName(category.longName), category);
    }
  }

  /**
   * Find a category by abbreviation (case sensitive, since {@code Lc} is not
   * {@code LC}) or by loosely matched long name.
   *
   * @param name abbreviation or long name
   */
  public static Optional<GeneralCategory> forName(String name) {
    final var byAbbreviation = BY_NAME.get(name);
    if (byAbbreviation != null) {
      return Optional.of(byAbbreviation);
    }
    return Optional.ofNullable(BY_NAME.get(CodePoints.looseName(name)));
  }
}
