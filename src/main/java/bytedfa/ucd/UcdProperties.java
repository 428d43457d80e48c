package bytedfa.ucd;

import bytedfa.parser.CodePoints;
import bytedfa.parser.PropertyResolver;
import bytedfa.util.IntRangeSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unicode properties loaded from UCD files.
 *
 * <p>Property and value names are matched loosely (ignoring case, spaces,
 * underscores, and hyphens). Enumerated properties get an {@code Other} value
 * covering every code point not listed in the file, unless the file already
 * defines one.
 */
public final class UcdProperties implements PropertyResolver {

  private static final Logger logger = LoggerFactory.getLogger(UcdProperties.class);

  /**
   * Enumerated property loaded from a file.
   *
   * @param fileName file in the UCD directory
   * @param aliases names of the property
   * @param valueAliases short value names, mapped to long ones
   */
  private record EnumeratedFile(
    String fileName,
    List<String> aliases,
    Map<String, String> valueAliases
  ) { }

  private static final List<EnumeratedFile> ENUMERATED_FILES = List.of(
    new EnumeratedFile(
      "GraphemeBreakProperty.txt",
      List.of("gcb", "Grapheme_Cluster_Break"),
      Map.of(
        "CN", "Control",
        "EX", "Extend",
        "PP", "Prepend",
        "RI", "Regional_Indicator",
        "SM", "SpacingMark",
        "XX", "Other"
      )
    ),
    new EnumeratedFile(
      "WordBreakProperty.txt",
      List.of("wb", "Word_Break"),
      Map.of(
        "DQ", "Double_Quote",
        "EX", "ExtendNumLet",
        "FO", "Format",
        "HL", "Hebrew_Letter",
        "KA", "Katakana",
        "LE", "ALetter",
        "MB", "MidNumLet",
        "ML", "MidLetter",
        "MN", "MidNum",
        "NU", "Numeric"
      )
    ),
    new EnumeratedFile(
      "SentenceBreakProperty.txt",
      List.of("sb", "Sentence_Break"),
      Map.of(
        "AT", "ATerm",
        "CL", "Close",
        "FO", "Format",
        "LE", "OLetter",
        "LO", "Lower",
        "NU", "Numeric",
        "SC", "SContinue",
        "SE", "Sep",
        "ST", "STerm",
        "UP", "Upper"
      )
    )
  );

  private static final List<String> BINARY_FILES = List.of("emoji-data.txt");

  private static final Map<String, String> BINARY_ALIASES = Map.of(
    "extpict", "extendedpictographic",
    "ebase", "emojimodifierbase",
    "ecomp", "emojicomponent",
    "emod", "emojimodifier",
    "epres", "emojipresentation"
  );

  // loose property name -> loose value name -> code points
  private final Map<String, Map<String, IntRangeSet>> enumerated = new HashMap<>();

  // loose property name -> code points
  private final Map<String, IntRangeSet> binary = new HashMap<>();

  /**
   * Load whichever of the known property files exist in a directory.
   *
   * @param directory directory containing UCD files
   * @return loaded properties
   */
  public static UcdProperties load(Path directory) throws IOException {
    final var properties = new UcdProperties();
    boolean foundAny = false;

    for (EnumeratedFile file : ENUMERATED_FILES) {
      final Path path = directory.resolve(file.fileName());
      if (Files.isRegularFile(path)) {
        properties.addEnumerated(file, UcdPropertyFile.parse(path));
        foundAny = true;
        logger.debug("Loaded {}", path);
      }
    }

    for (String fileName : BINARY_FILES) {
      final Path path = directory.resolve(fileName);
      if (Files.isRegularFile(path)) {
        UcdPropertyFile.parse(path).forEach(properties::addBinary);
        foundAny = true;
        logger.debug("Loaded {}", path);
      }
    }

    if (!foundAny) {
      logger.warn("No UCD property files found in {}", directory);
    }
    return properties;
  }

  private void addEnumerated(EnumeratedFile file, Map<String, IntRangeSet> values) {
    final var byValue = new HashMap<String, IntRangeSet>();
    IntRangeSet listed = IntRangeSet.EMPTY;
    for (Map.Entry<String, IntRangeSet> entry : values.entrySet()) {
      byValue.put(CodePoints.looseName(entry.getKey()), entry.getValue());
      listed = listed.union(entry.getValue());
    }
    byValue.putIfAbsent("other", listed.complement(CodePoints.UNICODE_RANGE));

    for (Map.Entry<String, String> alias : file.valueAliases().entrySet()) {
      final IntRangeSet aliased = byValue.get(CodePoints.looseName(alias.getValue()));
      if (aliased != null) {
        byValue.putIfAbsent(CodePoints.looseName(alias.getKey()), aliased);
      }
    }

    for (String alias : file.aliases()) {
      enumerated.put(CodePoints.looseName(alias), byValue);
    }
  }

  private void addBinary(String property, IntRangeSet codePoints) {
    binary.put(CodePoints.looseName(property), codePoints);
  }

  @Override
  public Optional<IntRangeSet> enumerated(String property, String value) {
    final Map<String, IntRangeSet> values = enumerated.get(CodePoints.looseName(property));
    if (values == null) {
      return Optional.empty();
    }
    final IntRangeSet codePoints = values.get(CodePoints.looseName(value));
    if (codePoints == null) {
      throw new IllegalArgumentException("Unknown value `" + value + "` for property " + property);
    }
    return Optional.of(codePoints);
  }

  @Override
  public Optional<IntRangeSet> binary(String property) {
    final String name = CodePoints.looseName(property);
    return Optional.ofNullable(binary.get(BINARY_ALIASES.getOrDefault(name, name)));
  }
}
