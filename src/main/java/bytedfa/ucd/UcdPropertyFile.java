package bytedfa.ucd;

import bytedfa.parser.CodePoints;
import bytedfa.util.IntRange;
import bytedfa.util.IntRangeSet;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for UCD property files in the common
 * {@code XXXX[..YYYY] ; Value  # comment} format, such as
 * {@code GraphemeBreakProperty.txt} or {@code emoji-data.txt}.
 */
public final class UcdPropertyFile {

  private UcdPropertyFile() { }

  /**
   * Read a property file.
   *
   * @param path file to read
   * @return code points for each property value, in order of first appearance
   */
  public static Map<String, IntRangeSet> parse(Path path) throws IOException {
    try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.getFileName().toString());
    }
  }

  /**
   * Read a property file.
   *
   * @param reader source of the file contents
   * @param source name of the file, for error messages
   * @return code points for each property value, in order of first appearance
   */
  public static Map<String, IntRangeSet> parse(Reader reader, String source) throws IOException {
    final var buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    final var ranges = new LinkedHashMap<String, List<IntRange>>();

    String line;
    int lineNumber = 0;
    while ((line = buffered.readLine()) != null) {
      lineNumber++;
      final int commentStart = line.indexOf('#');
      final String content = (commentStart >= 0 ? line.substring(0, commentStart) : line).trim();
      if (content.isEmpty()) {
        continue;
      }

      final String[] fields = content.split(";");
      if (fields.length < 2) {
        throw new UcdParseException("Expected `codepoints ; value`", source, lineNumber);
      }
      final IntRange codePoints = parseCodePoints(fields[0].trim(), source, lineNumber);
      final String value = fields[1].trim();
      if (value.isEmpty()) {
        throw new UcdParseException("Missing property value", source, lineNumber);
      }
      ranges.computeIfAbsent(value, v -> new ArrayList<>()).add(codePoints);
    }

    final var properties = new LinkedHashMap<String, IntRangeSet>();
    for (Map.Entry<String, List<IntRange>> entry : ranges.entrySet()) {
      properties.put(entry.getKey(), IntRangeSet.unionOf(entry.getValue()));
    }
    return properties;
  }

  private static IntRange parseCodePoints(
    String field,
    String source,
    int lineNumber
  ) throws UcdParseException {
    final int dots = field.indexOf("..");
    try {
      final int start = Integer.parseInt(dots < 0 ? field : field.substring(0, dots), 16);
      final int end = dots < 0 ? start : Integer.parseInt(field.substring(dots + 2), 16);
      final var range = IntRange.between(start, end);
      if (!CodePoints.UNICODE_RANGE.contains(start) || !CodePoints.UNICODE_RANGE.contains(end)) {
        throw new UcdParseException("Code point out of range: " + field, source, lineNumber);
      }
      return range;
    } catch (IllegalArgumentException err) {
      throw new UcdParseException("Invalid code points: " + field, source, lineNumber, err);
    }
  }
}
