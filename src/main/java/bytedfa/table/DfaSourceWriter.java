package bytedfa.table;

import bytedfa.dfa.Dfa;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.lang.model.SourceVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a DFA as a pair of table files (one per byte order) along with a Java
 * source file exposing the table for the native byte order as a constant.
 *
 * <p>Names are upper-cased, with characters that cannot appear in a Java
 * identifier replaced by {@code _}. For a DFA named {@code grapheme-cluster}
 * or {@code GRAPHEME_CLUSTER}, this writes
 * {@code grapheme_cluster.bigendian.dfa}, {@code grapheme_cluster.littleendian.dfa},
 * and a class declaring
 * {@code public static final SerializedDfa GRAPHEME_CLUSTER}. The table files
 * are expected to end up on the class path next to the generated class.
 */
public final class DfaSourceWriter {

  private static final Logger logger = LoggerFactory.getLogger(DfaSourceWriter.class);

  private final Path outputDirectory;
  private final Optional<String> packageName;
  private final String className;
  private final List<String> command;

  /**
   * @param outputDirectory directory into which files are written
   * @param packageName package of the generated class, if any
   * @param className simple name of the generated class
   * @param command command line which generated the files, quoted in the banner
   * @throws IllegalArgumentException if the package or class name is not a
   *   valid Java name
   */
  public DfaSourceWriter(
    Path outputDirectory,
    Optional<String> packageName,
    String className,
    List<String> command
  ) {
    if (packageName.isPresent() && !SourceVersion.isName(packageName.get())) {
      throw new IllegalArgumentException("Invalid package name `" + packageName.get() + "`");
    }
    if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
      throw new IllegalArgumentException("Invalid class name `" + className + "`");
    }
    this.outputDirectory = outputDirectory;
    this.packageName = packageName;
    this.className = className;
    this.command = List.copyOf(command);
  }

  /**
   * Write the table files and the source file.
   *
   * @param name name of the DFA, from which the constant name is derived
   * @param dfa automaton to write
   * @param options layout and state id width of the tables
   * @return path of the Java source file
   * @throws IOException if a file cannot be written
   * @throws IllegalArgumentException if the DFA does not fit the options, or
   *   the name cannot be made into a constant name
   */
  public Path write(String name, Dfa dfa, TableOptions options) throws IOException {
    final String baseName = tableBaseName(name);
    Files.createDirectories(outputDirectory);

    for (ByteOrder order : List.of(ByteOrder.BIG_ENDIAN, ByteOrder.LITTLE_ENDIAN)) {
      final Path tablePath = outputDirectory.resolve(baseName + SerializedDfa.suffix(order));
      Files.write(tablePath, DfaTableWriter.toBytes(dfa, options, order));
      logger.info("Wrote {}", tablePath);
    }

    final Path sourcePath = outputDirectory.resolve(className + ".java");
    Files.writeString(sourcePath, source(name, dfa, options), StandardCharsets.UTF_8);
    logger.info("Wrote {}", sourcePath);
    return sourcePath;
  }

  /**
   * Java source declaring the constant for a DFA.
   */
  String source(String name, Dfa dfa, TableOptions options) {
    final String constant = constantName(name);
    final var builder = new StringBuilder();
    builder.append("/*\n");
    builder.append(" * DO NOT EDIT THIS FILE. IT WAS AUTOMATICALLY GENERATED BY:\n");
    builder.append(" *\n");
    builder.append(" *   ").append(bannerCommand()).append('\n');
    builder.append(" */\n");
    packageName.ifPresent(pkg -> builder.append("package ").append(pkg).append(";\n"));
    builder.append('\n');
    builder.append("import ").append(SerializedDfa.class.getName()).append(";\n");
    builder.append('\n');
    builder.append("public final class ").append(className).append(" {\n");
    builder.append('\n');
    builder.append("  private ").append(className).append("() { }\n");
    builder.append('\n');
    builder.append("  /**\n");
    builder.append("   * ").append(options.layout().name().toLowerCase(Locale.ROOT));
    builder.append(" DFA with ").append(dfa.stateCount()).append(" states and ");
    builder.append(options.width().bytes()).append("-byte state ids.\n");
    builder.append("   */\n");
    builder.append("  public static final SerializedDfa ").append(constant);
    builder.append(" = SerializedDfa.loadNative(").append(className).append(".class, \"");
    builder.append(tableBaseName(name)).append("\");\n");
    builder.append("}\n");
    return builder.toString();
  }

  private String bannerCommand() {
    final var parts = new StringBuilder();
    for (String part : command) {
      if (parts.length() > 0) {
        parts.append(' ');
      }
      // Keep the banner on one line and inside the comment
      parts.append(part.contains("\n") ? "[snip (arg too long)]" : part.replace("*/", "*\\/"));
    }
    return parts.toString();
  }

  /**
   * Java constant name for a DFA name.
   *
   * @param name DFA name, such as {@code word-break}
   * @return upper snake case name, such as {@code WORD_BREAK}
   * @throws IllegalArgumentException if the result is still not a valid
   *   identifier (it is empty, starts with a digit, or is a keyword)
   */
  static String constantName(String name) {
    final var constant = new StringBuilder();
    name
      .toUpperCase(Locale.ROOT)
      .codePoints()
      .forEach(c -> constant.appendCodePoint(Character.isJavaIdentifierPart(c) ? c : '_'));
    final String result = constant.toString();
    if (!SourceVersion.isIdentifier(result) || SourceVersion.isKeyword(result)) {
      throw new IllegalArgumentException("Cannot make a Java constant name out of `" + name + "`");
    }
    return result;
  }

  /**
   * File name prefix of the tables for a DFA name.
   *
   * @param name DFA name, such as {@code WORD_BREAK} or {@code word-break}
   * @return lower snake case name, such as {@code word_break}
   */
  static String tableBaseName(String name) {
    return constantName(name).toLowerCase(Locale.ROOT);
  }
}
