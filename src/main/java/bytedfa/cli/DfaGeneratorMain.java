package bytedfa.cli;

import bytedfa.CompileOptions;
import bytedfa.DfaCompiler;
import bytedfa.dfa.Dfa;
import bytedfa.table.DfaSourceWriter;
import bytedfa.table.StateIdWidth;
import bytedfa.table.TableLayout;
import bytedfa.table.TableOptions;
import bytedfa.ucd.UcdProperties;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: compile a pattern into a DFA, then print it or
 * write it out as tables plus a Java source file.
 */
public final class DfaGeneratorMain {

  private static final Logger logger = LoggerFactory.getLogger(DfaGeneratorMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = "bytedfa [OPTION]... PATTERN";

  private static final Option UCD_DIR = Option.builder()
    .longOpt("ucd-dir")
    .hasArg()
    .argName("DIR")
    .desc("directory of UCD files providing properties such as \\p{gcb=LF}")
    .build();
  private static final Option NAME = Option.builder()
    .longOpt("name")
    .hasArg()
    .argName("NAME")
    .desc("name of the generated constant (default DFA)")
    .build();
  private static final Option PACKAGE = Option.builder()
    .longOpt("package")
    .hasArg()
    .argName("PKG")
    .desc("package of the generated class")
    .build();
  private static final Option CLASS = Option.builder()
    .longOpt("class")
    .hasArg()
    .argName("NAME")
    .desc("name of the generated class (default derived from --name)")
    .build();
  private static final Option DFA_DIR = Option.builder()
    .longOpt("dfa-dir")
    .hasArg()
    .argName("DIR")
    .desc("write tables and source here instead of printing the DFA")
    .build();
  private static final Option SPARSE = Option.builder()
    .longOpt("sparse")
    .desc("write sparse tables instead of dense ones")
    .build();
  private static final Option MINIMIZE = Option.builder()
    .longOpt("minimize")
    .desc("minimize the DFA")
    .build();
  private static final Option REVERSE = Option.builder()
    .longOpt("reverse")
    .desc("build a DFA matching backwards from the end of the input")
    .build();
  private static final Option STATE_SIZE = Option.builder()
    .longOpt("state-size")
    .hasArg()
    .argName("BYTES")
    .desc("bytes per state id in tables: 1, 2, 4, or 8 (default 4)")
    .build();
  private static final Option DOT = Option.builder()
    .longOpt("dot")
    .desc("print the DFA as a Graphviz graph")
    .build();
  private static final Option HELP = Option.builder("h")
    .longOpt("help")
    .desc("print this message")
    .build();

  private DfaGeneratorMain() { }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Run the generator.
   *
   * @param args command line arguments
   * @param out where the DFA is printed
   * @param err where errors and usage are printed
   * @return exit code
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    final Options options = options();
    final CommandLine cmd;
    try {
      final CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(options, args);
    } catch (ParseException e) {
      err.println(e.getMessage());
      printHelp(options, err);
      return EXIT_USAGE;
    }

    if (cmd.hasOption(HELP.getLongOpt())) {
      printHelp(options, out);
      return EXIT_OK;
    }
    if (cmd.getArgList().size() != 1) {
      err.println("Expected exactly one pattern, got " + cmd.getArgList().size());
      printHelp(options, err);
      return EXIT_USAGE;
    }
    final String pattern = cmd.getArgList().get(0);

    final StateIdWidth width;
    try {
      width = StateIdWidth.forBytes(Integer.parseInt(cmd.getOptionValue(STATE_SIZE.getLongOpt(), "4")));
    } catch (IllegalArgumentException e) {
      err.println("Invalid --state-size: " + e.getMessage());
      return EXIT_USAGE;
    }
    final TableOptions tableOptions = new TableOptions(
      cmd.hasOption(SPARSE.getLongOpt()) ? TableLayout.SPARSE : TableLayout.DENSE,
      width
    );

    try {
      CompileOptions compileOptions = CompileOptions.DEFAULT
        .withMinimize(cmd.hasOption(MINIMIZE.getLongOpt()))
        .withReverse(cmd.hasOption(REVERSE.getLongOpt()));
      if (cmd.hasOption(UCD_DIR.getLongOpt())) {
        final Path ucdDir = Paths.get(cmd.getOptionValue(UCD_DIR.getLongOpt()));
        compileOptions = compileOptions.withProperties(UcdProperties.load(ucdDir));
      }

      final Dfa dfa = DfaCompiler.compile(pattern, compileOptions);
      logger.info("Compiled DFA with {} states", dfa.stateCount());

      if (cmd.hasOption(DOT.getLongOpt())) {
        out.print(dfa.dotGraph(cmd.getOptionValue(NAME.getLongOpt(), "DFA")));
      } else if (cmd.hasOption(DFA_DIR.getLongOpt())) {
        final String name = cmd.getOptionValue(NAME.getLongOpt(), "DFA");
        final var command = new ArrayList<String>();
        command.add("bytedfa");
        command.addAll(List.of(args));
        final var writer = new DfaSourceWriter(
          Paths.get(cmd.getOptionValue(DFA_DIR.getLongOpt())),
          Optional.ofNullable(cmd.getOptionValue(PACKAGE.getLongOpt())),
          cmd.getOptionValue(CLASS.getLongOpt(), className(name)),
          command
        );
        writer.write(name, dfa, tableOptions);
      } else {
        out.print(dfa);
      }
      return EXIT_OK;
    } catch (PatternSyntaxException e) {
      err.println(e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException | IllegalArgumentException e) {
      logger.error("Failed to generate DFA", e);
      err.println("error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static Options options() {
    final Options options = new Options();
    List.of(UCD_DIR, NAME, PACKAGE, CLASS, DFA_DIR, SPARSE, MINIMIZE, REVERSE, STATE_SIZE, DOT, HELP)
      .forEach(options::addOption);
    return options;
  }

  private static void printHelp(Options options, PrintStream stream) {
    final HelpFormatter formatter = new HelpFormatter();
    final var writer = new PrintWriter(stream);
    formatter.printHelp(
      writer,
      formatter.getWidth(),
      USAGE,
      null,
      options,
      formatter.getLeftPadding(),
      formatter.getDescPadding(),
      null
    );
    writer.flush();
  }

  /**
   * Class name for a constant name. Any character that cannot appear in a
   * Java identifier separates words, like {@code _} does.
   *
   * @param name constant name, such as {@code GRAPHEME_CLUSTER} or {@code grapheme-cluster}
   * @return upper camel case name, such as {@code GraphemeCluster}
   */
  static String className(String name) {
    final var builder = new StringBuilder();
    boolean upper = true;
    for (char c : name.toCharArray()) {
      if (c == '_' || !Character.isJavaIdentifierPart(c)) {
        upper = true;
      } else if (upper) {
        builder.append(Character.toUpperCase(c));
        upper = false;
      } else {
        builder.append(Character.toLowerCase(c));
      }
    }
    return builder.length() == 0 ? "Dfa" : builder.toString();
  }
}
