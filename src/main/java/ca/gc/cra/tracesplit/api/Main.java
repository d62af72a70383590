package ca.gc.cra.tracesplit.api;

import ca.gc.cra.tracesplit.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * tracesplit command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: tracesplit <split|describe> [options]";
  private static final String HELP_TEXT = """
      tracesplit command dispatcher

      Usage:
        tracesplit <command> [options]

      Commands:
        split       Partition a label store into train/val/test index sets (split --help for details)
        describe    Summarize a label store before splitting

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = commandIndex(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    // Flags stay with the command so --dry-run and --help reach it.
    List<String> delegate = new ArrayList<>(raw.length - 1);
    for (int i = 0; i < raw.length; i++) {
      if (i != commandIndex) {
        delegate.add(raw[i]);
      }
    }
    String[] delegateArgs = delegate.toArray(String[]::new);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    return switch (command) {
      case "split" -> SplitCli.run(delegateArgs);
      case "describe" -> DescribeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int commandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=")
          && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
