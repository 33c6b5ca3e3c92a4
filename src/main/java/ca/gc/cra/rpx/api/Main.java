package ca.gc.cra.rpx.api;

import ca.gc.cra.rpx.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RPX command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: rpx <serve> [options]";
  private static final String HELP_TEXT = """
      RPX telemetry command dispatcher

      Usage:
        rpx <command> [options]

      Commands:
        serve       Run the telemetry WebSocket server (serve --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the subcommand
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput globals = CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);
    if (globals.verbose()) {
      String[] withVerbose = Arrays.copyOf(delegateArgs, delegateArgs.length + 1);
      withVerbose[delegateArgs.length] = "--verbose";
      delegateArgs = withVerbose;
    }

    switch (command) {
      case "serve":
        return ServeCli.run(delegateArgs);
      default:
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
    }
  }
}
