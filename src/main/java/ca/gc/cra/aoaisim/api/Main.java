package ca.gc.cra.aoaisim.api;

import ca.gc.cra.aoaisim.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the simulator.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: aoai-simulator <serve> [options]";
  private static final String HELP_TEXT = """
      aoai-simulator: simulated Azure OpenAI and Document Intelligence endpoint

      Usage:
        aoai-simulator <command> [options]

      Commands:
        serve       Start the HTTP simulator (serve --help for settings)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    // System.exit blocks while shutdown hooks run, and serve returns from inside that window.
    if (exit != ExitCode.SUCCESS) {
      System.exit(exit.code());
    }
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.printLines(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (global.help()) {
      delegateArgs = appendHelp(delegateArgs);
    }
    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.printLines(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !"help".equalsIgnoreCase(arg)) {
        return i;
      }
    }
    return -1;
  }

  private static String[] appendHelp(String[] args) {
    String[] withHelp = Arrays.copyOf(args, args.length + 1);
    withHelp[args.length] = CliInput.HELP;
    return withHelp;
  }
}
