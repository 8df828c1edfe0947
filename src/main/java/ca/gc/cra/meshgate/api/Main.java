package ca.gc.cra.meshgate.api;

import ca.gc.cra.meshgate.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the {@code meshgate} executable.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: meshgate <serve> [options]";
  private static final String HELP_TEXT = """
      meshgate: mesh radio gateway bridge

      Usage:
        meshgate <command> [options]

      Commands:
        serve       Connect to a mesh gateway and serve the HTTP API (serve --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code from the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.keyValueArgs().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = input.keyValueArgs().get(0).toLowerCase(Locale.ROOT);
    if (!"serve".equals(command)) {
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String[] delegate = withFlags(input.afterCommand(), input);
    return ServeCli.run(delegate);
  }

  private static String[] withFlags(String[] kv, CliInput input) {
    String[] flags = input.flags().toArray(String[]::new);
    String[] combined = new String[kv.length + flags.length];
    System.arraycopy(kv, 0, combined, 0, kv.length);
    System.arraycopy(flags, 0, combined, kv.length, flags.length);
    return combined;
  }
}
