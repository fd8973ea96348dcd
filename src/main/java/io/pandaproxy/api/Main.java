package io.pandaproxy.api;

import io.pandaproxy.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for {@code pandaproxy}.
 * <p>A first argument that is already a {@code key=value} pair runs the proxy, so a container can
 * start it with nothing but environment variables and no arguments after {@code run}.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pandaproxy <run|detect> [key=value ...]";
  private static final String HELP_TEXT = """
      pandaproxy: chamber camera fan-out proxy for Bambu Lab printers

      Usage:
        pandaproxy <command> [options]

      Commands:
        run         Detect the camera protocol and serve it (run --help for details)
        detect      Print the camera protocol the printer exposes

      Environment:
        PRINTER_IP, ACCESS_CODE, BIND_ADDRESS override YAML and defaults

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first token names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = input.command();
    if (input.help() && (command == null || command.equals("help"))) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (input.isEmpty()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (command == null) {
      return RunCli.run(args);
    }

    String[] delegateArgs = input.afterCommand().toArray(String[]::new);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "detect" -> DetectCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
