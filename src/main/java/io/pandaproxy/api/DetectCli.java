package io.pandaproxy.api;

import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.application.port.ProtocolDetector;
import io.pandaproxy.config.CompositionRoot;
import io.pandaproxy.config.EnvironmentConfig;
import io.pandaproxy.config.ProxyConfig;
import io.pandaproxy.domain.protocol.CameraProtocol;
import io.pandaproxy.logging.LoggingConfigurator;
import java.security.GeneralSecurityException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes a printer and prints which camera protocol it serves, without proxying anything.
 *
 * @since 0.1.0
 */
public final class DetectCli {
  private static final Logger log = LoggerFactory.getLogger(DetectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: detect printerIp=<host> accessCode=<code> [chamberPort=N] [rtspPort=N] "
          + "[detectTimeoutMillis=N] [config=PATH]";
  private static final String HELP_TEXT = """
      Camera protocol detection

      Usage:
        detect printerIp=<host> accessCode=<code> [options]

      Probes the chamber image port, then the RTSP port, with a TLS handshake each.

      Optional:
        chamberPort=1-65535        Chamber image port (default 6000)
        rtspPort=1-65535           RTSP port (default 322)
        detectTimeoutMillis=N      Bound on each probe (default 5000)
        config=PATH                YAML file (default ~/.pandaproxy/pandaproxy.yaml)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private DetectCli() {}

  static ExitCode run(String[] args) {
    return run(args, EnvironmentConfig.fromSystem());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ProxyConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.settingArgs());
      config = ProxyConfig.fromMap(ConfigCliUtils.resolveEffectiveConfig("detect", kv, environment));
    } catch (ConfigCliUtils.CliAbort ex) {
      log.error(ex.getMessage());
      return ex.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ProtocolDetector detector;
    try {
      detector = new CompositionRoot(config, MetricsPort.NO_OP).protocolDetector();
    } catch (GeneralSecurityException ex) {
      log.error("TLS is unavailable for camera detection", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    return report(config, detector.detect(config.printerIp()));
  }

  static ExitCode report(ProxyConfig config, CameraProtocol protocol) {
    if (protocol == CameraProtocol.UNKNOWN) {
      CliPrinter.println("No camera service answered on " + config.printerIp() + " ports "
          + config.chamberPort() + " or " + config.rtspPort() + "; " + RunCli.DETECTION_HINT);
      return ExitCode.DETECTION_FAILED;
    }
    int port = protocol == CameraProtocol.CHAMBER_IMAGE ? config.chamberPort() : config.rtspPort();
    CliPrinter.println(config.printerIp() + ": " + protocol + " on port " + port);
    return ExitCode.SUCCESS;
  }
}
