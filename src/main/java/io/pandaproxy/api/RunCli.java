package io.pandaproxy.api;

import io.pandaproxy.application.pipeline.ChamberProxyUseCase;
import io.pandaproxy.application.port.RelayLauncher;
import io.pandaproxy.application.port.RelayLauncher.RelayFailureAction;
import io.pandaproxy.application.port.Sleeper;
import io.pandaproxy.application.upstream.BackoffPolicy;
import io.pandaproxy.config.CompositionRoot;
import io.pandaproxy.config.EnvironmentConfig;
import io.pandaproxy.config.ProxyConfig;
import io.pandaproxy.domain.protocol.CameraProtocol;
import io.pandaproxy.infrastructure.ftp.FtpPassthroughProxy;
import io.pandaproxy.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.pandaproxy.infrastructure.metrics.TelemetrySettings;
import io.pandaproxy.logging.LoggingConfigurator;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the camera proxy for one printer.
 * <p>The camera protocol is detected once (or forced with {@code camera=}); a chamber image
 * printer gets the fan-out proxy, an RTSP printer is handed to the relay launcher, and a printer
 * that answers on neither port stops startup.</p>
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  static final String DETECTION_HINT = "check printer IP, access code, or LAN mode";
  private static final String SUMMARY_USAGE =
      "usage: run printerIp=<host> accessCode=<code> tlsKeystore=<file.p12> [bind=ADDR] "
          + "[proxyPort=N] [camera=auto|chamber|rtsp] [ftpEnabled=true|false] [config=PATH] "
          + "[--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Chamber camera proxy

      Usage:
        run printerIp=<host> accessCode=<code> [options]

      Required (CLI, environment or YAML):
        printerIp=HOST             Printer address (PRINTER_IP)
        accessCode=CODE            LAN access code shown on the printer (ACCESS_CODE)
        tlsKeystore=PATH           PKCS12 keystore with the listener certificate

      Optional (validated):
        tlsKeystorePassword=TEXT   Keystore password (default empty)
        bind=ADDR                  Listener bind address (default 0.0.0.0; BIND_ADDRESS)
        proxyPort=0-65535          Chamber image listener port (default 6000)
        chamberPort=1-65535        Printer chamber image port (default 6000)
        rtspPort=1-65535           Printer RTSP port probed during detection (default 322)
        camera=auto|chamber|rtsp   Skip detection when forced (default auto)
        connectTimeoutMillis=N     Upstream connect and TLS handshake bound (default 10000)
        authTimeoutMillis=N        Time the printer has to refuse the access code (default 5000)
        idleTimeoutMillis=N        Upstream silence treated as a dead link (default 30000)
        clientAuthTimeoutMillis=N  Time a client has to authenticate (default 10000)
        backoffMinMillis=N         First reconnect delay (default 1000)
        backoffMaxMillis=N         Reconnect delay cap (default 30000)
        clientQueueFrames=1-1024   Frames buffered per client before dropping (default 8)
        maxFrameBytes=N            Largest accepted image payload (default 4194304)
        detectTimeoutMillis=N      Bound on each detection probe (default 5000)
        ftpEnabled=true|false      Also relay FTPS on 990 and 2000-2100 (default false)
        config=PATH                YAML file (default ~/.pandaproxy/pandaproxy.yaml)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate inputs and print the plan without connecting
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private RunCli() {}

  /**
   * Runs the proxy with the process environment.
   *
   * @param args CLI arguments after the subcommand
   * @return exit code
   */
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
      log.debug("Verbose logging enabled for run");
    }
    boolean dryRun = input.has(CliInput.Switch.DRY_RUN);

    Map<String, String> effective;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.settingArgs());
      effective = ConfigCliUtils.resolveEffectiveConfig("run", kv, environment);
    } catch (ConfigCliUtils.CliAbort ex) {
      log.error(ex.getMessage());
      return ex.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ProxyConfig config;
    TelemetrySettings telemetry;
    try {
      telemetry = TelemetryConfigurator.settingsFrom(effective);
      config = ProxyConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid proxy configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.debug("Effective configuration: {}", config);

    if (dryRun) {
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      return execute(new CompositionRoot(config, metrics));
    }
  }

  private static ExitCode execute(CompositionRoot root) {
    ProxyConfig config = root.config();
    CameraProtocol protocol;
    try {
      protocol = resolveProtocol(root);
    } catch (GeneralSecurityException ex) {
      log.error("TLS is unavailable for camera detection", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    return switch (protocol) {
      case CHAMBER_IMAGE -> runChamberProxy(root);
      case RTSP -> runRelay(root.relayLauncher(), config, Sleeper.THREAD);
      case UNKNOWN -> {
        log.error("No camera service answered on {} ports {} or {}; {}",
            config.printerIp(), config.chamberPort(), config.rtspPort(), DETECTION_HINT);
        yield ExitCode.DETECTION_FAILED;
      }
    };
  }

  private static CameraProtocol resolveProtocol(CompositionRoot root) throws GeneralSecurityException {
    ProxyConfig config = root.config();
    Optional<CameraProtocol> forced = config.camera().forced();
    if (forced.isPresent()) {
      log.info("Camera protocol forced to {}; skipping detection", forced.get());
      return forced.get();
    }
    CameraProtocol detected = root.protocolDetector().detect(config.printerIp());
    log.info("Detected camera protocol {} on {}", detected, config.printerIp());
    return detected;
  }

  private static ExitCode runChamberProxy(CompositionRoot root) {
    ProxyConfig config = root.config();
    ChamberProxyUseCase proxy;
    try {
      proxy = root.chamberProxyUseCase();
    } catch (IOException | GeneralSecurityException | IllegalArgumentException ex) {
      log.error("Unable to prepare the client listener: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    FtpPassthroughProxy ftp = config.ftpEnabled() ? root.ftpPassthrough() : null;
    Thread hook = new Thread(() -> {
      proxy.close();
      if (ftp != null) {
        ftp.close();
      }
    }, "pandaproxy-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      if (ftp != null) {
        ftp.start();
      }
      log.info("Proxying chamber images from {}:{}", config.printerIp(), config.chamberPort());
      proxy.run();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Proxy I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Proxy interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in chamber proxy", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      proxy.close();
      if (ftp != null) {
        ftp.close();
      }
      removeHook(hook);
    }
  }

  /**
   * Runs the RTSP relay, restarting it after failures the launcher asks to retry.
   * <p>Restarts are paced with the configured reconnect backoff.</p>
   */
  static ExitCode runRelay(RelayLauncher relay, ProxyConfig config, Sleeper sleeper) {
    BackoffPolicy backoff = new BackoffPolicy(config.backoffMin(), config.backoffMax());
    while (true) {
      try {
        relay.start(config.printerIp(), config.credential());
        return ExitCode.SUCCESS;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.error("RTSP relay interrupted");
        return ExitCode.INTERRUPTED;
      } catch (Exception ex) {
        if (relay.onFailure(ex) == RelayFailureAction.EXIT) {
          log.error("RTSP relay for {} stopped: {}", config.printerIp(), ex.getMessage());
          return ExitCode.RUNTIME_FAILURE;
        }
        Duration delay = backoff.nextDelay();
        log.warn("Restarting RTSP relay for {} in {} ms after failure: {}",
            config.printerIp(), delay.toMillis(), ex.getMessage());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          log.error("RTSP relay interrupted");
          return ExitCode.INTERRUPTED;
        }
      }
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook stays registered");
    }
  }

  private static void printDryRunPlan(ProxyConfig config, TelemetrySettings telemetry) {
    CliPrinter.printLines(
        "Run dry-run: no connections will be made.",
        " Printer          : " + config.printerIp(),
        " Access code      : <redacted>",
        " Camera           : " + config.camera().forced()
            .map(CameraProtocol::name)
            .orElse("auto (probe " + config.chamberPort() + " then " + config.rtspPort() + ")"),
        " Listener         : " + config.bind() + ":" + config.proxyPort(),
        " TLS keystore     : " + (config.tlsKeystore() == null ? "<none>" : config.tlsKeystore()),
        " Upstream         : " + config.printerIp() + ":" + config.chamberPort(),
        " Idle timeout (ms): " + config.idleTimeoutMillis(),
        " Backoff (ms)     : " + config.backoffMinMillis() + ".." + config.backoffMaxMillis(),
        " Client queue     : " + config.clientQueueFrames() + " frames",
        " FTP passthrough  : " + (config.ftpEnabled() ? "990, 2000-2100" : "disabled"),
        " Metrics exporter : " + (telemetry.exporter().isEmpty() ? "<default>" : telemetry.exporter()),
        " Re-run without --dry-run to start proxying.");
  }
}
