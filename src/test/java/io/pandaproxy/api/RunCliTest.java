package io.pandaproxy.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pandaproxy.application.port.RelayLauncher;
import io.pandaproxy.config.ProxyConfig;
import io.pandaproxy.domain.chamber.AccessCredential;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  private static final Map<String, String> ENV = Map.of("PRINTER_IP", "10.0.0.5", "ACCESS_CODE", "12345678");

  @TempDir Path tempDir;

  private final StringWriter output = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private String configArg;

  @BeforeEach
  void setUp() throws IOException {
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    Path yaml = tempDir.resolve("pandaproxy.yaml");
    Files.writeString(yaml, "common:\n  metricsExporter: none\n");
    configArg = "config=" + yaml;
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, RunCli.run(new String[] {"--help"}, Map.of()));
    assertTrue(output.toString().contains("accessCode=CODE"));
  }

  @Test
  void missingPrinterIsInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {configArg, "accessCode=12345678"}, Map.of());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(output.toString().contains("usage: run"));
    assertTrue(hasLogContaining("printerIp is required"));
  }

  @Test
  void bareTokenIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {configArg, "printer"}, ENV));
  }

  @Test
  void unknownExporterIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        RunCli.run(new String[] {configArg, "metricsExporter=prometheus"}, ENV));
  }

  @Test
  void missingExplicitConfigFileIsConfigError() {
    ExitCode code = RunCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, ENV);

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void dryRunPrintsPlanWithoutSecrets() {
    ExitCode code = RunCli.run(new String[] {configArg, "proxyPort=6001", "--dry-run"}, ENV);

    assertEquals(ExitCode.SUCCESS, code);
    String plan = output.toString();
    assertTrue(plan.contains("Printer          : 10.0.0.5"));
    assertTrue(plan.contains("Listener         : 0.0.0.0:6001"));
    assertTrue(plan.contains("auto (probe 6000 then 322)"));
    assertFalse(plan.contains("12345678"));
  }

  @Test
  void cliOverridesEnvironment() {
    ExitCode code = RunCli.run(new String[] {configArg, "printerIp=10.0.0.9", "--dry-run"}, ENV);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output.toString().contains("Printer          : 10.0.0.9"));
  }

  @Test
  void forcedRtspWithoutRelayIsRuntimeFailure() {
    ExitCode code = RunCli.run(new String[] {configArg, "camera=rtsp"}, ENV);

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
  }

  @Test
  void forcedChamberWithoutKeystoreIsConfigError() {
    ExitCode code = RunCli.run(new String[] {configArg, "camera=chamber"}, ENV);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLogContaining("tlsKeystore is required"));
  }

  @Test
  void relayRestartsAreSpacedByGrowingBackoff() {
    AtomicInteger starts = new AtomicInteger();
    RelayLauncher flaky = new RelayLauncher() {
      @Override
      public void start(String printerHost, AccessCredential credential) throws Exception {
        if (starts.incrementAndGet() < 3) {
          throw new IOException("relay crashed");
        }
      }

      @Override
      public RelayFailureAction onFailure(Exception failure) {
        return RelayFailureAction.RETRY;
      }
    };
    ProxyConfig config = ProxyConfig.fromMap(Map.of(
        "printerIp", "10.0.0.5", "accessCode", "12345678",
        "backoffMinMillis", "200", "backoffMaxMillis", "5000"));
    List<Long> delays = new ArrayList<>();

    assertEquals(ExitCode.SUCCESS, RunCli.runRelay(flaky, config, delay -> delays.add(delay.toMillis())));
    assertEquals(3, starts.get());
    assertEquals(2, delays.size());
    assertTrue(delays.get(0) >= 200 && delays.get(0) <= 220, "first delay " + delays);
    assertTrue(delays.get(1) >= 400 && delays.get(1) <= 440, "second delay " + delays);
  }

  @Test
  void relayInterruptedWhileWaitingToRestart() {
    RelayLauncher crashing = new RelayLauncher() {
      @Override
      public void start(String printerHost, AccessCredential credential) throws Exception {
        throw new IOException("relay crashed");
      }

      @Override
      public RelayFailureAction onFailure(Exception failure) {
        return RelayFailureAction.RETRY;
      }
    };
    ProxyConfig config = ProxyConfig.fromMap(Map.of("printerIp", "10.0.0.5", "accessCode", "12345678"));

    try {
      ExitCode code = RunCli.runRelay(crashing, config, delay -> {
        throw new InterruptedException("stop");
      });
      assertEquals(ExitCode.INTERRUPTED, code);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains(fragment));
  }
}
