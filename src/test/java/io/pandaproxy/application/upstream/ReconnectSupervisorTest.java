package io.pandaproxy.application.upstream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pandaproxy.application.port.ClockPort;
import io.pandaproxy.application.port.Sleeper;
import io.pandaproxy.application.port.UpstreamConnector;
import io.pandaproxy.domain.chamber.AccessCredential;
import io.pandaproxy.domain.chamber.ChamberFrameCodec;
import io.pandaproxy.domain.chamber.Frame;
import io.pandaproxy.domain.chamber.HandshakeException;
import io.pandaproxy.domain.events.ProxyEvent;
import io.pandaproxy.domain.events.ProxyEventType;
import io.pandaproxy.domain.upstream.UpstreamState;
import io.pandaproxy.testutil.FakePrinter;
import io.pandaproxy.testutil.Frames;
import io.pandaproxy.testutil.RecordingEvents;
import io.pandaproxy.testutil.RecordingMetrics;
import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ReconnectSupervisorTest {
  private static final AccessCredential CREDENTIAL = AccessCredential.forAccessCode("12345678");
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingEvents events = new RecordingEvents();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final BlockingQueue<Frame> published = new LinkedBlockingQueue<>();
  private FakePrinter printer;
  private ReconnectSupervisor supervisor;

  @AfterEach
  void tearDown() throws IOException {
    if (supervisor != null) {
      supervisor.stop();
    }
    if (printer != null) {
      printer.close();
    }
  }

  @Test
  void retriesWithGrowingDelaysUntilPrinterAnswers() throws Exception {
    printer = new FakePrinter(CREDENTIAL);
    AtomicInteger attempts = new AtomicInteger();
    UpstreamConnector flaky = () -> {
      if (attempts.incrementAndGet() <= 3) {
        throw new HandshakeException("printer offline", null);
      }
      return connect(printer.port());
    };
    supervisor = supervisor(flaky);

    supervisor.start();

    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));
    assertEquals(List.of(10L, 20L, 40L), sleeper.millis());
    assertEquals(3, metrics.counter("upstream.failures.handshake"));
    assertEquals(4, metrics.counter("upstream.connect.attempts"));

    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));
    Frame frame = Frames.jpeg(9_000, 3);
    printer.send(frame);
    Frame received = published.poll(5, TimeUnit.SECONDS);
    assertNotNull(received);
    assertArrayEquals(frame.payload(), received.payload());
  }

  @Test
  void successfulStreamResetsBackoff() throws Exception {
    printer = new FakePrinter(CREDENTIAL);
    AtomicInteger attempts = new AtomicInteger();
    UpstreamConnector connector = () -> {
      if (attempts.incrementAndGet() <= 2) {
        throw new HandshakeException("printer offline", null);
      }
      return connect(printer.port());
    };
    supervisor = supervisor(connector);
    supervisor.start();
    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));
    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));

    printer.disconnect();

    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));
    assertEquals(List.of(10L, 20L, 10L), sleeper.millis());
    assertEquals(1, metrics.counter("upstream.failures.io"));
  }

  @Test
  void rejectedAccessCodeKeepsRetryingUntilAccepted() throws Exception {
    printer = new FakePrinter(AccessCredential.forAccessCode("other-code"));
    supervisor = supervisor(() -> connect(printer.port()));
    supervisor.start();

    waitFor(() -> printer.rejections() >= 2);
    printer.accept(CREDENTIAL);

    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));
    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));
    assertTrue(metrics.counter("upstream.failures.auth") >= 2);
    List<ProxyEvent> rejected = events.ofType(ProxyEventType.UPSTREAM_AUTH_REJECTED);
    assertTrue(rejected.size() >= 2);

    Frame frame = Frames.jpeg(15_000, 2);
    printer.send(frame);
    assertArrayEquals(frame.payload(), published.poll(5, TimeUnit.SECONDS).payload());
  }

  @Test
  void unexpectedConnectorFailureIsRetried() throws Exception {
    printer = new FakePrinter(CREDENTIAL);
    AtomicInteger attempts = new AtomicInteger();
    UpstreamConnector broken = () -> {
      if (attempts.incrementAndGet() == 1) {
        throw new IllegalStateException("socket factory not initialised");
      }
      return connect(printer.port());
    };
    supervisor = supervisor(broken);

    supervisor.start();

    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));
    assertEquals(1, metrics.counter("upstream.failures.unexpected"));
    assertEquals(List.of(10L), sleeper.millis());

    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));
    Frame frame = Frames.jpeg(12_000, 5);
    printer.send(frame);
    assertArrayEquals(frame.payload(), published.poll(5, TimeUnit.SECONDS).payload());
  }

  @Test
  void failingSinkDoesNotEndSupervision() throws Exception {
    printer = new FakePrinter(CREDENTIAL);
    AtomicInteger deliveries = new AtomicInteger();
    ChamberFrameCodec codec = new ChamberFrameCodec();
    supervisor = new ReconnectSupervisor(
        () -> new UpstreamSession(() -> connect(printer.port()), CREDENTIAL, codec,
            Duration.ofMillis(200), Duration.ofSeconds(5), metrics),
        frame -> {
          if (deliveries.incrementAndGet() == 1) {
            throw new IllegalStateException("sink failed");
          }
          published.add(frame);
        },
        new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(1_000), () -> 0d),
        sleeper,
        events,
        ClockPort.SYSTEM,
        metrics);
    supervisor.start();
    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));

    printer.send(Frames.jpeg(9_000, 1));
    waitFor(() -> metrics.counter("upstream.failures.unexpected") == 1);
    waitFor(() -> printer.connections() >= 2);
    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));
    assertTrue(printer.awaitAuthenticated(5, TimeUnit.SECONDS));

    Frame frame = Frames.jpeg(9_000, 2);
    printer.send(frame);
    assertArrayEquals(frame.payload(), published.poll(5, TimeUnit.SECONDS).payload());
  }

  @Test
  void stopEndsInDisconnected() throws Exception {
    printer = new FakePrinter(CREDENTIAL);
    supervisor = supervisor(() -> connect(printer.port()));
    supervisor.start();
    assertTrue(supervisor.awaitState(UpstreamState.STREAMING, WAIT));

    supervisor.stop();

    assertEquals(UpstreamState.DISCONNECTED, supervisor.state());
    List<ProxyEvent> transitions = events.ofType(ProxyEventType.UPSTREAM_STATE);
    assertEquals("DISCONNECTED", transitions.get(0).attributes().get("from"));
    assertEquals("CONNECTING", transitions.get(0).attributes().get("to"));
    assertEquals("DISCONNECTED", transitions.get(transitions.size() - 1).attributes().get("to"));
  }

  private ReconnectSupervisor supervisor(UpstreamConnector connector) {
    ChamberFrameCodec codec = new ChamberFrameCodec();
    return new ReconnectSupervisor(
        () -> new UpstreamSession(connector, CREDENTIAL, codec,
            Duration.ofMillis(200), Duration.ofSeconds(5), metrics),
        published::add,
        new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(1_000), () -> 0d),
        sleeper,
        events,
        ClockPort.SYSTEM,
        metrics);
  }

  private static Socket connect(int port) throws HandshakeException {
    try {
      return new Socket(InetAddress.getLoopbackAddress(), port);
    } catch (IOException ex) {
      throw new HandshakeException("connect failed", ex);
    }
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + WAIT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within " + WAIT);
      }
      Thread.sleep(10);
    }
  }

  private static final class RecordingSleeper implements Sleeper {
    private final List<Long> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration delay) throws InterruptedException {
      delays.add(delay.toMillis());
      Thread.sleep(5);
    }

    List<Long> millis() {
      return List.copyOf(delays);
    }
  }
}
