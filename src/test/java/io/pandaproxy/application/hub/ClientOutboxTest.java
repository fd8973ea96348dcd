package io.pandaproxy.application.hub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pandaproxy.application.port.MetricsPort;
import io.pandaproxy.domain.chamber.Frame;
import io.pandaproxy.testutil.Frames;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ClientOutboxTest {

  @Test
  void fullOutboxDropsOldestFrame() throws InterruptedException {
    ClientOutbox outbox = new ClientOutbox(2, MetricsPort.NO_OP);
    Frame first = Frames.jpeg(4, 1);
    Frame second = Frames.jpeg(4, 2);
    Frame third = Frames.jpeg(4, 3);

    assertTrue(outbox.offer(first));
    assertTrue(outbox.offer(second));
    assertTrue(outbox.offer(third));

    assertEquals(1, outbox.droppedFrames());
    assertEquals(2, outbox.queued());
    assertSame(second, outbox.take(0, TimeUnit.MILLISECONDS));
    assertSame(third, outbox.take(0, TimeUnit.MILLISECONDS));
  }

  @Test
  void takeTimesOutWhenEmpty() throws InterruptedException {
    assertNull(new ClientOutbox(1, MetricsPort.NO_OP).take(20, TimeUnit.MILLISECONDS));
  }

  @Test
  void closeWakesWaitingConsumerAndRefusesOffers() throws InterruptedException {
    ClientOutbox outbox = new ClientOutbox(4, MetricsPort.NO_OP);
    CountDownLatch waiting = new CountDownLatch(1);
    AtomicReference<Frame> taken = new AtomicReference<>(Frames.jpeg(1, 0));
    Thread consumer = new Thread(() -> {
      waiting.countDown();
      try {
        taken.set(outbox.take(10, TimeUnit.SECONDS));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    consumer.start();
    assertTrue(waiting.await(1, TimeUnit.SECONDS));

    outbox.close();
    consumer.join(2_000);

    assertFalse(consumer.isAlive());
    assertNull(taken.get());
    assertTrue(outbox.isClosed());
    assertFalse(outbox.offer(Frames.jpeg(4, 9)));
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ClientOutbox(0, MetricsPort.NO_OP));
  }
}
