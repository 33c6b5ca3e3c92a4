package ca.gc.cra.rpx.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ActivitySignalTest {
  private final ActivitySignal signal = new ActivitySignal();

  @Test
  void awaitTimesOutWithoutActivity() throws InterruptedException {
    long started = System.nanoTime();

    assertFalse(signal.await(Duration.ofMillis(30)));

    assertTrue(System.nanoTime() - started >= TimeUnit.MILLISECONDS.toNanos(25));
  }

  @Test
  void signalWakesWaiter() throws Exception {
    CountDownLatch waiting = new CountDownLatch(1);
    AtomicBoolean woke = new AtomicBoolean();
    Thread waiter = new Thread(() -> {
      try {
        waiting.countDown();
        woke.set(signal.await(Duration.ofSeconds(5)));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();
    assertTrue(waiting.await(1, TimeUnit.SECONDS));
    Thread.sleep(20);

    signal.signal();
    waiter.join(2_000);

    assertFalse(waiter.isAlive());
    assertTrue(woke.get());
    assertEquals(1L, signal.generation());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> signal.await(Duration.ZERO));
  }
}
