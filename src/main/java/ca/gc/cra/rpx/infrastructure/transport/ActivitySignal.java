package ca.gc.cra.rpx.infrastructure.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generation counter that lets threads wait, with a finite timeout, for the next reactor event.
 *
 * <p>Every call to {@link #signal()} advances the generation and wakes all waiters. A waiter returns {@code true}
 * only if the generation moved while it was waiting, so signals raised before the wait began are not counted.</p>
 *
 * @since 0.1.0
 */
public final class ActivitySignal {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition advanced = lock.newCondition();
  private long generation;

  /**
   * Records one event and wakes every waiter.
   */
  public void signal() {
    lock.lock();
    try {
      generation++;
      advanced.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next {@link #signal()} or until the timeout elapses.
   *
   * @param timeout maximum wait; must be positive
   * @return {@code true} if signalled, {@code false} on timeout
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    long remaining = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      long observed = generation;
      while (generation == observed) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = advanced.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of signals raised so far.
   *
   * @return current generation
   */
  public long generation() {
    lock.lock();
    try {
      return generation;
    } finally {
      lock.unlock();
    }
  }
}
