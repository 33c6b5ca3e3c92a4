package ca.gc.cra.rpx.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named threads RPX runs on: the spectrum streaming worker, sample sources and the
 * transport event loops.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "rpx-worker";

  private ExecutorFactories() {}

  /**
   * Builds a thread factory that names threads {@code prefix-N}.
   *
   * @param prefix thread-name prefix; blank falls back to {@code rpx-worker}
   * @param daemon whether created threads are daemons
   * @param handler uncaught exception handler installed on each thread; {@code null} installs a no-op
   * @return thread factory
   */
  public static ThreadFactory namedThreadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Builds a fixed-size executor of non-daemon threads that rejects work beyond {@code size} concurrent tasks.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreadFactory(prefix, false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
