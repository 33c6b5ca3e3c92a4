package ca.gc.cra.rpx.application.pipeline;

import ca.gc.cra.rpx.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link SpectrumStreamingWorker} on a dedicated non-daemon thread named {@code rpx-spectrum-N}.
 * <p>A worker failure is recorded and exposed through {@link #failure()}; it never affects the transport or other
 * connections. Restarting a failed worker is left to the supervisor, which must build a new worker.</p>
 *
 * @since 0.1.0
 */
public final class SpectrumStreamingService {
  private static final Logger log = LoggerFactory.getLogger(SpectrumStreamingService.class);

  private final SpectrumStreamingWorker worker;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private volatile ExecutorService executor;

  public SpectrumStreamingService(SpectrumStreamingWorker worker) {
    this.worker = Objects.requireNonNull(worker, "worker");
  }

  /**
   * Starts the worker thread.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Spectrum streaming already started");
    }
    ExecutorService exec = ExecutorFactories.newWorkerPool(1, "rpx-spectrum", this::handleCrash);
    this.executor = exec;
    exec.execute(this::runWorker);
  }

  /**
   * Requests termination and waits up to {@code timeout} for the worker thread to exit.
   *
   * @param timeout maximum wait
   * @return {@code true} if the worker terminated within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean stop(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    worker.terminate();
    ExecutorService exec = executor;
    if (exec == null) {
      return true;
    }
    exec.shutdown();
    if (exec.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return true;
    }
    log.warn("Spectrum worker did not stop within {} ms; interrupting", timeout.toMillis());
    exec.shutdownNow();
    return exec.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the failure that ended the worker loop, if any.
   *
   * @return worker failure
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure.get());
  }

  public boolean isRunning() {
    return started.get() && !worker.isTerminated();
  }

  public SpectrumStreamingWorker worker() {
    return worker;
  }

  private void runWorker() {
    try {
      worker.run();
    } catch (RuntimeException | Error ex) {
      failure.compareAndSet(null, ex);
    }
  }

  private void handleCrash(Thread thread, Throwable ex) {
    failure.compareAndSet(null, ex);
    log.error("Spectrum thread {} terminated unexpectedly", thread.getName(), ex);
  }
}
