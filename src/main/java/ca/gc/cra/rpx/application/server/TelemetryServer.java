package ca.gc.cra.rpx.application.server;

import ca.gc.cra.rpx.application.pipeline.SampleBatchQueue;
import ca.gc.cra.rpx.application.pipeline.SpectrumStreamingService;
import ca.gc.cra.rpx.application.port.SampleSource;
import ca.gc.cra.rpx.application.port.TransportInitException;
import ca.gc.cra.rpx.application.port.TransportListener;
import ca.gc.cra.rpx.application.port.TransportPort;
import ca.gc.cra.rpx.application.session.BroadcastRouter;
import ca.gc.cra.rpx.application.session.ConnectionRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lifecycle owner for one telemetry fan-out instance.
 * <p><strong>Why:</strong> Start and stop ordering matters: the transport binds before the worker starts, and on
 * shutdown the producer stops first, then the worker, then the transport, and finally the registry releases every
 * remaining connection.</p>
 * <p><strong>Role:</strong> Application service assembled by {@code CompositionRoot} and driven by the CLI.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} may be called from different threads;
 * {@link #close()} is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class TelemetryServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TelemetryServer.class);

  private final TransportPort transport;
  private final TransportListener listener;
  private final ConnectionRegistry registry;
  private final BroadcastRouter router;
  private final SampleBatchQueue queue;
  private final SpectrumStreamingService streaming;
  private final SampleSource source;
  private final Duration shutdownTimeout;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final CountDownLatch stopped = new CountDownLatch(1);

  public TelemetryServer(
      TransportPort transport,
      TransportListener listener,
      ConnectionRegistry registry,
      BroadcastRouter router,
      SampleBatchQueue queue,
      SpectrumStreamingService streaming,
      SampleSource source,
      Duration shutdownTimeout) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.router = Objects.requireNonNull(router, "router");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.streaming = Objects.requireNonNull(streaming, "streaming");
    this.source = Objects.requireNonNull(source, "source");
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
  }

  /**
   * Binds the transport, then starts the streaming worker and the sample source.
   *
   * @throws TransportInitException if the transport cannot bind; nothing else is started
   * @throws IllegalStateException if already started or closed
   */
  public void start() throws TransportInitException {
    if (closed.get() || !started.compareAndSet(false, true)) {
      throw new IllegalStateException("Telemetry server already started");
    }
    transport.start(listener);
    streaming.start();
    source.start(queue);
    log.info("Telemetry server started");
  }

  /**
   * Blocks until {@link #close()} completes or the timeout elapses.
   *
   * @param timeout maximum wait
   * @return {@code true} if the server stopped
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStop(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public BroadcastRouter router() {
    return router;
  }

  public ConnectionRegistry registry() {
    return registry;
  }

  public SpectrumStreamingService streaming() {
    return streaming;
  }

  public SampleBatchQueue queue() {
    return queue;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      source.close();
      try {
        if (!streaming.stop(shutdownTimeout)) {
          log.warn("Spectrum worker still running after {} ms", shutdownTimeout.toMillis());
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while stopping spectrum worker");
      }
      transport.close();
      int released = registry.clear();
      int discarded = queue.clear();
      log.info("Telemetry server stopped; released {} connections, discarded {} sample batches",
          released, discarded);
    } finally {
      stopped.countDown();
    }
  }
}
