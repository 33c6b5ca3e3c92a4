package ca.gc.cra.rpx.config;

import ca.gc.cra.rpx.application.pipeline.SampleBatchQueue;
import ca.gc.cra.rpx.application.pipeline.SpectrumPayloadEncoder;
import ca.gc.cra.rpx.application.pipeline.SpectrumStreamingService;
import ca.gc.cra.rpx.application.pipeline.SpectrumStreamingWorker;
import ca.gc.cra.rpx.application.port.ClockPort;
import ca.gc.cra.rpx.application.port.CommandHandler;
import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.SampleSource;
import ca.gc.cra.rpx.application.port.SpectrumEstimator;
import ca.gc.cra.rpx.application.port.TransportPort;
import ca.gc.cra.rpx.application.server.TelemetryServer;
import ca.gc.cra.rpx.application.session.BroadcastRouter;
import ca.gc.cra.rpx.application.session.ConnectionRegistry;
import ca.gc.cra.rpx.application.session.LoggingCommandHandler;
import ca.gc.cra.rpx.application.session.TelemetrySessionHandler;
import ca.gc.cra.rpx.infrastructure.dsp.PeriodogramEstimator;
import ca.gc.cra.rpx.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rpx.infrastructure.source.SyntheticSweepSource;
import ca.gc.cra.rpx.infrastructure.transport.NettyWebSocketTransport;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the telemetry server from a {@link TelemetryConfig}.
 * <p><strong>Why:</strong> One place translates configuration into the registry, router, session handler, streaming
 * worker, transport and sample source, so tests can swap the transport or metrics without touching the CLI.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the bootstrap thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Duration SHUTDOWN_GRACE_FLOOR = Duration.ofSeconds(2);

  private final TelemetryConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CommandHandler commandHandler;

  /**
   * Creates a root exporting metrics through OpenTelemetry.
   *
   * @param config validated configuration
   */
  public CompositionRoot(TelemetryConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  public CompositionRoot(TelemetryConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM, new LoggingCommandHandler());
  }

  /**
   * Creates a root with explicit collaborators.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   * @param clock clock for connection timestamps
   * @param commandHandler receiver for parsed client commands
   */
  public CompositionRoot(
      TelemetryConfig config, MetricsPort metrics, ClockPort clock, CommandHandler commandHandler) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.commandHandler = Objects.requireNonNull(commandHandler, "commandHandler");
  }

  /**
   * Builds a server on the Netty WebSocket transport.
   *
   * @return unstarted server
   */
  public TelemetryServer telemetryServer() {
    return telemetryServer(new NettyWebSocketTransport(config.transportSettings()), sampleSource());
  }

  /**
   * Builds a server on the supplied transport and source.
   *
   * @param transport transport to serve clients on
   * @param source sample producer
   * @return unstarted server
   */
  public TelemetryServer telemetryServer(TransportPort transport, SampleSource source) {
    ConnectionRegistry registry = new ConnectionRegistry(clock, metrics);
    BroadcastRouter router = new BroadcastRouter(registry, transport, metrics);
    TelemetrySessionHandler handler = new TelemetrySessionHandler(
        registry, router, commandHandler, config.defaultPermissions(), metrics);
    SampleBatchQueue queue = new SampleBatchQueue(config.sampleQueueCapacity(), metrics);
    SpectrumStreamingWorker worker = new SpectrumStreamingWorker(
        queue,
        spectrumEstimator(),
        new SpectrumPayloadEncoder(),
        router,
        transport,
        metrics,
        config.streamingSettings(),
        config.tuning());
    registry.addListener(worker);
    Duration shutdownTimeout = config.reactorTimeout().multipliedBy(4);
    if (shutdownTimeout.compareTo(SHUTDOWN_GRACE_FLOOR) < 0) {
      shutdownTimeout = SHUTDOWN_GRACE_FLOOR;
    }
    return new TelemetryServer(
        transport, handler, registry, router, queue, new SpectrumStreamingService(worker), source, shutdownTimeout);
  }

  /**
   * Builds the configured sample source.
   *
   * @return sweep generator or {@link SampleSource#NONE}
   */
  public SampleSource sampleSource() {
    switch (config.source()) {
      case SWEEP:
        return new SyntheticSweepSource(
            config.sweepSampleRate(),
            config.sweepBatchSize(),
            Duration.ofMillis(config.sweepIntervalMillis()),
            System.nanoTime());
      case NONE:
      default:
        return SampleSource.NONE;
    }
  }

  public SpectrumEstimator spectrumEstimator() {
    return new PeriodogramEstimator();
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public TelemetryConfig config() {
    return config;
  }

  /**
   * Flushes and closes the metrics exporter, if it is an OpenTelemetry adapter.
   */
  public void closeMetrics() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }
}
