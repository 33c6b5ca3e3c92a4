package ca.gc.cra.rpx.infrastructure.metrics;

import ca.gc.cra.rpx.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry: {@code increment} feeds a counter and {@code observe} a long
 * histogram, each created lazily per metric key and cached.
 * <p>Metric names are prefixed with {@code rpx.}; the unmodified dotted key is attached as the
 * {@code rpx.metric.key} attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("rpx.metric.key");
  private static final String PREFIX = "rpx.";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  /**
   * Exports pending measurements; called during graceful shutdown.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(metricName(key))
        .setUnit("1")
        .setDescription("RPX counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(metricName(key))
        .ofLongs()
        .setDescription("RPX observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String metricName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(PREFIX.length() + lower.length()).append(PREFIX);
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    if (name.length() == PREFIX.length()) {
      name.append("metric");
    }
    return name.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
