package ca.gc.cra.rpx.config;

import ca.gc.cra.rpx.application.pipeline.StreamingSettings;
import ca.gc.cra.rpx.domain.spectrum.Tuning;
import ca.gc.cra.rpx.infrastructure.transport.TransportSettings;
import ca.gc.cra.rpx.logging.LogVerbosity;
import ca.gc.cra.rpx.validation.Numbers;
import ca.gc.cra.rpx.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings for the {@code serve} command.
 * <p><strong>Why:</strong> Collects transport, pipeline, logging and sample source options in one immutable value
 * so the composition root never sees unchecked input.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param bindHost interface to bind
 * @param port listening port; {@code 0} picks an ephemeral port
 * @param path WebSocket upgrade path
 * @param certPath TLS certificate; {@code null} for plain WebSocket
 * @param keyPath TLS private key; set together with {@code certPath}
 * @param ioThreads transport reactor threads
 * @param nfft spectrum bins per frame
 * @param lowWaterMark queued batches the worker leaves untouched
 * @param sampleQueueCapacity bounded sample queue size
 * @param reactorTimeoutMillis upper bound on one worker wait; bounds shutdown latency
 * @param logLevel verbosity code (0 off .. 6 critical)
 * @param centerFrequencyHz center frequency reported to clients
 * @param spanHz span reported to clients
 * @param defaultPermissions capabilities granted to each new connection
 * @param source sample producer
 * @param sweepSampleRate sweep source sample rate
 * @param sweepBatchSize sweep source samples per batch
 * @param sweepIntervalMillis sweep source batch period
 * @since 0.1.0
 */
public record TelemetryConfig(
    String bindHost,
    int port,
    String path,
    Path certPath,
    Path keyPath,
    int ioThreads,
    int nfft,
    int lowWaterMark,
    int sampleQueueCapacity,
    int reactorTimeoutMillis,
    int logLevel,
    double centerFrequencyHz,
    double spanHz,
    Set<String> defaultPermissions,
    SampleSourceMode source,
    double sweepSampleRate,
    int sweepBatchSize,
    int sweepIntervalMillis) {

  static final int DEFAULT_PORT = 9002;
  private static final int MIN_NFFT = 16;
  private static final int MAX_NFFT = 65_536;
  private static final int MAX_IO_THREADS = 64;
  private static final int MAX_QUEUE_CAPACITY = 65_536;
  private static final int MIN_REACTOR_TIMEOUT_MILLIS = 1;
  private static final int MAX_REACTOR_TIMEOUT_MILLIS = 60_000;
  private static final int MAX_SWEEP_BATCH = 1 << 20;
  private static final int MAX_SWEEP_INTERVAL_MILLIS = 60_000;

  public TelemetryConfig {
    bindHost = Strings.requireNonBlank("bindHost", bindHost);
    Numbers.requireRange("port", port, 0, 65_535);
    path = Strings.requireNonBlank("path", path);
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/' (was " + path + ")");
    }
    if ((certPath == null) != (keyPath == null)) {
      throw new IllegalArgumentException("certPath and keyPath must be provided together");
    }
    Numbers.requireRange("ioThreads", ioThreads, 1, MAX_IO_THREADS);
    Numbers.requirePowerOfTwo("nfft", nfft, MIN_NFFT, MAX_NFFT);
    Numbers.requireRange("sampleQueueCapacity", sampleQueueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange("lowWaterMark", lowWaterMark, 0, sampleQueueCapacity - 1L);
    Numbers.requireRange("reactorTimeoutMillis", reactorTimeoutMillis,
        MIN_REACTOR_TIMEOUT_MILLIS, MAX_REACTOR_TIMEOUT_MILLIS);
    Numbers.requireFiniteNonNegative("centerFrequencyHz", centerFrequencyHz);
    Numbers.requireFiniteNonNegative("spanHz", spanHz);
    Set<String> permissions = new LinkedHashSet<>();
    for (String permission : Objects.requireNonNullElse(defaultPermissions, Set.<String>of())) {
      permissions.add(Strings.requireToken("defaultPermissions", permission));
    }
    defaultPermissions = Set.copyOf(permissions);
    source = Objects.requireNonNullElse(source, SampleSourceMode.NONE);
    if (!(sweepSampleRate > 0d) || !Double.isFinite(sweepSampleRate)) {
      throw new IllegalArgumentException("sweepSampleRate must be a positive number (was " + sweepSampleRate + ")");
    }
    Numbers.requireRange("sweepBatchSize", sweepBatchSize, 1, MAX_SWEEP_BATCH);
    Numbers.requireRange("sweepIntervalMillis", sweepIntervalMillis, 1, MAX_SWEEP_INTERVAL_MILLIS);
  }

  /**
   * Default settings: plain WebSocket on {@code 0.0.0.0:9002/}, 512 bins, no sample source.
   *
   * @return default configuration
   */
  public static TelemetryConfig defaults() {
    return new TelemetryConfig(
        "0.0.0.0",
        DEFAULT_PORT,
        "/",
        null,
        null,
        1,
        StreamingSettings.DEFAULT_NFFT,
        StreamingSettings.DEFAULT_LOW_WATER_MARK,
        64,
        (int) StreamingSettings.DEFAULT_REACTOR_TIMEOUT.toMillis(),
        3,
        0d,
        0d,
        Set.of(),
        SampleSourceMode.NONE,
        1_000_000d,
        1_024,
        20);
  }

  /**
   * Builds a configuration from flattened {@code key=value} pairs, falling back to {@link #defaults()}.
   *
   * @param kv configuration values; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static TelemetryConfig fromMap(Map<String, String> kv) {
    Map<String, String> values = kv == null ? Map.of() : kv;
    TelemetryConfig d = defaults();
    return new TelemetryConfig(
        values.getOrDefault("bindHost", d.bindHost()),
        parseInt(values, "port", d.port()),
        values.getOrDefault("path", d.path()),
        parseOptionalPath("certPath", values.get("certPath")),
        parseOptionalPath("keyPath", values.get("keyPath")),
        parseInt(values, "ioThreads", d.ioThreads()),
        parseInt(values, "nfft", d.nfft()),
        parseInt(values, "lowWaterMark", d.lowWaterMark()),
        parseInt(values, "sampleQueueCapacity", d.sampleQueueCapacity()),
        parseInt(values, "reactorTimeoutMillis", d.reactorTimeoutMillis()),
        parseInt(values, "logLevel", d.logLevel()),
        parseDouble(values, "centerFrequencyHz", d.centerFrequencyHz()),
        parseDouble(values, "spanHz", d.spanHz()),
        parsePermissions(values.get("defaultPermissions")),
        SampleSourceMode.fromString(values.get("source")),
        parseDouble(values, "sweepSampleRate", d.sweepSampleRate()),
        parseInt(values, "sweepBatchSize", d.sweepBatchSize()),
        parseInt(values, "sweepIntervalMillis", d.sweepIntervalMillis()));
  }

  public TransportSettings transportSettings() {
    return new TransportSettings(bindHost, port, path, certPath, keyPath, ioThreads);
  }

  public StreamingSettings streamingSettings() {
    return new StreamingSettings(nfft, lowWaterMark, reactorTimeout());
  }

  public Duration reactorTimeout() {
    return Duration.ofMillis(reactorTimeoutMillis);
  }

  public Tuning tuning() {
    return new Tuning(centerFrequencyHz, spanHz);
  }

  public LogVerbosity verbosity() {
    return LogVerbosity.fromCode(logLevel);
  }

  private static int parseInt(Map<String, String> kv, String key, int fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(Map<String, String> kv, String key, double fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static Path parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Set<String> parsePermissions(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    Set<String> permissions = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        permissions.add(token.trim());
      }
    }
    return permissions;
  }
}
