package ca.gc.cra.rpx.api;

import ca.gc.cra.rpx.application.port.TransportInitException;
import ca.gc.cra.rpx.application.server.TelemetryServer;
import ca.gc.cra.rpx.config.CompositionRoot;
import ca.gc.cra.rpx.config.TelemetryConfig;
import ca.gc.cra.rpx.config.YamlConfigLoader;
import ca.gc.cra.rpx.logging.LogBridge;
import ca.gc.cra.rpx.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the telemetry WebSocket server until the JVM is asked to stop or the streaming worker fails.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final Duration SUPERVISE_INTERVAL = Duration.ofSeconds(1);
  private static final String MODE = "serve";
  private static final String SUMMARY_USAGE =
      "usage: serve [config=FILE] [bindHost=HOST] [port=0-65535] [path=/P] [certPath=PEM keyPath=PEM] "
          + "[nfft=16-65536] [lowWaterMark=N] [sampleQueueCapacity=N] [reactorTimeoutMillis=1-60000] "
          + "[logLevel=0-6] [centerFrequencyHz=HZ] [spanHz=HZ] [defaultPermissions=a,b] [source=none|sweep] "
          + "[--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      RPX telemetry server

      Usage:
        serve [options]

      Transport:
        bindHost=HOST               Interface to bind (default 0.0.0.0)
        port=0-65535                Listening port (default 9002; 0 picks a free port)
        path=/P                     WebSocket path (default /)
        certPath=PEM keyPath=PEM    Enable TLS (wss://) with a PEM certificate chain and PKCS#8 key
        ioThreads=1-64              Reactor threads (default 1)

      Spectrum pipeline:
        nfft=16-65536               Bins per frame, power of two (default 512)
        lowWaterMark=N              Batches left queued before one is consumed (default 5)
        sampleQueueCapacity=N       Bounded sample queue size (default 64)
        reactorTimeoutMillis=MS     Worker wait bound and shutdown latency (default 100)
        centerFrequencyHz=HZ        Center frequency reported to clients (default 0)
        spanHz=HZ                   Span reported to clients (default 0)
        source=none|sweep           Sample producer (default none)
        sweepSampleRate=HZ          Sweep sample rate (default 1000000)
        sweepBatchSize=N            Sweep samples per batch (default 1024)
        sweepIntervalMillis=MS      Sweep batch period (default 20)

      Sessions and logging:
        defaultPermissions=a,b      Permissions granted to each client (e.g. logs)
        logLevel=0-6                0 off, 1 trace, 2 debug, 3 info, 4-5 warn, 6 critical (default 3)

      Other:
        config=FILE                 YAML file with 'common' and 'serve' sections; CLI values win
        metricsExporter=otlp|none   Configure metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without binding
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ServeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArray());
      TelemetryConfigurator.configureMetrics(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> merged;
    try {
      merged = mergeWithYaml(kv);
    } catch (IOException ex) {
      log.error("Unable to read config file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid config file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    TelemetryConfig config;
    try {
      config = TelemetryConfig.fromMap(merged);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.verbose()) {
      LoggingConfigurator.applyVerbosity(config.verbosity());
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = new CompositionRoot(config);
    TelemetryServer server = root.telemetryServer();
    Thread shutdownHook = new Thread(server::close, "rpx-shutdown");
    try {
      server.start();
      LoggingConfigurator.installLogBridge(LogBridge.attachedTo(server.router()));
      Runtime.getRuntime().addShutdownHook(shutdownHook);
      return supervise(server);
    } catch (TransportInitException ex) {
      log.error("Unable to start WebSocket listener: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Telemetry server interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in telemetry server", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      LoggingConfigurator.uninstallLogBridge();
      server.close();
      root.closeMetrics();
      removeShutdownHook(shutdownHook);
    }
  }

  private static ExitCode supervise(TelemetryServer server) throws InterruptedException {
    while (!server.awaitStop(SUPERVISE_INTERVAL)) {
      Optional<Throwable> failure = server.streaming().failure();
      if (failure.isPresent()) {
        log.error("Spectrum worker failed; stopping telemetry server", failure.get());
        return ExitCode.RUNTIME_FAILURE;
      }
    }
    log.info("Telemetry server shut down");
    return ExitCode.SUCCESS;
  }

  static Map<String, String> mergeWithYaml(Map<String, String> cli) throws IOException {
    Map<String, String> merged = new LinkedHashMap<>();
    String configPath = cli.remove("config");
    if (configPath != null && !configPath.isBlank()) {
      Path path;
      try {
        path = Path.of(configPath.trim());
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("config is not a valid path: " + configPath, ex);
      }
      merged.putAll(YamlConfigLoader.load(path, MODE));
      log.debug("Loaded {} settings from {}", merged.size(), path);
    }
    merged.putAll(cli);
    return merged;
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook left registered");
    }
  }

  private static void printDryRunPlan(TelemetryConfig config) {
    String tls = config.certPath() == null ? "disabled" : config.certPath() + " / " + config.keyPath();
    CliPrinter.printLines(
        "Serve dry-run: no socket will be bound.",
        " Listen           : " + config.transportSettings().scheme() + "://" + config.bindHost() + ":"
            + config.port() + config.path(),
        " TLS              : " + tls,
        " Reactor threads  : " + config.ioThreads(),
        " nfft             : " + config.nfft(),
        " Low-water mark   : " + config.lowWaterMark(),
        " Sample queue     : " + config.sampleQueueCapacity(),
        " Reactor timeout  : " + config.reactorTimeoutMillis() + " ms",
        " Tuning           : center=" + config.centerFrequencyHz() + " Hz span=" + config.spanHz() + " Hz",
        " Log level        : " + config.logLevel() + " (" + config.verbosity() + ")",
        " Permissions      : " + (config.defaultPermissions().isEmpty()
            ? "<none>" : String.join(",", config.defaultPermissions())),
        " Sample source    : " + config.source(),
        " Re-run without --dry-run to start serving.");
  }
}
