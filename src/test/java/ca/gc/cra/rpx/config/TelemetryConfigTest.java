package ca.gc.cra.rpx.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.domain.spectrum.Tuning;
import ca.gc.cra.rpx.logging.LogVerbosity;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TelemetryConfigTest {

  @Test
  void defaultsMatchReferenceSettings() {
    TelemetryConfig config = TelemetryConfig.defaults();

    assertEquals("0.0.0.0", config.bindHost());
    assertEquals(9002, config.port());
    assertEquals("/", config.path());
    assertNull(config.certPath());
    assertEquals(512, config.nfft());
    assertEquals(5, config.lowWaterMark());
    assertEquals(Duration.ofMillis(100), config.reactorTimeout());
    assertEquals(LogVerbosity.INFO, config.verbosity());
    assertEquals(SampleSourceMode.NONE, config.source());
    assertFalse(config.transportSettings().tlsEnabled());
  }

  @Test
  void fromMapParsesOverrides() {
    TelemetryConfig config = TelemetryConfig.fromMap(Map.of(
        "port", "0",
        "nfft", "1024",
        "lowWaterMark", "2",
        "centerFrequencyHz", "101.1e6",
        "spanHz", "2.4e6",
        "defaultPermissions", "logs, admin ,",
        "source", "SWEEP",
        "logLevel", "6"));

    assertEquals(0, config.port());
    assertEquals(1024, config.streamingSettings().nfft());
    assertEquals(2, config.streamingSettings().lowWaterMark());
    assertEquals(new Tuning(101.1e6, 2.4e6), config.tuning());
    assertEquals(Set.of("logs", "admin"), config.defaultPermissions());
    assertEquals(SampleSourceMode.SWEEP, config.source());
    assertEquals(LogVerbosity.CRITICAL, config.verbosity());
  }

  @Test
  void certificateAndKeyEnableTls() {
    TelemetryConfig config = TelemetryConfig.fromMap(Map.of("certPath", "cert.pem", "keyPath", "key.pem"));

    assertTrue(config.transportSettings().tlsEnabled());
    assertTrue(config.certPath().isAbsolute());
  }

  @Test
  void certificateWithoutKeyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("certPath", "cert.pem")));
  }

  @Test
  void nfftMustBePowerOfTwo() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("nfft", "500")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("nfft", "8")));
  }

  @Test
  void lowWaterMarkMustFitInQueue() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("sampleQueueCapacity", "4", "lowWaterMark", "4")));
  }

  @Test
  void rejectsMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("port", "abc")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("port", "70000")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("path", "ws")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfig.fromMap(Map.of("source", "rtl")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("defaultPermissions", "logs;drop")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfig.fromMap(Map.of("reactorTimeoutMillis", "0")));
  }
}
