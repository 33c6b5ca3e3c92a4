package ca.gc.cra.rpx.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.SampleSource;
import ca.gc.cra.rpx.application.server.TelemetryServer;
import ca.gc.cra.rpx.infrastructure.dsp.PeriodogramEstimator;
import ca.gc.cra.rpx.infrastructure.source.SyntheticSweepSource;
import ca.gc.cra.rpx.testing.FakeTransport;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void sampleSourceFollowsConfiguredMode() {
    CompositionRoot none = new CompositionRoot(TelemetryConfig.defaults(), MetricsPort.NO_OP);
    CompositionRoot sweep = new CompositionRoot(TelemetryConfig.fromMap(Map.of("source", "sweep")), MetricsPort.NO_OP);

    assertSame(SampleSource.NONE, none.sampleSource());
    assertTrue(sweep.sampleSource() instanceof SyntheticSweepSource);
    assertTrue(none.spectrumEstimator() instanceof PeriodogramEstimator);
  }

  @Test
  void workerTracksRegistrySubscribers() {
    CompositionRoot root = new CompositionRoot(TelemetryConfig.defaults(), MetricsPort.NO_OP);
    FakeTransport transport = new FakeTransport();
    try (TelemetryServer server = root.telemetryServer(transport, SampleSource.NONE)) {
      server.registry().onConnect(4);

      assertEquals(1, server.streaming().worker().subscriberCount());
      assertEquals(512, server.streaming().worker().settings().nfft());
    }
  }
}
