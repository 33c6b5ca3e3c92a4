package ca.gc.cra.rpx.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.application.port.SpectrumEstimator;
import ca.gc.cra.rpx.application.session.BroadcastRouter;
import ca.gc.cra.rpx.application.session.ConnectionRegistry;
import ca.gc.cra.rpx.domain.spectrum.SampleBatch;
import ca.gc.cra.rpx.domain.spectrum.Tuning;
import ca.gc.cra.rpx.testing.FakeTransport;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SpectrumStreamingServiceTest {
  private final ConnectionRegistry registry = new ConnectionRegistry();
  private final FakeTransport transport = new FakeTransport();
  private final SampleBatchQueue queue = new SampleBatchQueue(8, null);

  private SpectrumStreamingWorker worker(SpectrumEstimator estimator) {
    SpectrumStreamingWorker worker = new SpectrumStreamingWorker(
        queue,
        estimator,
        new SpectrumPayloadEncoder(),
        new BroadcastRouter(registry, transport, null),
        transport,
        null,
        new StreamingSettings(16, 0, Duration.ofMillis(10)),
        Tuning.UNTUNED);
    registry.addListener(worker);
    return worker;
  }

  @Test
  void stopTerminatesWorkerWithinTimeout() throws Exception {
    SpectrumStreamingService service = new SpectrumStreamingService(worker((iq, n, nfft) -> new float[nfft]));
    service.start();
    assertTrue(service.isRunning());

    assertTrue(service.stop(Duration.ofSeconds(2)));

    assertFalse(service.isRunning());
    assertTrue(service.worker().isTerminated());
    assertTrue(service.failure().isEmpty());
  }

  @Test
  void stopBeforeStartIsHarmless() throws Exception {
    SpectrumStreamingService service = new SpectrumStreamingService(worker((iq, n, nfft) -> new float[nfft]));

    assertTrue(service.stop(Duration.ofMillis(100)));
    assertTrue(service.worker().isStopping());
  }

  @Test
  void startTwiceIsRejected() throws Exception {
    SpectrumStreamingService service = new SpectrumStreamingService(worker((iq, n, nfft) -> new float[nfft]));
    service.start();
    try {
      assertThrows(IllegalStateException.class, service::start);
    } finally {
      service.stop(Duration.ofSeconds(2));
    }
  }

  @Test
  void workerFailureIsRecorded() throws Exception {
    SpectrumStreamingService service = new SpectrumStreamingService(worker((iq, n, nfft) -> {
      throw new IllegalStateException("fft failed");
    }));
    registry.onConnect(1);
    queue.offer(SampleBatch.silence(16));
    service.start();

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (service.failure().isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertEquals("fft failed", service.failure().orElseThrow().getMessage());
    assertTrue(service.worker().isTerminated());
    assertTrue(service.stop(Duration.ofSeconds(1)));
  }
}
