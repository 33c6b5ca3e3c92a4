package ca.gc.cra.rpx.domain.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SampleBatchTest {

  @Test
  void interleavesInPhaseAndQuadrature() {
    SampleBatch batch = SampleBatch.of(new float[] {1f, 2f}, new float[] {3f, 4f});

    assertEquals(2, batch.sampleCount());
    assertArrayEquals(new float[] {1f, 3f, 2f, 4f}, batch.interleaved());
  }

  @Test
  void rejectsOddLength() {
    assertThrows(IllegalArgumentException.class, () -> new SampleBatch(new float[3]));
  }

  @Test
  void isDefensivelyCopied() {
    float[] raw = {1f, 1f};
    SampleBatch batch = new SampleBatch(raw);
    raw[0] = 9f;
    batch.interleaved()[1] = 9f;

    assertArrayEquals(new float[] {1f, 1f}, batch.interleaved());
  }

  @Test
  void copyIntoStopsAtTargetCapacity() {
    SampleBatch batch = new SampleBatch(new float[] {1f, 2f, 3f, 4f, 5f, 6f});
    float[] target = new float[4];

    assertEquals(2, batch.copyInto(target));
    assertArrayEquals(new float[] {1f, 2f, 3f, 4f}, target);
  }

  @Test
  void copyIntoLeavesTailUntouchedForShortBatch() {
    SampleBatch batch = new SampleBatch(new float[] {1f, 2f});
    float[] target = new float[6];

    assertEquals(1, batch.copyInto(target));
    assertArrayEquals(new float[] {1f, 2f, 0f, 0f, 0f, 0f}, target);
  }

  @Test
  void silenceIsZeroFilled() {
    SampleBatch batch = SampleBatch.silence(4);

    assertEquals(4, batch.sampleCount());
    assertArrayEquals(new float[8], batch.interleaved());
  }
}
