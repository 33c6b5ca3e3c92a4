package ca.gc.cra.rpx.domain.spectrum;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class WorkerStateTest {

  @Test
  void advancesOnlyForward() {
    assertTrue(WorkerState.CREATED.canAdvanceTo(WorkerState.RUNNING));
    assertTrue(WorkerState.RUNNING.canAdvanceTo(WorkerState.TERMINATED));
    assertFalse(WorkerState.STOPPING.canAdvanceTo(WorkerState.RUNNING));
    assertFalse(WorkerState.TERMINATED.canAdvanceTo(WorkerState.TERMINATED));
    assertFalse(WorkerState.CREATED.canAdvanceTo(null));
  }

  @Test
  void tuningRejectsNegativeSpan() {
    assertThrows(IllegalArgumentException.class, () -> new Tuning(100e6, -1d));
    assertThrows(IllegalArgumentException.class, () -> new Tuning(Double.NaN, 1d));
  }
}
