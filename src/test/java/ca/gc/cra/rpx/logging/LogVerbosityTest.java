package ca.gc.cra.rpx.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

class LogVerbosityTest {

  @Test
  void mapsNumericCodes() {
    assertEquals(LogVerbosity.OFF, LogVerbosity.fromCode(0));
    assertEquals(LogVerbosity.TRACE, LogVerbosity.fromCode(1));
    assertEquals(LogVerbosity.DEBUG, LogVerbosity.fromCode(2));
    assertEquals(LogVerbosity.INFO, LogVerbosity.fromCode(3));
    assertEquals(LogVerbosity.WARN, LogVerbosity.fromCode(4));
    assertEquals(LogVerbosity.WARN, LogVerbosity.fromCode(5));
    assertEquals(LogVerbosity.CRITICAL, LogVerbosity.fromCode(6));
  }

  @Test
  void unknownCodesFallBackToTrace() {
    assertEquals(LogVerbosity.TRACE, LogVerbosity.fromCode(7));
    assertEquals(LogVerbosity.TRACE, LogVerbosity.fromCode(99));
    assertEquals(LogVerbosity.TRACE, LogVerbosity.fromCode(-1));
  }

  @Test
  void criticalMapsToLogbackError() {
    assertEquals(Level.ERROR, LogVerbosity.CRITICAL.level());
    assertEquals(Level.OFF, LogVerbosity.OFF.level());
  }
}
