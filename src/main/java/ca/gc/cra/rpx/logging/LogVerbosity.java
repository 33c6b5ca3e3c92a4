package ca.gc.cra.rpx.logging;

import ch.qos.logback.classic.Level;

/**
 * Operator-facing verbosity levels and their Logback severity floor.
 *
 * <p>Integer codes come from administrative input ({@code logLevel=N}):</p>
 * <pre>
 *   0 off, 1 trace, 2 debug, 3 info, 4 warn, 5 warn, 6 critical, anything else trace
 * </pre>
 * <p>Logback has no level above ERROR, so {@link #CRITICAL} maps to {@link Level#ERROR}.</p>
 *
 * @since 0.1.0
 */
public enum LogVerbosity {
  OFF(Level.OFF),
  TRACE(Level.TRACE),
  DEBUG(Level.DEBUG),
  INFO(Level.INFO),
  WARN(Level.WARN),
  CRITICAL(Level.ERROR);

  private final Level level;

  LogVerbosity(Level level) {
    this.level = level;
  }

  /**
   * Returns the Logback threshold for this verbosity.
   *
   * @return severity floor applied to the root logger
   */
  public Level level() {
    return level;
  }

  /**
   * Maps an administrative verbosity code to a level. Unknown codes select the most verbose level.
   *
   * @param code verbosity code
   * @return matching verbosity
   */
  public static LogVerbosity fromCode(int code) {
    switch (code) {
      case 0:
        return OFF;
      case 1:
        return TRACE;
      case 2:
        return DEBUG;
      case 3:
        return INFO;
      case 4:
      case 5:
        return WARN;
      case 6:
        return CRITICAL;
      default:
        return TRACE;
    }
  }
}
