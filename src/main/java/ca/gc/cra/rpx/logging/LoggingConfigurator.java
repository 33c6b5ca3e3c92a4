package ca.gc.cra.rpx.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures RPX runtime logging for CLI-driven startup.
 * <p><strong>Why:</strong> Lets operators pick a verbosity code and wires the client log relay once the router
 * exists, without editing {@code logback.xml}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Adjust the root logging level from a {@link LogVerbosity}.</li>
 *   <li>Attach and detach the {@link ClientLogAppender} for a {@link LogBridge}.</li>
 *   <li>Warn when the SLF4J backend is not Logback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the single bootstrap/shutdown thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyLevel(Level.DEBUG, "Verbose logging");
  }

  /**
   * Sets the root logger threshold for the given verbosity.
   *
   * @param verbosity operator-selected verbosity
   */
  public static void applyVerbosity(LogVerbosity verbosity) {
    Objects.requireNonNull(verbosity, "verbosity");
    applyLevel(verbosity.level(), "Verbosity " + verbosity);
  }

  /**
   * Attaches a client relay appender for {@code bridge} to the root logger and to every non-additive logger,
   * replacing any previous one.
   *
   * @param bridge bridge to relay through
   * @return {@code true} when the appender was attached; {@code false} for a detached bridge or non-Logback backend
   */
  public static boolean installLogBridge(LogBridge bridge) {
    Objects.requireNonNull(bridge, "bridge");
    uninstallLogBridge();
    if (!bridge.isAttached()) {
      log.debug("Log bridge detached; client log relay disabled");
      return false;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Client log relay requested but backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    ClientLogAppender appender = new ClientLogAppender(bridge);
    appender.setContext(context);
    appender.start();
    for (Logger target : relayTargets(context)) {
      target.addAppender(appender);
    }
    return true;
  }

  /**
   * Detaches and stops the client relay appender, if one is installed.
   *
   * @return {@code true} when an appender was removed
   */
  public static boolean uninstallLogBridge() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return false;
    }
    Appender<ILoggingEvent> appender = null;
    for (Logger target : relayTargets(context)) {
      Appender<ILoggingEvent> attached = target.getAppender(ClientLogAppender.NAME);
      if (attached != null) {
        target.detachAppender(attached);
        appender = attached;
      }
    }
    if (appender == null) {
      return false;
    }
    appender.stop();
    return true;
  }

  // Root plus every non-additive logger, so split sinks such as the application file log still relay.
  private static List<Logger> relayTargets(LoggerContext context) {
    List<Logger> targets = new ArrayList<>();
    targets.add(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
    for (Logger candidate : context.getLoggerList()) {
      if (!candidate.isAdditive() && !org.slf4j.Logger.ROOT_LOGGER_NAME.equals(candidate.getName())) {
        targets.add(candidate);
      }
    }
    return targets;
  }

  private static void applyLevel(Level level, String description) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("{} requested but backend {} does not support dynamic level updates",
        description, factory.getClass().getName());
  }
}
