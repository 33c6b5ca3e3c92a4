package ca.gc.cra.rpx.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.application.session.BroadcastRouter;
import ca.gc.cra.rpx.application.session.ConnectionRegistry;
import ca.gc.cra.rpx.testing.FakeTransport;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level previousLevel;

  @BeforeEach
  void setUp() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    previousLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    LoggingConfigurator.uninstallLogBridge();
    root.setLevel(previousLevel);
  }

  @Test
  void verbosityAdjustsRootLevel() {
    LoggingConfigurator.applyVerbosity(LogVerbosity.CRITICAL);
    assertEquals(Level.ERROR, root.getLevel());

    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void installedBridgeRelaysApplicationLogs() {
    ConnectionRegistry registry = new ConnectionRegistry();
    BroadcastRouter router = new BroadcastRouter(registry, new FakeTransport(), null);
    registry.onConnect(1).grant(LogBridge.LOGS_PERMISSION);

    assertTrue(LoggingConfigurator.installLogBridge(LogBridge.attachedTo(router)));
    assertNotNull(root.getAppender(ClientLogAppender.NAME));
    LoggerFactory.getLogger("ca.gc.cra.rpx.Relay").warn("overflow on channel {}", 3);

    String relayed = registry.get(1).orElseThrow().peekOutbound();
    assertNotNull(relayed);
    assertTrue(relayed.endsWith("Relay: overflow on channel 3"), relayed);
  }

  @Test
  void nonAdditiveLoggerStillRelaysOnce() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    Logger app = context.getLogger("ca.gc.cra.rpx.lifecycle");
    app.setAdditive(false);
    ConnectionRegistry registry = new ConnectionRegistry();
    BroadcastRouter router = new BroadcastRouter(registry, new FakeTransport(), null);
    registry.onConnect(1).grant(LogBridge.LOGS_PERMISSION);
    try {
      assertTrue(LoggingConfigurator.installLogBridge(LogBridge.attachedTo(router)));
      assertNotNull(app.getAppender(ClientLogAppender.NAME));
      LoggerFactory.getLogger("ca.gc.cra.rpx.lifecycle.Server").info("listening on {}", 9002);

      assertEquals(1, registry.get(1).orElseThrow().pendingCount());
      assertTrue(registry.get(1).orElseThrow().peekOutbound().endsWith("Server: listening on 9002"));

      assertTrue(LoggingConfigurator.uninstallLogBridge());
      assertNull(app.getAppender(ClientLogAppender.NAME));
    } finally {
      LoggingConfigurator.uninstallLogBridge();
      app.setAdditive(true);
    }
  }

  @Test
  void uninstallRemovesAppender() {
    ConnectionRegistry registry = new ConnectionRegistry();
    BroadcastRouter router = new BroadcastRouter(registry, new FakeTransport(), null);
    LoggingConfigurator.installLogBridge(LogBridge.attachedTo(router));

    assertTrue(LoggingConfigurator.uninstallLogBridge());
    assertFalse(LoggingConfigurator.uninstallLogBridge());
    assertNull(root.getAppender(ClientLogAppender.NAME));
  }

  @Test
  void detachedBridgeIsNotInstalled() {
    assertFalse(LoggingConfigurator.installLogBridge(LogBridge.detached()));
    assertNull(root.getAppender(ClientLogAppender.NAME));
  }
}
