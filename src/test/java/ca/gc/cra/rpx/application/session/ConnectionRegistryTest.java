package ca.gc.cra.rpx.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rpx.domain.session.Connection;
import ca.gc.cra.rpx.testing.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConnectionRegistryTest {
  private RecordingMetricsPort metrics;
  private ConnectionRegistry registry;
  private final List<String> events = new ArrayList<>();

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    registry = new ConnectionRegistry(() -> 1_000L, metrics);
    registry.addListener(new RegistryListener() {
      @Override
      public void connectionAdded(Connection connection) {
        events.add("+" + connection.id());
      }

      @Override
      public void connectionRemoved(Connection connection) {
        events.add("-" + connection.id());
      }
    });
  }

  @Test
  void connectRegistersConnectionWithClockTimestamp() {
    Connection connection = registry.onConnect(1);

    assertEquals(1, connection.id());
    assertEquals(Instant.ofEpochMilli(1_000L), connection.createdAt());
    assertSame(connection, registry.get(1).orElseThrow());
    assertEquals(1, metrics.count("session.connect"));
    assertEquals(List.of("+1"), events);
  }

  @Test
  void duplicateConnectKeepsExistingConnection() {
    Connection first = registry.onConnect(1);
    first.enqueue("pending");

    DuplicateConnectionException ex =
        assertThrows(DuplicateConnectionException.class, () -> registry.onConnect(1));

    assertEquals(1, ex.clientId());
    assertSame(first, registry.get(1).orElseThrow());
    assertEquals(1, first.pendingCount());
    assertEquals(List.of("+1"), events);
  }

  @Test
  void disconnectReleasesBufferAndNotifiesListeners() {
    Connection connection = registry.onConnect(2);
    connection.enqueue("a");
    connection.enqueue("b");

    assertTrue(registry.onDisconnect(2));

    assertTrue(registry.get(2).isEmpty());
    assertEquals(0, connection.pendingCount());
    assertEquals(List.of(2L), metrics.observed("session.release.dropped"));
    assertEquals(List.of("+2", "-2"), events);
  }

  @Test
  void disconnectOfUnknownClientIsIgnored() {
    assertFalse(registry.onDisconnect(99));
    assertEquals(0, metrics.count("session.disconnect"));
    assertTrue(events.isEmpty());
  }

  @Test
  void errorRemovesConnection() {
    Logger logger = (Logger) LoggerFactory.getLogger(ConnectionRegistry.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    registry.onConnect(3);
    try {
      assertTrue(registry.onError(3, "Error writing to socket"));
      assertFalse(registry.onError(3, "again"));
    } finally {
      logger.detachAppender(appender);
    }

    assertEquals(0, registry.size());
    assertEquals(1, metrics.count("session.error"));
    assertEquals(List.of("+3", "-3"), events);
    List<ILoggingEvent> errors = appender.list.stream()
        .filter(event -> event.getLevel() == Level.ERROR)
        .toList();
    assertEquals(1, errors.size());
    assertEquals("Error: Error writing to socket on client 3", errors.get(0).getFormattedMessage());
  }

  @Test
  void idsIsSnapshot() {
    registry.onConnect(1);
    registry.onConnect(2);
    Set<Integer> ids = registry.ids();

    registry.onDisconnect(1);

    assertEquals(Set.of(1, 2), ids);
    assertEquals(Set.of(2), registry.ids());
  }

  @Test
  void clearReleasesEveryConnection() {
    registry.onConnect(1);
    registry.onConnect(2);

    assertEquals(2, registry.clear());

    assertEquals(0, registry.size());
    assertEquals(4, events.size());
  }
}
