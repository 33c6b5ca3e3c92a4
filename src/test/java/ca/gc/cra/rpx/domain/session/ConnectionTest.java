package ca.gc.cra.rpx.domain.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConnectionTest {
  private final Connection connection = new Connection(7, Instant.EPOCH);

  @Test
  void outboundBufferIsFifo() {
    connection.enqueue("a");
    connection.enqueue("b");

    assertEquals(2, connection.pendingCount());
    assertEquals("a", connection.peekOutbound());
    assertEquals("a", connection.pollOutbound());
    assertEquals("b", connection.pollOutbound());
    assertNull(connection.pollOutbound());
  }

  @Test
  void discardOutboundReportsDroppedCount() {
    connection.enqueue("a");
    connection.enqueue("b");
    connection.enqueue("c");

    assertEquals(3, connection.discardOutbound());
    assertEquals(0, connection.pendingCount());
  }

  @Test
  void missingAttributeReadsAsEmptyString() {
    assertEquals("", connection.attribute("mode"));
    assertEquals("", connection.attribute(null));
  }

  @Test
  void nullAttributeValueRemovesKey() {
    connection.setAttribute("mode", "fft");
    assertEquals("fft", connection.attribute("mode"));

    connection.setAttribute("mode", null);
    assertEquals("", connection.attribute("mode"));
  }

  @Test
  void userIsStoredAsAttribute() {
    connection.setUser("alice");

    assertEquals("alice", connection.user());
    assertEquals("alice", connection.attribute(Connection.USER_ATTRIBUTE));
  }

  @Test
  void permissionsCanBeGrantedAndRevoked() {
    connection.grant("logs");
    connection.grant("admin");
    connection.revoke("admin");
    connection.revoke(null);

    assertTrue(connection.hasPermission("logs"));
    assertFalse(connection.hasPermission("admin"));
    assertFalse(connection.hasPermission(null));
    assertEquals(Set.of("logs"), connection.permissions());
  }

  @Test
  void rejectsNullPayload() {
    assertThrows(NullPointerException.class, () -> connection.enqueue(null));
  }
}
