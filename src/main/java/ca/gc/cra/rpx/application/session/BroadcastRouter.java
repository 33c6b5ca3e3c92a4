package ca.gc.cra.rpx.application.session;

import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.TransportPort;
import ca.gc.cra.rpx.domain.session.Connection;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Buffered multicast over the {@link ConnectionRegistry}.
 * <p><strong>Why:</strong> Producers (the streaming worker, the log bridge) enqueue text without touching sockets;
 * the reactor drains each client's buffer when the transport reports it writable.</p>
 * <p><strong>Role:</strong> Application service between producers and the {@link TransportPort}.</p>
 * <p><strong>Thread-safety:</strong> {@link #send}, {@link #broadcast} and {@link #broadcastToPermission} are safe from
 * any thread. {@link #flush(int)} must only run on the reactor thread.</p>
 * <p><strong>Delivery:</strong> Best effort and at most once. A partial write removes the connection and drops the
 * rest of its buffer without retry.</p>
 * <p><strong>Observability:</strong> Emits {@code router.send.dropped}, {@code router.write.failure} and
 * {@code router.flush.messages}.</p>
 *
 * @since 0.1.0
 */
public final class BroadcastRouter {
  private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

  static final String WRITE_ERROR = "Error writing to socket";

  private final ConnectionRegistry registry;
  private final TransportPort transport;
  private final MetricsPort metrics;

  /**
   * Creates a router.
   *
   * @param registry connection registry shared with the session handler
   * @param transport transport used for writes and writable requests
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public BroadcastRouter(ConnectionRegistry registry, TransportPort transport, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Appends a payload to one client's buffer and asks the transport for a writable callback.
   * Silently dropped when the client is not registered.
   *
   * @param clientId target client
   * @param payload text payload
   * @return {@code true} if the payload was buffered
   */
  public boolean send(int clientId, String payload) {
    Objects.requireNonNull(payload, "payload");
    Optional<Connection> connection = registry.get(clientId);
    if (connection.isEmpty()) {
      metrics.increment("router.send.dropped");
      return false;
    }
    connection.get().enqueue(payload);
    transport.requestWritable(clientId);
    return true;
  }

  /**
   * Writes buffered payloads for one client, head first, until the buffer is empty or a write falls short.
   * A payload is removed from the buffer only after the transport accepted all of its bytes.
   *
   * @param clientId client reported writable by the transport
   * @return messages written and whether the connection failed
   */
  public FlushResult flush(int clientId) {
    Optional<Connection> found = registry.get(clientId);
    if (found.isEmpty()) {
      return FlushResult.NOT_CONNECTED;
    }
    Connection connection = found.get();
    int written = 0;
    String payload;
    while ((payload = connection.peekOutbound()) != null) {
      byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
      int accepted = transport.write(clientId, bytes);
      if (accepted < bytes.length) {
        log.debug("Short write to client {}: {} of {} bytes", clientId, accepted, bytes.length);
        metrics.increment("router.write.failure");
        registry.onError(clientId, WRITE_ERROR);
        observeFlush(written);
        return new FlushResult(written, true);
      }
      connection.pollOutbound();
      written++;
    }
    observeFlush(written);
    return new FlushResult(written, false);
  }

  /**
   * Sends a payload to every client registered at the time of the call.
   *
   * @param payload text payload
   * @return number of clients the payload was buffered for
   */
  public int broadcast(String payload) {
    Set<Integer> ids = registry.ids();
    int delivered = 0;
    for (Integer id : ids) {
      if (send(id, payload)) {
        delivered++;
      }
    }
    return delivered;
  }

  /**
   * Sends a payload to every registered client holding {@code permission}.
   *
   * @param payload text payload
   * @param permission capability the client must hold, e.g. {@code logs}
   * @return number of clients the payload was buffered for
   */
  public int broadcastToPermission(String payload, String permission) {
    Objects.requireNonNull(permission, "permission");
    Set<Integer> ids = registry.ids();
    int delivered = 0;
    for (Integer id : ids) {
      Optional<Connection> connection = registry.get(id);
      if (connection.isPresent() && connection.get().hasPermission(permission) && send(id, payload)) {
        delivered++;
      }
    }
    return delivered;
  }

  public void setAttribute(int clientId, String key, String value) {
    registry.get(clientId).ifPresent(c -> c.setAttribute(key, value));
  }

  /**
   * Reads a session attribute.
   *
   * @return the value, or an empty string when the client or key is unknown
   */
  public String getAttribute(int clientId, String key) {
    return registry.get(clientId).map(c -> c.attribute(key)).orElse("");
  }

  public String getUser(int clientId) {
    return getAttribute(clientId, Connection.USER_ATTRIBUTE);
  }

  public void setUser(int clientId, String user) {
    setAttribute(clientId, Connection.USER_ATTRIBUTE, user);
  }

  /**
   * Grants a capability to a registered client.
   *
   * @return {@code false} when the client is not registered
   */
  public boolean grantPermission(int clientId, String permission) {
    Optional<Connection> connection = registry.get(clientId);
    connection.ifPresent(c -> c.grant(permission));
    return connection.isPresent();
  }

  public boolean revokePermission(int clientId, String permission) {
    Optional<Connection> connection = registry.get(clientId);
    connection.ifPresent(c -> c.revoke(permission));
    return connection.isPresent();
  }

  public int connectionCount() {
    return registry.size();
  }

  private void observeFlush(int written) {
    if (written > 0) {
      metrics.observe("router.flush.messages", written);
    }
  }
}
