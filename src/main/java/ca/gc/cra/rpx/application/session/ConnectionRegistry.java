package ca.gc.cra.rpx.application.session;

import ca.gc.cra.rpx.application.port.ClockPort;
import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.domain.session.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps transport client identifiers to {@link Connection} state.
 * <p><strong>Why:</strong> Centralizes connection ownership so removal happens exactly once even when the transport
 * reports both an error and a close for the same socket.</p>
 * <p><strong>Role:</strong> Application service mutated by the session handler on the reactor thread and read by
 * the broadcast router from any thread.</p>
 * <p><strong>Thread-safety:</strong> Backed by a {@link ConcurrentHashMap}; insert uses {@code putIfAbsent} and
 * removal uses {@code remove}, so concurrent readers never observe a half-registered connection.</p>
 * <p><strong>Observability:</strong> Emits {@code session.connect}, {@code session.disconnect}, and
 * {@code session.error} counters plus the {@code session.active} gauge.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConcurrentMap<Integer, Connection> connections = new ConcurrentHashMap<>();
  private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a registry using the supplied clock and metrics sink.
   *
   * @param clock source for connection creation timestamps
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public ConnectionRegistry(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates a registry with the system clock and no metrics.
   */
  public ConnectionRegistry() {
    this(ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Registers a listener notified on every addition and removal.
   *
   * @param listener listener to add
   */
  public void addListener(RegistryListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Creates and registers a connection for a newly connected client.
   *
   * @param clientId transport-assigned identifier
   * @return the new connection
   * @throws DuplicateConnectionException if {@code clientId} is already registered; the existing connection is kept
   */
  public Connection onConnect(int clientId) {
    Connection connection = new Connection(clientId, clock.now());
    Connection existing = connections.putIfAbsent(clientId, connection);
    if (existing != null) {
      throw new DuplicateConnectionException(clientId);
    }
    metrics.increment("session.connect");
    metrics.observe("session.active", connections.size());
    log.debug("Registered client {} ({} active)", clientId, connections.size());
    for (RegistryListener listener : listeners) {
      listener.connectionAdded(connection);
    }
    return connection;
  }

  /**
   * Removes a client that closed its socket.
   *
   * @param clientId client identifier
   * @return {@code true} if a connection was removed; {@code false} when it was already gone
   */
  public boolean onDisconnect(int clientId) {
    Connection removed = connections.remove(clientId);
    if (removed == null) {
      log.trace("Ignoring disconnect for unknown client {}", clientId);
      return false;
    }
    metrics.increment("session.disconnect");
    log.debug("Client {} disconnected after {} pending payloads", clientId, removed.pendingCount());
    release(removed);
    return true;
  }

  /**
   * Removes a failed client and logs the failure once; a repeat for a gone client only traces.
   *
   * @param clientId client identifier
   * @param message failure description
   * @return {@code true} if a connection was removed; {@code false} when it was already gone
   */
  public boolean onError(int clientId, String message) {
    Connection removed = connections.remove(clientId);
    if (removed == null) {
      log.trace("Ignoring error '{}' for unknown client {}", message, clientId);
      return false;
    }
    log.error("Error: {} on client {}", message, clientId);
    metrics.increment("session.error");
    release(removed);
    return true;
  }

  /**
   * Looks up a registered connection.
   *
   * @param clientId client identifier
   * @return the connection, or empty when the client is not registered
   */
  public Optional<Connection> get(int clientId) {
    return Optional.ofNullable(connections.get(clientId));
  }

  /**
   * Returns an immutable snapshot of the registered identifiers.
   *
   * @return identifier snapshot; unaffected by later connects or removals
   */
  public Set<Integer> ids() {
    return Set.copyOf(connections.keySet());
  }

  /**
   * Returns an immutable snapshot of the registered connections.
   *
   * @return connection snapshot
   */
  public List<Connection> connections() {
    return List.copyOf(connections.values());
  }

  public int size() {
    return connections.size();
  }

  /**
   * Removes every connection, notifying listeners; used at shutdown.
   *
   * @return number of connections released
   */
  public int clear() {
    List<Integer> ids = new ArrayList<>(connections.keySet());
    int released = 0;
    for (Integer id : ids) {
      Connection removed = connections.remove(id);
      if (removed != null) {
        release(removed);
        released++;
      }
    }
    return released;
  }

  private void release(Connection removed) {
    int dropped = removed.discardOutbound();
    if (dropped > 0) {
      metrics.observe("session.release.dropped", dropped);
    }
    metrics.observe("session.active", connections.size());
    for (RegistryListener listener : listeners) {
      listener.connectionRemoved(removed);
    }
  }
}
