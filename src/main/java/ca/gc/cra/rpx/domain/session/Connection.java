package ca.gc.cra.rpx.domain.session;

import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * <strong>What:</strong> Server-side state for one active client socket.
 * <p><strong>Why:</strong> Decouples producers (spectrum worker, log bridge) from socket writes by buffering
 * outbound payloads until the transport reports the socket writable.</p>
 * <p><strong>Role:</strong> Domain entity owned exclusively by the connection registry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a FIFO of pending text payloads; removal from the head happens only after transmission.</li>
 *   <li>Track capability strings (e.g., {@code logs}) checked by permission-scoped broadcasts.</li>
 *   <li>Store session attributes such as the authenticated user name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Buffer, permissions, and attributes are concurrent collections; producers
 * append from the worker thread while the reactor thread drains.</p>
 * <p><strong>Performance:</strong> Appends and head removal are lock-free O(1).</p>
 * <p><strong>Observability:</strong> {@link #pendingCount()} feeds queue-depth diagnostics.</p>
 *
 * @since 0.1.0
 */
public final class Connection {
  /** Attribute key holding the authenticated user name. */
  public static final String USER_ATTRIBUTE = "user";

  private final int id;
  private final Instant createdAt;
  private final Deque<String> outboundBuffer = new ConcurrentLinkedDeque<>();
  private final Set<String> permissions = ConcurrentHashMap.newKeySet();
  private final Map<String, String> attributes = new ConcurrentHashMap<>();

  /**
   * Creates connection state for a newly observed client.
   *
   * @param id transport-assigned client identifier
   * @param createdAt creation timestamp; immutable afterwards
   */
  public Connection(int id, Instant createdAt) {
    this.id = id;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Returns the transport-assigned client identifier.
   *
   * @return client identifier
   */
  public int id() {
    return id;
  }

  /**
   * Returns the instant this connection was observed as connected.
   *
   * @return creation timestamp
   */
  public Instant createdAt() {
    return createdAt;
  }

  /**
   * Appends a payload at the tail of the outbound buffer.
   *
   * @param payload text payload; must not be {@code null}
   */
  public void enqueue(String payload) {
    outboundBuffer.addLast(Objects.requireNonNull(payload, "payload"));
  }

  /**
   * Returns the head of the outbound buffer without removing it.
   *
   * @return next payload to transmit, or {@code null} when the buffer is empty
   */
  public String peekOutbound() {
    return outboundBuffer.peekFirst();
  }

  /**
   * Removes the head of the outbound buffer after it has been transmitted.
   *
   * @return removed payload, or {@code null} when the buffer was empty
   */
  public String pollOutbound() {
    return outboundBuffer.pollFirst();
  }

  /**
   * Drops every pending payload.
   *
   * @return number of payloads discarded
   */
  public int discardOutbound() {
    int dropped = 0;
    while (outboundBuffer.pollFirst() != null) {
      dropped++;
    }
    return dropped;
  }

  /**
   * Returns the number of payloads waiting for transmission.
   *
   * @return pending payload count
   */
  public int pendingCount() {
    return outboundBuffer.size();
  }

  public void grant(String permission) {
    permissions.add(Objects.requireNonNull(permission, "permission"));
  }

  public void revoke(String permission) {
    if (permission != null) {
      permissions.remove(permission);
    }
  }

  public boolean hasPermission(String permission) {
    return permission != null && permissions.contains(permission);
  }

  /**
   * Returns an immutable snapshot of the granted permissions.
   *
   * @return permission snapshot
   */
  public Set<String> permissions() {
    return Set.copyOf(permissions);
  }

  /**
   * Stores a session attribute; a {@code null} value removes the key.
   *
   * @param key attribute name
   * @param value attribute value
   */
  public void setAttribute(String key, String value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      attributes.remove(key);
    } else {
      attributes.put(key, value);
    }
  }

  /**
   * Reads a session attribute.
   *
   * @param key attribute name
   * @return attribute value, or an empty string when absent
   */
  public String attribute(String key) {
    if (key == null) {
      return "";
    }
    return attributes.getOrDefault(key, "");
  }

  public String user() {
    return attribute(USER_ATTRIBUTE);
  }

  public void setUser(String user) {
    setAttribute(USER_ATTRIBUTE, user);
  }

  @Override
  public String toString() {
    return "Connection{"
        + "id=" + id
        + ", createdAt=" + createdAt
        + ", pending=" + outboundBuffer.size()
        + ", permissions=" + permissions
        + '}';
  }
}
