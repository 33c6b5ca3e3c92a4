package ca.gc.cra.rpx.application.session;

import ca.gc.cra.rpx.domain.session.Connection;

/**
 * Observer of connection additions and removals in a {@link ConnectionRegistry}.
 * <p>Each connection produces exactly one {@link #connectionAdded} and at most one {@link #connectionRemoved},
 * regardless of how many times the transport reports the disconnect.</p>
 *
 * @since 0.1.0
 */
public interface RegistryListener {
  /**
   * Called after a connection has been inserted.
   *
   * @param connection newly registered connection
   */
  default void connectionAdded(Connection connection) {}

  /**
   * Called after a connection has been removed.
   *
   * @param connection removed connection
   */
  default void connectionRemoved(Connection connection) {}
}
