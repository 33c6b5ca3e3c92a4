/**
 * Client session state for the telemetry fan-out layer.
 * <p><strong>Role:</strong> Domain entities owned by the connection registry; no transport dependencies.</p>
 * <p><strong>Concurrency:</strong> Connection internals are concurrent collections shared by the reactor and
 * streaming threads.</p>
 * <p><strong>Security:</strong> Permissions gate which clients receive operator log lines.</p>
 */
package ca.gc.cra.rpx.domain.session;
