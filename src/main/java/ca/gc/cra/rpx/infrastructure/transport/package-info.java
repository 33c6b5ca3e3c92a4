/**
 * Netty WebSocket transport adapter.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.rpx.application.port.TransportPort}: handshake, framing,
 * optional TLS and TCP keep-alive, mapping channels to integer client identifiers.</p>
 * <p><strong>Concurrency:</strong> One accept thread and, by default, one reactor thread dispatching every client
 * event in order. {@link ca.gc.cra.rpx.infrastructure.transport.ActivitySignal} exposes reactor activity to other
 * threads as a bounded wait.</p>
 */
package ca.gc.cra.rpx.infrastructure.transport;
