/**
 * Connection lifecycle and buffered multicast.
 * <p><strong>Role:</strong> Application services driven by transport events on the reactor thread and by
 * producers (streaming worker, log bridge) on their own threads.</p>
 * <p><strong>Concurrency:</strong> The registry map and per-connection buffers are concurrent collections;
 * broadcasts snapshot identifiers before iterating.</p>
 * <p><strong>Metrics:</strong> {@code session.*} and {@code router.*}.</p>
 */
package ca.gc.cra.rpx.application.session;
