/**
 * Hexagonal ports consumed by the session layer and spectrum pipeline.
 * <p><strong>Role:</strong> Interfaces for the socket transport, spectral estimator, metrics, clock, and command
 * dispatch; adapters live under {@code ca.gc.cra.rpx.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Each port documents which thread calls it; transports dispatch on one reactor
 * thread.</p>
 */
package ca.gc.cra.rpx.application.port;
