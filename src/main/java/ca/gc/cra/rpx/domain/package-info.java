/**
 * Core domain model for the RPX telemetry fan-out layer.
 * <p><strong>Role:</strong> Sessions, client commands, and spectral value types without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@code Connection} is the one mutable entity
 * and uses concurrent collections internally.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed {@code session.*} and {@code stream.*} metrics.</p>
 */
package ca.gc.cra.rpx.domain;
