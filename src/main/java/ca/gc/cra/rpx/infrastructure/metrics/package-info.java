/**
 * OpenTelemetry implementation of {@link ca.gc.cra.rpx.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are safe from the reactor,
 * streaming and producer threads.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code session.*}, {@code router.*} and {@code stream.*} keys under
 * an {@code rpx.} prefix.</p>
 */
package ca.gc.cra.rpx.infrastructure.metrics;
