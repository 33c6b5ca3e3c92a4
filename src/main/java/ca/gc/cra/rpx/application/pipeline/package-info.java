/**
 * Spectrum streaming pipeline: bounded sample queue, estimator, payload encoder and broadcast.
 * <p><strong>Role:</strong> Application layer running on its own thread beside the transport reactor.</p>
 * <p><strong>Concurrency:</strong> One worker thread per pipeline; producers hand batches over through
 * {@link ca.gc.cra.rpx.application.pipeline.SampleBatchQueue} without blocking.</p>
 * <p><strong>Metrics:</strong> {@code stream.*} counters and observations.</p>
 */
package ca.gc.cra.rpx.application.pipeline;
