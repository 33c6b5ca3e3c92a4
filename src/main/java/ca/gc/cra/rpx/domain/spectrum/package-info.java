/**
 * Spectral analysis value types: sample batches, tuning, spectrum frames, and worker lifecycle.
 * <p><strong>Role:</strong> Domain layer shared by sample producers, the streaming worker, and estimators.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to hand across threads.</p>
 * <p><strong>Performance:</strong> Sample arrays are copied once on construction; the worker copies into a reusable
 * working buffer rather than cloning per cycle.</p>
 */
package ca.gc.cra.rpx.domain.spectrum;
