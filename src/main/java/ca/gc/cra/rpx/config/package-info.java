/**
 * Configuration records, the YAML loader and the composition root.
 * <p><strong>Role:</strong> Turns CLI and YAML input into validated settings and wires the telemetry server.</p>
 * <p><strong>Concurrency:</strong> Used on the bootstrap thread only.</p>
 */
package ca.gc.cra.rpx.config;
