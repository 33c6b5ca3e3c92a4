/**
 * Executor and thread factories.
 * <p><strong>Role:</strong> Infrastructure utilities naming the streaming worker, sample source and Netty event
 * loop threads so thread dumps and log lines identify them.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return independent executors.</p>
 */
package ca.gc.cra.rpx.infrastructure.exec;
