/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments and flags, applies logging and metrics settings and
 * runs the telemetry server.</p>
 * <p><strong>Concurrency:</strong> Runs on the main thread; a JVM shutdown hook closes the server.</p>
 */
package ca.gc.cra.rpx.api;
