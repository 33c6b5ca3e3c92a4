/**
 * Telemetry server lifecycle: start ordering, shutdown ordering and the wait used by the CLI.
 */
package ca.gc.cra.rpx.application.server;
