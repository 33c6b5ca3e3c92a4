/**
 * Logging configuration and the client log relay.
 * <p><strong>Role:</strong> Bridges operator verbosity codes to Logback and relays formatted log lines to browser
 * clients holding the {@code logs} permission.</p>
 * <p><strong>Concurrency:</strong> Configuration runs on the bootstrap thread; the relay appender is invoked from
 * any logging thread and guards against same-thread recursion.</p>
 */
package ca.gc.cra.rpx.logging;
