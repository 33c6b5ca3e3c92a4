package ca.gc.cra.rpx.logging;

import ca.gc.cra.rpx.application.session.BroadcastRouter;
import java.util.Objects;

/**
 * <strong>What:</strong> Handle through which formatted log lines reach browser clients holding the
 * {@value #LOGS_PERMISSION} permission.
 * <p><strong>Why:</strong> The router is injected explicitly; a detached bridge is a legitimate, observable
 * configuration in which client forwarding is disabled while console and file logging continue.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #forward(String)} may be called from any logging thread.</p>
 *
 * @since 0.1.0
 * @see ClientLogAppender
 */
public final class LogBridge {
  /** Permission a connection needs to receive log lines. */
  public static final String LOGS_PERMISSION = "logs";

  private static final LogBridge DETACHED = new LogBridge(null);

  private final BroadcastRouter router;

  private LogBridge(BroadcastRouter router) {
    this.router = router;
  }

  /**
   * Returns a bridge with no router; every forward is a no-op.
   *
   * @return detached bridge
   */
  public static LogBridge detached() {
    return DETACHED;
  }

  /**
   * Creates a bridge forwarding to {@code router}.
   *
   * @param router router constructed before logging is wired
   * @return attached bridge
   */
  public static LogBridge attachedTo(BroadcastRouter router) {
    return new LogBridge(Objects.requireNonNull(router, "router"));
  }

  public boolean isAttached() {
    return router != null;
  }

  /**
   * Broadcasts a formatted line to permitted clients.
   *
   * @param formatted formatted log line
   * @return number of clients the line was buffered for; {@code 0} when detached
   */
  public int forward(String formatted) {
    if (router == null || formatted == null) {
      return 0;
    }
    return router.broadcastToPermission(formatted, LOGS_PERMISSION);
  }
}
