package ca.gc.cra.rpx.application.port;

/**
 * Fatal transport start-up failure, such as a port that cannot be bound or unreadable TLS material.
 * <p>Aborts process start-up; never raised after the transport is running.</p>
 *
 * @since 0.1.0
 */
public final class TransportInitException extends Exception {
  private static final long serialVersionUID = 1L;

  public TransportInitException(String message, Throwable cause) {
    super(message, cause);
  }
}
