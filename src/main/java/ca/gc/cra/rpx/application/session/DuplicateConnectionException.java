package ca.gc.cra.rpx.application.session;

/**
 * Raised when the transport reports a connect for an identifier that is still registered.
 * <p>Indicates a transport contract violation. The registry rejects the new connection and keeps the existing
 * one untouched.</p>
 *
 * @since 0.1.0
 */
public final class DuplicateConnectionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int clientId;

  public DuplicateConnectionException(int clientId) {
    super("Connection already registered for client " + clientId);
    this.clientId = clientId;
  }

  public int clientId() {
    return clientId;
  }
}
