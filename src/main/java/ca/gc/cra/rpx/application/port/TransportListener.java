package ca.gc.cra.rpx.application.port;

/**
 * <strong>What:</strong> Callback context receiving socket lifecycle events from a {@link TransportPort}.
 * <p><strong>Why:</strong> Passing the listener at {@link TransportPort#start(TransportListener)} replaces
 * process-global callback state, so several server instances can run side by side.</p>
 * <p><strong>Role:</strong> Driving-side port implemented by {@code TelemetrySessionHandler}.</p>
 * <p><strong>Thread-safety:</strong> Transports invoke callbacks from a single reactor thread, one event at a time,
 * without reentrancy.</p>
 * <p><strong>Observability:</strong> Implementations own logging and metrics for each event.</p>
 *
 * @since 0.1.0
 */
public interface TransportListener {
  /**
   * A client completed the handshake and is ready to receive payloads.
   *
   * @param clientId transport-assigned identifier, unique among active connections
   */
  void onConnect(int clientId);

  /**
   * A text message arrived from the client.
   *
   * @param clientId client identifier
   * @param message decoded text payload
   */
  void onMessage(int clientId, String message);

  /**
   * The client's socket can accept more bytes; buffered payloads should be flushed now.
   *
   * @param clientId client identifier
   */
  void onWritable(int clientId);

  /**
   * The client closed the connection. May be delivered more than once for the same identifier.
   *
   * @param clientId client identifier
   */
  void onDisconnect(int clientId);

  /**
   * The connection failed. May be followed by {@link #onDisconnect(int)} for the same identifier.
   *
   * @param clientId client identifier
   * @param message failure description
   */
  void onError(int clientId, String message);
}
