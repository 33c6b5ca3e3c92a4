package ca.gc.cra.rpx.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Domain port over the persistent socket transport that carries telemetry to browsers.
 * <p><strong>Why:</strong> Keeps handshake, framing, and TLS termination out of the session and streaming logic.</p>
 * <p><strong>Role:</strong> Driven port implemented by {@code NettyWebSocketTransport}; test doubles record writes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver connect/message/writable/disconnect/error events to the listener supplied at start.</li>
 *   <li>Write raw text bytes to one client and report how many were accepted.</li>
 *   <li>Expose the reactor's activity signal as a bounded wait used for pipeline cadence.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #write(int, byte[])} is called from the reactor thread;
 * {@link #requestWritable(int)} and {@link #awaitActivity(Duration)} may be called from any thread.</p>
 *
 * @implNote Callers must invoke {@link #start(TransportListener)} once and always {@link #close()}.
 * @since 0.1.0
 */
public interface TransportPort extends AutoCloseable {
  /**
   * Binds the listener socket and starts dispatching events.
   *
   * @param listener callback context for lifecycle events; must not be {@code null}
   * @throws TransportInitException if the listener cannot bind or TLS material cannot be loaded
   */
  void start(TransportListener listener) throws TransportInitException;

  /**
   * Writes a text payload to one client.
   *
   * @param clientId target client identifier
   * @param payload UTF-8 encoded text payload
   * @return number of bytes accepted; fewer than {@code payload.length} signals a write failure
   */
  int write(int clientId, byte[] payload);

  /**
   * Asks the transport to deliver {@link TransportListener#onWritable(int)} once the client can accept data.
   *
   * @param clientId client identifier; unknown identifiers are ignored
   */
  void requestWritable(int clientId);

  /**
   * Blocks until the transport dispatches another event or the timeout elapses.
   *
   * @param timeout maximum wait; must be positive
   * @return {@code true} if an event was observed, {@code false} on timeout
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean awaitActivity(Duration timeout) throws InterruptedException;

  /**
   * Closes every client connection and releases the listener socket.
   */
  @Override
  void close();
}
