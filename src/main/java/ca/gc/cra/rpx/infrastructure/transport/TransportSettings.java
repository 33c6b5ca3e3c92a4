package ca.gc.cra.rpx.infrastructure.transport;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Listener and TLS settings for {@link NettyWebSocketTransport}.
 *
 * @param bindHost interface to bind, e.g. {@code 0.0.0.0}
 * @param port TCP port; {@code 0} binds an ephemeral port
 * @param path WebSocket upgrade path
 * @param certPath PEM certificate chain; {@code null} disables TLS
 * @param keyPath PEM PKCS#8 private key; required when {@code certPath} is set
 * @param ioThreads reactor threads; {@code 1} keeps all client callbacks on one thread
 * @since 0.1.0
 */
public record TransportSettings(
    String bindHost, int port, String path, Path certPath, Path keyPath, int ioThreads) {

  /** Maximum aggregated HTTP request size during the handshake. */
  public static final int MAX_HTTP_CONTENT_BYTES = 65_536;

  public TransportSettings {
    Objects.requireNonNull(bindHost, "bindHost");
    Objects.requireNonNull(path, "path");
    if (port < 0 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 0 and 65535");
    }
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/'");
    }
    if ((certPath == null) != (keyPath == null)) {
      throw new IllegalArgumentException("certPath and keyPath must be set together");
    }
    if (ioThreads <= 0) {
      throw new IllegalArgumentException("ioThreads must be positive");
    }
  }

  /**
   * Plain-text listener on {@code host:port} at {@code /} with one reactor thread.
   */
  public static TransportSettings plain(String host, int port) {
    return new TransportSettings(host, port, "/", null, null, 1);
  }

  public boolean tlsEnabled() {
    return certPath != null;
  }

  public String scheme() {
    return tlsEnabled() ? "wss" : "ws";
  }
}
