package ca.gc.cra.rpx.infrastructure.transport;

import ca.gc.cra.rpx.application.port.TransportInitException;
import ca.gc.cra.rpx.application.port.TransportListener;
import ca.gc.cra.rpx.application.port.TransportPort;
import ca.gc.cra.rpx.infrastructure.exec.ExecutorFactories;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioChannelOption;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.AttributeKey;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import jdk.net.ExtendedSocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransportPort} over a Netty WebSocket server.
 * <p><strong>Why:</strong> Netty owns the handshake, framing and TLS termination; this adapter only maps channels
 * to integer client identifiers and relays lifecycle events to the {@link TransportListener} supplied at start.</p>
 * <p><strong>Role:</strong> Infrastructure adapter. Each instance owns its own event loops, identifier sequence
 * and listener, so several servers can run in one JVM.</p>
 * <p><strong>Thread-safety:</strong> Listener callbacks run on the Netty reactor thread; with the default single
 * I/O thread every client event is dispatched sequentially. {@link #write(int, byte[])} and
 * {@link #requestWritable(int)} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Every dispatched event advances the {@link ActivitySignal} that paces the
 * spectrum worker.</p>
 *
 * @implNote Client identifiers come from a monotonically increasing counter and are never reused within one
 *     transport instance.
 * @since 0.1.0
 */
public final class NettyWebSocketTransport implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

  static final AttributeKey<Integer> CLIENT_ID = AttributeKey.valueOf("rpx.clientId");

  private static final int KEEPALIVE_IDLE_SECONDS = 60;
  private static final int KEEPALIVE_PROBES = 10;
  private static final int KEEPALIVE_INTERVAL_SECONDS = 10;
  private static final long SHUTDOWN_QUIET_MILLIS = 0L;
  private static final long SHUTDOWN_TIMEOUT_MILLIS = 2_000L;

  private final TransportSettings settings;
  private final ActivitySignal activity;
  private final AtomicInteger nextClientId = new AtomicInteger();
  private final ConcurrentMap<Integer, Channel> channels = new ConcurrentHashMap<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile TransportListener listener;
  private EventLoopGroup acceptGroup;
  private EventLoopGroup reactorGroup;
  private Channel serverChannel;

  public NettyWebSocketTransport(TransportSettings settings) {
    this(settings, new ActivitySignal());
  }

  NettyWebSocketTransport(TransportSettings settings, ActivitySignal activity) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.activity = Objects.requireNonNull(activity, "activity");
  }

  @Override
  public void start(TransportListener listener) throws TransportInitException {
    Objects.requireNonNull(listener, "listener");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Transport already started");
    }
    this.listener = listener;
    SslContext sslContext = buildSslContext();
    acceptGroup = new NioEventLoopGroup(1, ExecutorFactories.namedThreadFactory("rpx-accept", true, null));
    reactorGroup = new NioEventLoopGroup(
        settings.ioThreads(), ExecutorFactories.namedThreadFactory("rpx-reactor", true, null));

    ServerBootstrap bootstrap = new ServerBootstrap();
    bootstrap.group(acceptGroup, reactorGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new WebSocketChannelInitializer(
            sslContext, settings.path(), new WebSocketFrameHandler(this)))
        .option(ChannelOption.SO_BACKLOG, 128)
        .option(ChannelOption.SO_REUSEADDR, true)
        .childOption(ChannelOption.SO_KEEPALIVE, true)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childOption(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPIDLE), KEEPALIVE_IDLE_SECONDS)
        .childOption(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPCOUNT), KEEPALIVE_PROBES)
        .childOption(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPINTERVAL), KEEPALIVE_INTERVAL_SECONDS);

    try {
      serverChannel = bootstrap.bind(settings.bindHost(), settings.port()).sync().channel();
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      shutdownGroups();
      throw new TransportInitException(
          "Failed to bind " + settings.scheme() + "://" + settings.bindHost() + ":" + settings.port(), ex);
    }
    log.info("WebSocket listening on {}://{}:{}{}",
        settings.scheme(), settings.bindHost(), boundPort(), settings.path());
  }

  @Override
  public int write(int clientId, byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    Channel channel = channels.get(clientId);
    if (channel == null || !channel.isActive()) {
      return 0;
    }
    channel.writeAndFlush(new TextWebSocketFrame(Unpooled.wrappedBuffer(payload)))
        .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    return payload.length;
  }

  @Override
  public void requestWritable(int clientId) {
    Channel channel = channels.get(clientId);
    if (channel == null) {
      return;
    }
    channel.eventLoop().execute(() -> {
      if (channel.isActive() && channel.isWritable()) {
        channelWritable(channel);
      }
    });
  }

  @Override
  public boolean awaitActivity(Duration timeout) throws InterruptedException {
    return activity.await(timeout);
  }

  /**
   * Returns the port actually bound, which differs from the configured one when it was {@code 0}.
   *
   * @return bound TCP port, or {@code -1} before start
   */
  public int boundPort() {
    Channel server = serverChannel;
    if (server == null || !(server.localAddress() instanceof InetSocketAddress address)) {
      return -1;
    }
    return address.getPort();
  }

  public int openChannels() {
    return channels.size();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (serverChannel != null) {
      serverChannel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS);
    }
    List<Channel> open = new ArrayList<>(channels.values());
    for (Channel channel : open) {
      channel.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS);
    }
    shutdownGroups();
    activity.signal();
    log.info("WebSocket transport closed ({} client channels)", open.size());
  }

  void channelOpened(Channel channel) {
    int clientId = nextClientId.incrementAndGet();
    channel.attr(CLIENT_ID).set(clientId);
    channels.put(clientId, channel);
    log.debug("Handshake complete for client {} from {}", clientId, channel.remoteAddress());
    dispatch("connect", clientId, () -> listener.onConnect(clientId));
  }

  void messageReceived(Channel channel, String text) {
    Integer clientId = channel.attr(CLIENT_ID).get();
    if (clientId == null) {
      return;
    }
    dispatch("message", clientId, () -> listener.onMessage(clientId, text));
  }

  void channelWritable(Channel channel) {
    Integer clientId = channel.attr(CLIENT_ID).get();
    if (clientId == null) {
      return;
    }
    dispatch("writable", clientId, () -> listener.onWritable(clientId));
  }

  void channelClosed(Channel channel) {
    Integer clientId = channel.attr(CLIENT_ID).get();
    if (clientId == null) {
      return;
    }
    channels.remove(clientId, channel);
    dispatch("disconnect", clientId, () -> listener.onDisconnect(clientId));
  }

  void channelFailed(Channel channel, Throwable cause) {
    Integer clientId = channel.attr(CLIENT_ID).get();
    if (clientId == null) {
      log.debug("Connection error before handshake from {}", channel.remoteAddress(), cause);
      return;
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    dispatch("error", clientId, () -> listener.onError(clientId, message));
  }

  private void dispatch(String event, int clientId, Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException ex) {
      log.error("Listener failed handling {} for client {}", event, clientId, ex);
    } finally {
      activity.signal();
    }
  }

  private SslContext buildSslContext() throws TransportInitException {
    if (!settings.tlsEnabled()) {
      return null;
    }
    try {
      return SslContextBuilder.forServer(settings.certPath().toFile(), settings.keyPath().toFile()).build();
    } catch (Exception ex) {
      throw new TransportInitException("Failed to load TLS material from " + settings.certPath(), ex);
    }
  }

  private void shutdownGroups() {
    if (acceptGroup != null) {
      acceptGroup.shutdownGracefully(SHUTDOWN_QUIET_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS);
    }
    if (reactorGroup != null) {
      reactorGroup.shutdownGracefully(SHUTDOWN_QUIET_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS);
    }
  }
}
