package ca.gc.cra.rpx.infrastructure.transport;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.ssl.SslContext;
import java.util.Objects;

/**
 * Pipeline for accepted sockets: optional TLS, HTTP codec, handshake aggregation, WebSocket protocol handling
 * and the frame handler.
 */
final class WebSocketChannelInitializer extends ChannelInitializer<SocketChannel> {
  private final SslContext sslContext;
  private final String path;
  private final WebSocketFrameHandler frameHandler;

  WebSocketChannelInitializer(SslContext sslContext, String path, WebSocketFrameHandler frameHandler) {
    this.sslContext = sslContext;
    this.path = Objects.requireNonNull(path, "path");
    this.frameHandler = Objects.requireNonNull(frameHandler, "frameHandler");
  }

  @Override
  protected void initChannel(SocketChannel ch) {
    ChannelPipeline pipeline = ch.pipeline();
    if (sslContext != null) {
      pipeline.addLast(sslContext.newHandler(ch.alloc()));
    }
    pipeline
        .addLast(new HttpServerCodec())
        .addLast(new HttpObjectAggregator(TransportSettings.MAX_HTTP_CONTENT_BYTES))
        .addLast(new WebSocketServerProtocolHandler(path, null, true))
        .addLast(frameHandler);
  }
}
