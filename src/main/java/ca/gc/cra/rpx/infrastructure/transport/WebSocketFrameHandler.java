package ca.gc.cra.rpx.infrastructure.transport;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import java.util.Objects;

/**
 * Translates Netty channel events into {@link NettyWebSocketTransport} lifecycle callbacks.
 * <p>A client counts as connected once the WebSocket handshake completes; channels that close before then
 * produce no callbacks.</p>
 */
@ChannelHandler.Sharable
final class WebSocketFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {
  private final NettyWebSocketTransport transport;

  WebSocketFrameHandler(NettyWebSocketTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      transport.channelOpened(ctx.channel());
    }
    super.userEventTriggered(ctx, evt);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
    transport.messageReceived(ctx.channel(), frame.text());
  }

  @Override
  public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
    if (ctx.channel().isWritable()) {
      transport.channelWritable(ctx.channel());
    }
    super.channelWritabilityChanged(ctx);
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    transport.channelClosed(ctx.channel());
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    transport.channelFailed(ctx.channel(), cause);
    ctx.close();
  }
}
