package robotrader.core.server;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.GlobalEventExecutor;
import robotrader.core.broadcast.BroadcastMessage;
import robotrader.core.broadcast.BroadcastTransport;
import robotrader.core.error.BroadcastException;
import robotrader.core.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes broadcast messages to every connected WebSocket client as a JSON text frame.
 * <p>
 * A send with no connected client succeeds without I/O. A send fails only
 * when every client write fails; partial failures are logged.
 */
public class WebSocketBroadcastTransport implements BroadcastTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketBroadcastTransport.class);

    private final ChannelGroup clients = new DefaultChannelGroup("ws-clients", GlobalEventExecutor.INSTANCE);
    private final ClientHandler handler = new ClientHandler();
    private volatile Runnable onConnect = () -> {
    };

    /**
     * Called after each successful handshake, e.g. to force a status snapshot to the new client.
     */
    public void setOnConnect(Runnable onConnect) {
        this.onConnect = onConnect != null ? onConnect : () -> {
        };
    }

    @Override
    public void send(BroadcastMessage message) throws Exception {
        if (clients.isEmpty()) {
            log.trace("No WebSocket clients, {} not sent", message.type());
            return;
        }
        String json = JsonCodec.toJson(message);
        ChannelGroupFuture future = clients.writeAndFlush(new TextWebSocketFrame(json));
        future.await();
        if (future.isSuccess()) {
            return;
        }
        if (future.isPartialSuccess()) {
            log.warn("Broadcast {} reached only part of the WebSocket clients: {}",
                    message.type(), future.cause().getMessage());
            return;
        }
        throw new BroadcastException("Broadcast to WebSocket clients failed: " + future.cause().getMessage(),
                future.cause());
    }

    public int clientCount() {
        return clients.size();
    }

    /** Pipeline handler placed after the WebSocket protocol handler. */
    public ChannelHandler handler() {
        return handler;
    }

    public void close() {
        clients.close().awaitUninterruptibly();
    }

    @Sharable
    private final class ClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                clients.add(ctx.channel());
                log.info("WebSocket client connected: {} ({} total)", ctx.channel().remoteAddress(), clients.size());
                try {
                    onConnect.run();
                } catch (RuntimeException e) {
                    log.warn("WebSocket connect callback failed: {}", e.getMessage());
                }
            } else {
                super.userEventTriggered(ctx, evt);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            // Observers are read-only
            log.debug("Ignoring {} from WebSocket client {}", frame.getClass().getSimpleName(),
                    ctx.channel().remoteAddress());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            log.info("WebSocket client disconnected: {}", ctx.channel().remoteAddress());
            super.channelInactive(ctx);
        }
    }
}
