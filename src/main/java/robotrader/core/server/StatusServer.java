package robotrader.core.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import robotrader.core.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty server for observers: the read-only HTTP API and the {@code /ws}
 * WebSocket push channel share one port.
 */
public final class StatusServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final String host;
    private final int port;
    private final RouterHandler router;
    private final WebSocketBroadcastTransport webSocket;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running;

    public StatusServer(CoordinatorConfig config, RouterHandler router, WebSocketBroadcastTransport webSocket) {
        this.host = config.serverHost();
        this.port = config.serverPort();
        this.router = router;
        this.webSocket = webSocket;
    }

    /**
     * Bind and start serving. Port 0 binds an ephemeral port, see {@link #boundPort()}.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(120, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH));
                            p.addLast(webSocket.handler());
                            p.addLast(router);
                        }
                    });

            serverChannel = bootstrap.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Status server listening on {}:{}", host, boundPort());
        } catch (RuntimeException e) {
            log.error("Failed to start status server on {}:{}", host, port, e);
            shutdownGroups();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            webSocket.close();
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        } finally {
            shutdownGroups();
            running = false;
            log.info("Status server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** Actual listening port, or -1 when stopped. */
    public int boundPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }
}
