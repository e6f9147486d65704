package robotrader.core.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpUtil;
import robotrader.core.api.Controller;
import robotrader.core.api.Controller.ControllerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to the registered controllers, first match wins.
 * Only GET is served; unmatched paths return 404.
 * <p>
 * Sharable: holds no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        ControllerResponse response;
        try {
            response = dispatch(ctx, req, method, path);
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        write(ctx, req, response);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }
        if (!HttpMethod.GET.equals(method)) {
            return ControllerResponse.error(METHOD_NOT_ALLOWED, "method not allowed");
        }
        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest req, ControllerResponse response) {
        byte[] bytes = (response.body() == null ? "" : response.body()).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(http, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(http);
        } else {
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        if (ctx.channel().isActive()) {
            byte[] bytes = "{\"error\":\"channel error\"}".getBytes(StandardCharsets.UTF_8);
            FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                    Unpooled.wrappedBuffer(bytes));
            http.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
            http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.close();
        }
    }
}
