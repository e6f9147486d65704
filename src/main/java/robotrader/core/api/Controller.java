package robotrader.core.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import robotrader.core.util.JsonCodec;

import java.util.Map;

/**
 * Read-only HTTP endpoint served by the observer server.
 */
public interface Controller {

    /**
     * @param path request path without query string
     */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize a value with the shared mapper. */
        public static ControllerResponse ok(Object value) {
            return json(JsonCodec.toJson(value));
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return json(status, JsonCodec.toJson(Map.of("error", message == null ? "" : message)));
        }
    }
}
