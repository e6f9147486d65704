package robotrader.core.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import robotrader.core.api.Controller;
import robotrader.core.coordinator.queue.QueueCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Queue observation endpoints.
 * <p>
 * GET /api/v1/queues - states, workers and totals of every queue
 * GET /api/v1/queues/{name} - state of one queue
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);
    private static final String BASE_PATH = "/api/v1/queues";

    private final QueueCoordinator queueCoordinator;

    public QueueController(QueueCoordinator queueCoordinator) {
        this.queueCoordinator = queueCoordinator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (path.equals(BASE_PATH) || path.startsWith(BASE_PATH + "/"));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (path.equals(BASE_PATH) || path.equals(BASE_PATH + "/")) {
            return ControllerResponse.ok(queueCoordinator.getQueueStatus());
        }

        String name = URLDecoder.decode(path.substring(BASE_PATH.length() + 1), StandardCharsets.UTF_8);
        if (name.contains("/")) {
            return ControllerResponse.notFound("not found");
        }
        try {
            return ControllerResponse.ok(queueCoordinator.getQueueState(name));
        } catch (IllegalArgumentException e) {
            log.debug("Queue lookup failed: {}", e.getMessage());
            return ControllerResponse.notFound(e.getMessage());
        }
    }
}
