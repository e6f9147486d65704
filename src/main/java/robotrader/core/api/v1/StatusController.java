package robotrader.core.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import robotrader.core.api.Controller;
import robotrader.core.coordinator.status.StatusCoordinator;

/**
 * Aggregated system status.
 * GET /api/v1/status
 */
public class StatusController implements Controller {

    private final StatusCoordinator statusCoordinator;

    public StatusController(StatusCoordinator statusCoordinator) {
        this.statusCoordinator = statusCoordinator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/status".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.ok(statusCoordinator.getSystemStatus());
    }
}
