package robotrader.core.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import robotrader.core.api.Controller;
import robotrader.core.api.v1.dto.HealthResponse;
import robotrader.core.coordinator.broadcast.BroadcastCoordinator;
import robotrader.core.coordinator.queue.QueueCoordinator;
import robotrader.core.model.QueueStatistics;
import robotrader.core.repository.StateRepository;
import robotrader.core.store.Database;
import robotrader.core.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Database database;
    private final StateRepository stateRepository;
    private final QueueCoordinator queueCoordinator;
    private final BroadcastCoordinator broadcastCoordinator;

    public HealthController(Database database, StateRepository stateRepository, QueueCoordinator queueCoordinator,
            BroadcastCoordinator broadcastCoordinator) {
        this.database = database;
        this.stateRepository = stateRepository;
        this.queueCoordinator = queueCoordinator;
        this.broadcastCoordinator = broadcastCoordinator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        JsonCodec.toJson(HealthResponse.unhealthy("connection failed")));
            }

            QueueStatistics statistics = stateRepository.getStatistics();
            int runningQueues = queueCoordinator.healthCheck().runningQueues();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, runningQueues, statistics.pending(), statistics.running(),
                    broadcastCoordinator.circuitState().phase().name());
            return ControllerResponse.ok(response);

        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    JsonCodec.toJson(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
