package robotrader.core.coordinator.queue;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.model.QueueState;
import robotrader.core.model.QueueStatus;
import robotrader.core.repository.StateRepository;
import robotrader.core.scheduler.QueueScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the queues: persisted state plus worker liveness.
 */
public class QueueMonitoringCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(QueueMonitoringCoordinator.class);

    static final String NAME = "queue_monitoring_coordinator";

    private final StateRepository stateRepository;
    private final QueueScheduler scheduler;
    private volatile boolean initialized;

    public QueueMonitoringCoordinator(StateRepository stateRepository, QueueScheduler scheduler) {
        this.stateRepository = stateRepository;
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize() {
        initialized = true;
    }

    @Override
    public void cleanup() {
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Queue states, worker statuses and totals in one map.
     *
     * @throws robotrader.core.error.StoreException if the store cannot be read
     */
    public Map<String, Object> getQueueStatus() {
        Map<String, QueueState> states = stateRepository.getAllStatuses();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("queues", states);
        status.put("workers", scheduler.workerStatuses());
        status.put("statistics", stateRepository.getStatistics());
        status.put("timestamp", Instant.now());
        return status;
    }

    public QueueState getQueueState(String queueName) {
        if (!scheduler.hasQueue(queueName)) {
            throw new IllegalArgumentException("Unknown queue: " + queueName);
        }
        return stateRepository.getStatus(queueName);
    }

    public QueueHealth healthCheck() {
        try {
            Map<String, QueueState> states = stateRepository.getAllStatuses();
            List<String> degraded = new ArrayList<>();
            states.forEach((name, state) -> {
                if (state.status() == QueueStatus.DEGRADED) {
                    degraded.add(name);
                }
            });

            int running = 0;
            for (String queueName : scheduler.queueNames()) {
                if (scheduler.isRunning(queueName)) {
                    running++;
                }
            }

            boolean healthy = initialized && degraded.isEmpty();
            return new QueueHealth(healthy, scheduler.queueNames().size(), running, degraded, null, Instant.now());
        } catch (RuntimeException e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            return QueueHealth.failed(e.getMessage());
        }
    }
}
