package robotrader.core.coordinator.queue;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.EventBus;
import robotrader.core.model.QueueState;
import robotrader.core.model.Task;
import robotrader.core.repository.StateRepository;
import robotrader.core.scheduler.QueueScheduler;
import robotrader.core.scheduler.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the queue domain. Delegates to its lifecycle, execution,
 * monitoring and event sub-coordinators.
 */
public class QueueCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(QueueCoordinator.class);

    static final String NAME = "queue_coordinator";

    private final QueueLifecycleCoordinator lifecycle;
    private final QueueExecutionCoordinator execution;
    private final QueueMonitoringCoordinator monitoring;
    private final QueueEventCoordinator events;
    private volatile boolean initialized;

    public QueueCoordinator(QueueScheduler scheduler, StateRepository stateRepository, EventBus eventBus) {
        this.lifecycle = new QueueLifecycleCoordinator(scheduler, eventBus);
        this.execution = new QueueExecutionCoordinator(scheduler);
        this.monitoring = new QueueMonitoringCoordinator(stateRepository, scheduler);
        this.events = new QueueEventCoordinator(eventBus, scheduler);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        lifecycle.initialize();
        execution.initialize();
        monitoring.initialize();
        events.initialize();
        initialized = true;
        log.info("Queue coordinator initialized");
    }

    @Override
    public synchronized void cleanup() {
        if (!initialized) {
            return;
        }
        log.info("Cleaning up queue coordinator");
        cleanupQuietly(lifecycle);
        cleanupQuietly(events);
        cleanupQuietly(execution);
        cleanupQuietly(monitoring);
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void startQueues() {
        lifecycle.startQueues();
    }

    public void stopQueues() {
        lifecycle.stopQueues();
    }

    public boolean startQueue(String queueName) {
        return lifecycle.startQueue(queueName);
    }

    public boolean stopQueue(String queueName) {
        return lifecycle.stopQueue(queueName);
    }

    public boolean areQueuesRunning() {
        return lifecycle.areQueuesRunning();
    }

    public Task createTask(TaskRequest request) {
        return execution.createTask(request);
    }

    public Task createTask(String queueName, String taskType, Map<String, Object> payload, int priority) {
        return execution.createTask(queueName, taskType, payload, priority);
    }

    public boolean cancelTask(String taskId) {
        return execution.cancelTask(taskId);
    }

    public Map<String, Object> getQueueStatus() {
        return monitoring.getQueueStatus();
    }

    public QueueState getQueueState(String queueName) {
        return monitoring.getQueueState(queueName);
    }

    public QueueHealth healthCheck() {
        return monitoring.healthCheck();
    }

    public void registerTrigger(EventTrigger trigger) {
        events.registerTrigger(trigger);
    }

    public boolean unregisterTrigger(String name) {
        return events.unregisterTrigger(name);
    }

    public List<EventTrigger> triggers() {
        return events.triggers();
    }

    private static void cleanupQuietly(Coordinator coordinator) {
        try {
            coordinator.cleanup();
        } catch (RuntimeException e) {
            log.warn("Error cleaning up {}: {}", coordinator.name(), e.getMessage());
        }
    }
}
