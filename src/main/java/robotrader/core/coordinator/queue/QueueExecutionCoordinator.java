package robotrader.core.coordinator.queue;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.model.Task;
import robotrader.core.scheduler.QueueScheduler;
import robotrader.core.scheduler.TaskRequest;

import java.util.Map;

/**
 * Creates and cancels tasks on behalf of the queue domain.
 */
public class QueueExecutionCoordinator implements Coordinator {

    static final String NAME = "queue_execution_coordinator";

    private final QueueScheduler scheduler;
    private volatile boolean initialized;

    public QueueExecutionCoordinator(QueueScheduler scheduler) {
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

    public Task createTask(TaskRequest request) {
        return scheduler.enqueue(request);
    }

    public Task createTask(String queueName, String taskType, Map<String, Object> payload, int priority) {
        return scheduler.enqueue(TaskRequest.of(queueName, taskType, payload).withPriority(priority));
    }

    public boolean cancelTask(String taskId) {
        return scheduler.cancel(taskId);
    }
}
