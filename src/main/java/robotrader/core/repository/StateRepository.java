package robotrader.core.repository;

import robotrader.core.model.ComponentStatus;
import robotrader.core.model.QueueState;
import robotrader.core.model.QueueStatistics;
import robotrader.core.model.Task;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Single query surface over persisted state. Observers and coordinators read
 * through this interface; nothing answers from in-memory counters.
 */
public interface StateRepository {

    QueueState getStatus(String queueName);

    Map<String, QueueState> getAllStatuses();

    List<Task> getPendingTasks(String queueName, int limit);

    List<Task> getRunningTasks();

    List<Task> getTaskHistory(String queueName, Duration window);

    QueueStatistics getStatistics();

    /**
     * Fan-out over every state component in parallel. A failing component is
     * returned as a degraded placeholder; the others are still answered.
     *
     * @return component name → result, in a stable order
     */
    Map<String, ComponentStatus> getSystemState();
}
