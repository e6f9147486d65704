package robotrader.core.store;

import robotrader.core.model.ComponentStatus;
import robotrader.core.model.QueueState;
import robotrader.core.model.QueueStatistics;
import robotrader.core.model.Task;
import robotrader.core.repository.QueueStateRepository;
import robotrader.core.repository.StateRepository;
import robotrader.core.repository.TaskRepository;
import robotrader.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * State repository over the task and queue-state stores.
 * {@link #getSystemState()} queries its components in parallel and contains
 * each branch's failure.
 */
public class DatabaseStateRepository implements StateRepository, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseStateRepository.class);

    static final int HISTORY_LIMIT = 100;
    static final int RECENT_FAILURES_LIMIT = 20;
    static final Duration RECENT_FAILURES_WINDOW = Duration.ofHours(1);

    private final TaskRepository taskRepository;
    private final QueueStateRepository queueStateRepository;
    private final Duration timeout;
    private final ExecutorService executor;

    public DatabaseStateRepository(TaskRepository taskRepository, QueueStateRepository queueStateRepository,
            Duration timeout) {
        this.taskRepository = taskRepository;
        this.queueStateRepository = queueStateRepository;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(4, new NamedThreadFactory("state-query"));
    }

    @Override
    public QueueState getStatus(String queueName) {
        return queueStateRepository.getStatus(queueName);
    }

    @Override
    public Map<String, QueueState> getAllStatuses() {
        return queueStateRepository.getAllStatuses();
    }

    @Override
    public List<Task> getPendingTasks(String queueName, int limit) {
        return taskRepository.findPending(queueName, limit);
    }

    @Override
    public List<Task> getRunningTasks() {
        return taskRepository.findRunning(null);
    }

    @Override
    public List<Task> getTaskHistory(String queueName, Duration window) {
        return taskRepository.findHistory(queueName, window, HISTORY_LIMIT);
    }

    @Override
    public QueueStatistics getStatistics() {
        return queueStateRepository.getStatistics();
    }

    @Override
    public Map<String, ComponentStatus> getSystemState() {
        Map<String, CompletableFuture<ComponentStatus>> branches = new LinkedHashMap<>();
        branches.put("queues", branch("queues", this::getAllStatuses));
        branches.put("running_tasks", branch("running_tasks", this::getRunningTasks));
        branches.put("statistics", branch("statistics", this::getStatistics));
        branches.put("recent_failures", branch("recent_failures",
                () -> taskRepository.findRecentFailures(RECENT_FAILURES_WINDOW, RECENT_FAILURES_LIMIT)));

        Map<String, ComponentStatus> state = new LinkedHashMap<>();
        branches.forEach((name, future) -> state.put(name, future.join()));
        return state;
    }

    private CompletableFuture<ComponentStatus> branch(String name, Supplier<?> query) {
        return CompletableFuture.supplyAsync(query, executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        return ComponentStatus.ok(name, result);
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    String message = cause instanceof TimeoutException
                            ? "timed out after " + timeout.toMillis() + "ms"
                            : String.valueOf(cause.getMessage());
                    log.warn("State component {} failed: {}", name, message);
                    return ComponentStatus.degraded(name, message);
                });
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
