package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.error.TaskValidationException;
import robotrader.core.events.EventBus;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.repository.TaskRepository;
import robotrader.core.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns one {@link QueueWorker} per configured queue.
 * Queues run concurrently; tasks within a queue run strictly in order.
 *
 * <pre>
 * QueueScheduler scheduler = new QueueScheduler(taskRepository, executors, eventBus, config);
 * scheduler.startAll();
 * Task task = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("symbol", "AAPL")));
 * </pre>
 */
public class QueueScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);

    static final String CANCEL_REASON = "Cancelled by request";

    private final TaskRepository taskRepository;
    private final EventBus eventBus;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final Map<String, QueueWorker> workers;

    public QueueScheduler(TaskRepository taskRepository, TaskExecutorRegistry executors, EventBus eventBus,
            CoordinatorConfig config) {
        this(taskRepository, executors, eventBus, config,
                new ExponentialBackoffRetryPolicy(config.retryBaseDelay().toMillis(),
                        config.retryMaxDelay().toMillis()),
                Clock.systemUTC());
    }

    public QueueScheduler(TaskRepository taskRepository, TaskExecutorRegistry executors, EventBus eventBus,
            CoordinatorConfig config, RetryPolicy retryPolicy, Clock clock) {
        this.taskRepository = taskRepository;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;

        Map<String, QueueWorker> table = new LinkedHashMap<>();
        for (String name : config.queueNames()) {
            table.put(name, new QueueWorker(name, taskRepository, executors, eventBus, retryPolicy, config, clock));
        }
        this.workers = Collections.unmodifiableMap(table);
    }

    // ==================== Lifecycle ====================

    public void startAll() {
        workers.values().forEach(QueueWorker::start);
        log.info("Started {} queue workers", workers.size());
    }

    public void stopAll() {
        // Stop in parallel so one slow task does not delay the other queues
        List<Thread> stoppers = new ArrayList<>();
        for (QueueWorker worker : workers.values()) {
            if (worker.isRunning()) {
                Thread stopper = new Thread(worker::stop, "stop-" + worker.queueName());
                stopper.setDaemon(true);
                stopper.start();
                stoppers.add(stopper);
            }
        }
        for (Thread stopper : stoppers) {
            try {
                stopper.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping queue workers");
                return;
            }
        }
        log.info("Stopped {} queue workers", stoppers.size());
    }

    /**
     * @return true if the queue was started by this call
     * @throws IllegalArgumentException if the queue is unknown
     */
    public boolean start(String queueName) {
        return worker(queueName).start();
    }

    /**
     * @return true if the queue was running and is now stopped
     * @throws IllegalArgumentException if the queue is unknown
     */
    public boolean stop(String queueName) {
        return worker(queueName).stop();
    }

    public boolean isRunning(String queueName) {
        return worker(queueName).isRunning();
    }

    @Override
    public void close() {
        stopAll();
    }

    // ==================== Tasks ====================

    /**
     * Validate and persist a new PENDING task, then wake its queue.
     *
     * @throws IllegalArgumentException if the queue is unknown or an argument is out of range
     * @throws TaskValidationException  if the payload is not JSON-serializable
     */
    public Task enqueue(TaskRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        QueueWorker worker = worker(request.queueName());
        if (request.taskType() == null || request.taskType().isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (request.priority() < TaskRequest.HIGHEST_PRIORITY || request.priority() > TaskRequest.LOWEST_PRIORITY) {
            throw new IllegalArgumentException("priority must be between " + TaskRequest.HIGHEST_PRIORITY
                    + " and " + TaskRequest.LOWEST_PRIORITY + ", got: " + request.priority());
        }
        int maxRetries = request.maxRetries() != null ? request.maxRetries() : config.defaultMaxRetries();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        Map<String, Object> payload = request.payload() != null ? request.payload() : Map.of();
        try {
            JsonCodec.toJson(payload);
        } catch (IllegalArgumentException e) {
            throw new TaskValidationException("Payload is not JSON-serializable: " + e.getMessage(), e);
        }

        Task task = Task.builder()
                .taskId(UUID.randomUUID().toString())
                .queueName(request.queueName())
                .taskType(request.taskType())
                .status(TaskStatus.PENDING)
                .priority(request.priority())
                .payload(payload)
                .maxRetries(maxRetries)
                .createdAt(clock.instant())
                .build();

        taskRepository.save(task);
        log.debug("Enqueued task {} ({}) on queue '{}' with priority {}",
                task.taskId(), task.taskType(), task.queueName(), task.priority());

        eventBus.publish(TaskEvents.created(task));
        worker.wake();
        return task;
    }

    /**
     * Cancel a task that has not started yet.
     *
     * @return true if the task moved from PENDING to CANCELLED
     */
    public boolean cancel(String taskId) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            log.debug("Cancel requested for unknown task {}", taskId);
            return false;
        }
        Task task = found.get();
        if (!taskRepository.cancelPending(taskId, CANCEL_REASON, clock.instant())) {
            log.debug("Task {} is {} and cannot be cancelled", taskId, task.status());
            return false;
        }

        log.info("Cancelled task {} on queue '{}'", taskId, task.queueName());
        eventBus.publish(TaskEvents.cancelled(task, CANCEL_REASON));
        QueueWorker worker = workers.get(task.queueName());
        if (worker != null) {
            worker.wake();
        }
        return true;
    }

    // ==================== Introspection ====================

    public List<String> queueNames() {
        return new ArrayList<>(workers.keySet());
    }

    public boolean hasQueue(String queueName) {
        return workers.containsKey(queueName);
    }

    /** Whether any worker is executing the given task right now. */
    public boolean isExecuting(String taskId) {
        for (QueueWorker worker : workers.values()) {
            if (worker.isExecuting(taskId)) {
                return true;
            }
        }
        return false;
    }

    public WorkerStatus workerStatus(String queueName) {
        return worker(queueName).status();
    }

    public Map<String, WorkerStatus> workerStatuses() {
        Map<String, WorkerStatus> statuses = new LinkedHashMap<>();
        workers.forEach((name, worker) -> statuses.put(name, worker.status()));
        return statuses;
    }

    public List<ExecutionRecord> history(String queueName) {
        return worker(queueName).history();
    }

    private QueueWorker worker(String queueName) {
        QueueWorker worker = queueName == null ? null : workers.get(queueName);
        if (worker == null) {
            throw new IllegalArgumentException("Unknown queue: " + queueName);
        }
        return worker;
    }
}
