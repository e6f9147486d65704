package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.error.OrchestrationException;
import robotrader.core.error.StoreException;
import robotrader.core.error.TaskExecutionException;
import robotrader.core.error.TaskTimeoutException;
import robotrader.core.error.TaskValidationException;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.repository.TaskRepository;
import robotrader.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Executes the tasks of one queue, strictly one at a time.
 * <p>
 * The loop thread always looks at the head of the queue (priority, creation
 * time, acceptance sequence). If the head is still backing off after a failed
 * attempt, the worker waits for it rather than running a later task. Executor
 * calls happen on a separate single-thread pool so they can be bounded by the
 * task timeout; a pool whose thread overran the timeout is discarded.
 * <p>
 * Every state transition is persisted before the loop moves on. Store errors
 * are retried after {@code storeRetryDelay}; a transition that could not be
 * persisted before {@link #stop()} leaves a RUNNING row that the next start
 * recovers.
 */
public class QueueWorker {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private static final Duration CANCEL_GRACE = Duration.ofSeconds(5);
    static final String STOP_REASON = "Cancelled: queue stopped";
    static final String ORPHAN_REASON = "Interrupted: task was RUNNING when the queue worker started";

    private final String queueName;
    private final TaskRepository taskRepository;
    private final TaskExecutorRegistry executors;
    private final EventBus eventBus;
    private final RetryPolicy retryPolicy;
    private final CoordinatorConfig config;
    private final Clock clock;

    private final Semaphore wakeup = new Semaphore(0);
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();

    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean cancelRequested = false;
    private volatile boolean needsRecovery = true;
    private volatile Thread loopThread;
    private volatile ExecutorService executionPool;
    private volatile Task current;
    private volatile Future<Map<String, Object>> currentFuture;

    public QueueWorker(String queueName, TaskRepository taskRepository, TaskExecutorRegistry executors,
            EventBus eventBus, RetryPolicy retryPolicy, CoordinatorConfig config, Clock clock) {
        this.queueName = queueName;
        this.taskRepository = taskRepository;
        this.executors = executors;
        this.eventBus = eventBus;
        this.retryPolicy = retryPolicy;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start the loop thread. Does nothing if already running.
     *
     * @return true if the worker was started by this call
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        running = true;
        cancelRequested = false;
        needsRecovery = true;
        wakeup.drainPermits();
        executionPool = newExecutionPool();

        Thread thread = new Thread(this::runLoop, "queue-" + queueName);
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();

        log.info("Queue worker '{}' started", queueName);
        return true;
    }

    /**
     * Stop the worker. The in-flight task gets {@code queueStopTimeout} to finish;
     * after that it is cancelled and persisted as CANCELLED.
     *
     * @return true if the worker was running
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        wakeup.release();

        Thread thread = loopThread;
        join(thread, config.queueStopTimeout());

        if (thread != null && thread.isAlive()) {
            Task inFlight = current;
            log.warn("Queue '{}': task {} did not finish within {}ms, cancelling",
                    queueName, inFlight != null ? inFlight.taskId() : "-", config.queueStopTimeout().toMillis());
            cancelRequested = true;
            Future<Map<String, Object>> future = currentFuture;
            if (future != null) {
                future.cancel(true);
            }
            join(thread, CANCEL_GRACE);
            if (thread.isAlive()) {
                log.error("Queue worker '{}' did not terminate", queueName);
            }
        }

        executionPool.shutdownNow();
        loopThread = null;
        log.info("Queue worker '{}' stopped", queueName);
        return true;
    }

    /** Wake the loop so it re-reads the head of the queue. */
    public void wake() {
        wakeup.release();
    }

    public String queueName() {
        return queueName;
    }

    public boolean isRunning() {
        return running;
    }

    /** Whether this worker is executing the given task right now. */
    public boolean isExecuting(String taskId) {
        Task task = current;
        return task != null && task.taskId().equals(taskId);
    }

    public WorkerStatus status() {
        Task task = current;
        return new WorkerStatus(
                queueName,
                running,
                task != null ? task.taskId() : null,
                task != null ? task.taskType() : null,
                task != null ? task.startedAt() : null,
                executed.get(),
                failed.get(),
                storeErrors.get());
    }

    /** Recent executions, newest first. */
    public List<ExecutionRecord> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    // ==================== Loop ====================

    private void runLoop() {
        while (running) {
            try {
                if (needsRecovery) {
                    needsRecovery = false;
                    recoverOrphans();
                }
                processNext();
            } catch (StoreException e) {
                storeErrors.incrementAndGet();
                log.warn("Queue '{}': store unavailable, retrying in {}ms: {}",
                        queueName, config.storeRetryDelay().toMillis(), e.getMessage());
                pause(config.storeRetryDelay());
            } catch (Throwable e) {
                // The current task may be left RUNNING; recovery requeues it
                needsRecovery = true;
                log.error("Queue '{}': unexpected error in worker loop", queueName, e);
                pause(config.storeRetryDelay());
            }
        }
    }

    private void processNext() {
        Optional<Task> head = taskRepository.findNextPending(queueName);
        if (head.isEmpty()) {
            pause(config.pollInterval());
            return;
        }

        Task task = head.get();
        Instant now = clock.instant();
        if (!task.isEligibleAt(now)) {
            Duration wait = Duration.between(now, task.scheduledAt());
            pause(wait.compareTo(config.pollInterval()) < 0 ? wait : config.pollInterval());
            return;
        }

        Instant startedAt = clock.instant();
        if (!taskRepository.markRunning(task.taskId(), queueName, startedAt)) {
            // Cancelled in between, or a RUNNING row without a live execution
            log.debug("Queue '{}': task {} could not be started", queueName, task.taskId());
            needsRecovery = !taskRepository.findRunning(queueName).isEmpty();
            return;
        }

        execute(task.toBuilder()
                .status(TaskStatus.RUNNING)
                .startedAt(startedAt)
                .completedAt(null)
                .build());
    }

    private void execute(Task task) {
        current = task;
        long startNanos = System.nanoTime();
        try {
            log.debug("Queue '{}': starting task {} ({})", queueName, task.taskId(), task.taskType());
            publish(TaskEvents.started(task));

            if (task.hasPayloadDefect()) {
                log.error("Data-quality alarm: task {} in queue '{}' has an unreadable payload: {}",
                        task.taskId(), queueName, task.payloadDefect());
                handleFailure(task, new TaskValidationException("Unreadable payload: " + task.payloadDefect()),
                        elapsedMs(startNanos));
                return;
            }

            Optional<TaskExecutor> executor = executors.find(task.taskType());
            if (executor.isEmpty()) {
                handleFailure(task, new TaskValidationException(
                        "No executor registered for task type: " + task.taskType()), elapsedMs(startNanos));
                return;
            }

            runExecutor(task, executor.get(), startNanos);
        } finally {
            current = null;
            currentFuture = null;
        }
    }

    private void runExecutor(Task task, TaskExecutor executor, long startNanos) {
        Future<Map<String, Object>> future = executionPool.submit(() -> executor.execute(task));
        currentFuture = future;
        if (cancelRequested) {
            future.cancel(true);
        }

        try {
            Map<String, Object> result = future.get(config.taskTimeout().toMillis(), TimeUnit.MILLISECONDS);
            handleSuccess(task, result, elapsedMs(startNanos));
        } catch (TimeoutException e) {
            future.cancel(true);
            replaceExecutionPool();
            handleFailure(task, new TaskTimeoutException(task.taskId(), config.taskTimeout()),
                    elapsedMs(startNanos));
        } catch (CancellationException e) {
            handleCancelled(task, STOP_REASON, elapsedMs(startNanos));
        } catch (ExecutionException e) {
            handleFailure(task, classify(e.getCause()), elapsedMs(startNanos));
        } catch (InterruptedException e) {
            future.cancel(true);
            // Clear the flag so the CANCELLED transition can still be written
            Thread.interrupted();
            handleCancelled(task, STOP_REASON, elapsedMs(startNanos));
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    // ==================== Outcomes ====================

    private void handleSuccess(Task task, Map<String, Object> result, long durationMs) {
        Boolean moved = persist("complete", task.taskId(),
                () -> taskRepository.markCompleted(task.taskId(), clock.instant(), durationMs));
        if (!Boolean.TRUE.equals(moved)) {
            warnNotMoved(task, moved, "completed");
            return;
        }
        executed.incrementAndGet();
        record(task, ExecutionOutcome.COMPLETED, durationMs, null);
        log.debug("Queue '{}': task {} completed in {}ms", queueName, task.taskId(), durationMs);
        publish(TaskEvents.completed(task, durationMs, result));
    }

    private void handleFailure(Task task, OrchestrationException error, Long durationMs) {
        String message = error.getMessage();
        boolean retry = error.isRetryable() && task.canRetry();

        if (retry) {
            int attempt = task.retryCount() + 1;
            long delayMs = retryPolicy.computeDelayMs(attempt);
            Instant scheduledAt = clock.instant().plusMillis(delayMs);
            Boolean moved = persist("requeue", task.taskId(),
                    () -> taskRepository.markRetry(task.taskId(), message, scheduledAt, durationMs));
            if (Boolean.TRUE.equals(moved)) {
                record(task, ExecutionOutcome.RETRY_SCHEDULED, durationMs, message);
                log.warn("Queue '{}': task {} failed, retry {} of {} in {}ms: {}",
                        queueName, task.taskId(), attempt, task.maxRetries(), delayMs, message);
                publish(TaskEvents.failed(task, error, true, delayMs, durationMs));
                return;
            }
            if (moved == null) {
                warnNotMoved(task, null, "requeued");
                return;
            }
            // Retry budget changed under us; fall through to a terminal failure
        }

        Boolean moved = persist("fail", task.taskId(),
                () -> taskRepository.markFailed(task.taskId(), message, clock.instant(), durationMs));
        if (!Boolean.TRUE.equals(moved)) {
            warnNotMoved(task, moved, "failed");
            return;
        }
        failed.incrementAndGet();
        record(task, ExecutionOutcome.FAILED, durationMs, message);
        log.error("Queue '{}': task {} ({}) failed permanently after {} retries: {}",
                queueName, task.taskId(), task.taskType(), task.retryCount(), message);
        publish(TaskEvents.failed(task, error, false, 0L, durationMs));
    }

    private void handleCancelled(Task task, String reason, long durationMs) {
        Boolean moved = persist("cancel", task.taskId(),
                () -> taskRepository.markCancelled(task.taskId(), reason, clock.instant()));
        if (!Boolean.TRUE.equals(moved)) {
            warnNotMoved(task, moved, "cancelled");
            return;
        }
        record(task, ExecutionOutcome.CANCELLED, durationMs, reason);
        log.warn("Queue '{}': task {} cancelled: {}", queueName, task.taskId(), reason);
        publish(TaskEvents.cancelled(task, reason));
    }

    private void recoverOrphans() {
        List<Task> orphans;
        try {
            orphans = taskRepository.findRunning(queueName);
        } catch (StoreException e) {
            needsRecovery = true;
            throw e;
        }
        for (Task orphan : orphans) {
            log.warn("Queue '{}': recovering task {} left RUNNING since {}",
                    queueName, orphan.taskId(), orphan.startedAt());
            handleFailure(orphan, new TaskExecutionException(ORPHAN_REASON, null), null);
        }
    }

    private void warnNotMoved(Task task, Boolean moved, String target) {
        if (moved == null) {
            needsRecovery = true;
            log.error("Queue '{}': task {} could not be {} before stop; it will be recovered on next start",
                    queueName, task.taskId(), target);
        } else {
            log.warn("Queue '{}': task {} was no longer RUNNING and could not be {}",
                    queueName, task.taskId(), target);
        }
    }

    // ==================== Helpers ====================

    /**
     * Run a transition until the store accepts it.
     *
     * @return the transition result, or null if the worker stopped before it could be written
     */
    private Boolean persist(String action, String taskId, BooleanSupplier transition) {
        while (true) {
            try {
                return transition.getAsBoolean();
            } catch (StoreException e) {
                storeErrors.incrementAndGet();
                if (!running || Thread.currentThread().isInterrupted()) {
                    log.error("Queue '{}': failed to {} task {}: {}", queueName, action, taskId, e.getMessage());
                    return null;
                }
                log.warn("Queue '{}': failed to {} task {}, retrying in {}ms: {}",
                        queueName, action, taskId, config.storeRetryDelay().toMillis(), e.getMessage());
                pause(config.storeRetryDelay());
            }
        }
    }

    private static OrchestrationException classify(Throwable cause) {
        if (cause instanceof OrchestrationException orchestration) {
            return orchestration;
        }
        String message = cause == null || cause.getMessage() == null
                ? (cause == null ? "Unknown executor failure" : cause.getClass().getSimpleName())
                : cause.getMessage();
        return new TaskExecutionException(message, cause);
    }

    private void record(Task task, ExecutionOutcome outcome, Long durationMs, String error) {
        ExecutionRecord entry = new ExecutionRecord(task.taskId(), task.taskType(), outcome,
                durationMs != null ? durationMs : 0L, clock.instant(), error);
        synchronized (history) {
            history.addFirst(entry);
            while (history.size() > config.executionHistorySize()) {
                history.removeLast();
            }
        }
    }

    private void publish(Event event) {
        eventBus.publish(event);
    }

    /** Wait up to the given time, returning early on {@link #wake()} or stop. */
    private void pause(Duration duration) {
        long millis = Math.max(1L, duration.toMillis());
        try {
            if (wakeup.tryAcquire(millis, TimeUnit.MILLISECONDS)) {
                wakeup.drainPermits();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void replaceExecutionPool() {
        ExecutorService stale = executionPool;
        executionPool = newExecutionPool();
        stale.shutdownNow();
        log.warn("Queue '{}': execution thread replaced after timeout", queueName);
    }

    private ExecutorService newExecutionPool() {
        return Executors.newSingleThreadExecutor(new NamedThreadFactory("queue-" + queueName + "-exec"));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void join(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
