package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.error.TaskTimeoutException;
import robotrader.core.events.EventBus;
import robotrader.core.model.Task;
import robotrader.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Background task that recovers stalled RUNNING tasks.
 * <p>
 * A task is stalled when it has been RUNNING longer than the stuck threshold
 * and no live worker is executing it, e.g. after a crash or a transition that
 * could not be persisted. The reaper treats it as a timeout:
 * <ul>
 * <li>retry budget left: back to PENDING with the usual backoff</li>
 * <li>otherwise: FAILED</li>
 * </ul>
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskRepository taskRepository;
    private final EventBus eventBus;
    private final RetryPolicy retryPolicy;
    private final Predicate<String> inFlight;
    private final Duration stuckThreshold;
    private final Clock clock;

    /**
     * @param inFlight tells whether a live worker is executing a task id
     *                 (typically {@code QueueScheduler::isExecuting})
     */
    public TaskReaper(TaskRepository taskRepository, EventBus eventBus, RetryPolicy retryPolicy,
            Predicate<String> inFlight, CoordinatorConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.eventBus = eventBus;
        this.retryPolicy = retryPolicy;
        this.inFlight = inFlight;
        this.stuckThreshold = config.taskStuckThreshold();
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find and recover stalled RUNNING tasks.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        Instant now = clock.instant();
        List<Task> stuck = taskRepository.findStuckRunning(now.minus(stuckThreshold));

        if (stuck.isEmpty()) {
            log.debug("No stuck tasks found");
            return 0;
        }

        int retried = 0;
        int failed = 0;

        for (Task task : stuck) {
            if (inFlight.test(task.taskId())) {
                continue;
            }
            try {
                TaskTimeoutException error = new TaskTimeoutException(
                        "Task " + task.taskId() + " stalled in RUNNING since " + task.startedAt());
                if (task.canRetry()) {
                    long delayMs = retryPolicy.computeDelayMs(task.retryCount() + 1);
                    if (taskRepository.markRetry(task.taskId(), error.getMessage(), now.plusMillis(delayMs), null)) {
                        retried++;
                        log.info("Reaped task {} for retry (retry {} of {})",
                                task.taskId(), task.retryCount() + 1, task.maxRetries());
                        eventBus.publish(TaskEvents.failed(task, error, true, delayMs, null));
                    }
                } else if (taskRepository.markFailed(task.taskId(), error.getMessage(), now, null)) {
                    failed++;
                    log.warn("Task {} permanently failed after {} retries (stalled in RUNNING)",
                            task.taskId(), task.retryCount());
                    eventBus.publish(TaskEvents.failed(task, error, false, 0L, null));
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.taskId(), e);
            }
        }

        if (retried + failed > 0) {
            log.info("Task reaper: {} retried, {} failed, {} total stuck", retried, failed, stuck.size());
        }
        return retried + failed;
    }
}
