package robotrader.core.repository;

import robotrader.core.model.Task;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of queued tasks.
 * Every transition is a single conditional write that reports whether the
 * row actually moved, so concurrent or repeated calls are harmless.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save (normally PENDING)
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Head of a queue: the first PENDING task in priority, creation and
     * acceptance order. The head may still be waiting out a retry backoff.
     *
     * @param queueName the queue
     * @return the next task, if any
     */
    Optional<Task> findNextPending(String queueName);

    /**
     * PENDING tasks of a queue in execution order.
     *
     * @param queueName the queue
     * @param limit     maximum number of results
     * @return list of tasks
     */
    List<Task> findPending(String queueName, int limit);

    /**
     * All RUNNING tasks, optionally restricted to one queue.
     *
     * @param queueName the queue, or null for all queues
     * @return list of tasks ordered by start time
     */
    List<Task> findRunning(String queueName);

    /**
     * Terminal tasks of a queue that finished within the window, newest first.
     *
     * @param queueName the queue
     * @param window    how far back to look
     * @param limit     maximum number of results
     * @return list of tasks
     */
    List<Task> findHistory(String queueName, Duration window, int limit);

    /**
     * Find FAILED tasks across all queues that finished within the window,
     * newest first.
     */
    List<Task> findRecentFailures(Duration window, int limit);

    /**
     * Find RUNNING tasks that started before the cutoff.
     *
     * @param startedBefore cutoff timestamp
     * @return list of stuck tasks
     */
    List<Task> findStuckRunning(Instant startedBefore);

    /**
     * PENDING → RUNNING, only if no other task of the same queue is RUNNING.
     *
     * @return true if the task was claimed
     */
    boolean markRunning(String taskId, String queueName, Instant startedAt);

    /**
     * RUNNING → COMPLETED.
     *
     * @return true if updated
     */
    boolean markCompleted(String taskId, Instant completedAt, long durationMs);

    /**
     * RUNNING → PENDING with retry_count + 1, eligible again at {@code scheduledAt}.
     * Refused once the retry budget is spent.
     *
     * @return true if requeued
     */
    boolean markRetry(String taskId, String error, Instant scheduledAt, Long durationMs);

    /**
     * PENDING or RUNNING → FAILED.
     *
     * @return true if updated
     */
    boolean markFailed(String taskId, String error, Instant completedAt, Long durationMs);

    /**
     * PENDING or RUNNING → CANCELLED.
     *
     * @return true if updated
     */
    boolean markCancelled(String taskId, String reason, Instant completedAt);

    /**
     * Only cancels PENDING tasks.
     *
     * @return true if updated
     */
    boolean cancelPending(String taskId, String reason, Instant completedAt);
}
