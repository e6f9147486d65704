package robotrader.core.scheduler;

import robotrader.core.model.Task;

import java.util.Map;

/**
 * Domain work for one task type. Implementations live outside the core.
 * <p>
 * Runs on the queue's execution thread under the task timeout and should
 * respond to interruption. Throw {@link robotrader.core.error.TaskValidationException}
 * for input that can never succeed; any other exception is retried.
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * @param task the RUNNING task
     * @return result data published with TASK_COMPLETED; may be empty or null
     */
    Map<String, Object> execute(Task task) throws Exception;
}
