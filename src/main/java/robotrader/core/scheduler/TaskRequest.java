package robotrader.core.scheduler;

import java.util.Map;

/**
 * Request to enqueue a task.
 *
 * @param queueName  target queue
 * @param taskType   executor lookup key
 * @param payload    JSON-serializable data handed to the executor
 * @param priority   1 (most urgent) to 10
 * @param maxRetries retry budget, or null for the configured default
 */
public record TaskRequest(
        String queueName,
        String taskType,
        Map<String, Object> payload,
        int priority,
        Integer maxRetries) {

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    public static TaskRequest of(String queueName, String taskType, Map<String, Object> payload) {
        return new TaskRequest(queueName, taskType, payload, DEFAULT_PRIORITY, null);
    }

    public TaskRequest withPriority(int priority) {
        return new TaskRequest(queueName, taskType, payload, priority, maxRetries);
    }

    public TaskRequest withMaxRetries(int maxRetries) {
        return new TaskRequest(queueName, taskType, payload, priority, maxRetries);
    }
}
