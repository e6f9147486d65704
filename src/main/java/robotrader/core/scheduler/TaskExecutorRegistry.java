package robotrader.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table of executors by task type.
 */
public final class TaskExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutorRegistry.class);

    private final Map<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public TaskExecutorRegistry register(String taskType, TaskExecutor executor) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor is required");
        }
        TaskExecutor previous = executors.put(taskType, executor);
        if (previous != null) {
            log.warn("Executor for task type '{}' replaced", taskType);
        } else {
            log.debug("Registered executor for task type '{}'", taskType);
        }
        return this;
    }

    public Optional<TaskExecutor> find(String taskType) {
        return Optional.ofNullable(executors.get(taskType));
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(executors.keySet());
    }
}
