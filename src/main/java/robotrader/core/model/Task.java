package robotrader.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a queued task as persisted in {@code queue_tasks}.
 * Tasks are mutated only by the queue scheduler; every change is a new snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Task {
    private final String taskId;
    private final String queueName;
    private final String taskType;
    private final TaskStatus status;
    private final int priority; // 1 = most urgent
    private final Map<String, Object> payload;
    private final int retryCount;
    private final int maxRetries;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String error;
    private final Instant scheduledAt; // earliest start after a retry backoff
    private final Long durationMs;
    private final String payloadDefect; // set when the stored payload could not be parsed

    private Task(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.queueName = Objects.requireNonNull(builder.queueName, "queueName is required");
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.payload = builder.payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.error = builder.error;
        this.scheduledAt = builder.scheduledAt;
        this.durationMs = builder.durationMs;
        this.payloadDefect = builder.payloadDefect;
    }

    @JsonProperty("task_id")
    public String taskId() {
        return taskId;
    }

    @JsonProperty("queue_name")
    public String queueName() {
        return queueName;
    }

    @JsonProperty("task_type")
    public String taskType() {
        return taskType;
    }

    @JsonProperty("status")
    public TaskStatus status() {
        return status;
    }

    @JsonProperty("priority")
    public int priority() {
        return priority;
    }

    @JsonProperty("payload")
    public Map<String, Object> payload() {
        return payload;
    }

    @JsonProperty("retry_count")
    public int retryCount() {
        return retryCount;
    }

    @JsonProperty("max_retries")
    public int maxRetries() {
        return maxRetries;
    }

    @JsonProperty("created_at")
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty("started_at")
    public Instant startedAt() {
        return startedAt;
    }

    @JsonProperty("completed_at")
    public Instant completedAt() {
        return completedAt;
    }

    @JsonProperty("error")
    public String error() {
        return error;
    }

    @JsonProperty("scheduled_at")
    public Instant scheduledAt() {
        return scheduledAt;
    }

    @JsonProperty("duration_ms")
    public Long durationMs() {
        return durationMs;
    }

    @JsonProperty("payload_defect")
    public String payloadDefect() {
        return payloadDefect;
    }

    /** Check if the stored payload could not be parsed */
    public boolean hasPayloadDefect() {
        return payloadDefect != null;
    }

    /** Check if task can be retried */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /** Check if task is in terminal state */
    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Check if a requeued task is still waiting out its backoff */
    public boolean isEligibleAt(Instant now) {
        return scheduledAt == null || !scheduledAt.isAfter(now);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .queueName(queueName)
                .taskType(taskType)
                .status(status)
                .priority(priority)
                .payload(payload)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .error(error)
                .scheduledAt(scheduledAt)
                .durationMs(durationMs)
                .payloadDefect(payloadDefect);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String queueName;
        private String taskType;
        private TaskStatus status = TaskStatus.PENDING;
        private int priority = 5;
        private Map<String, Object> payload;
        private int retryCount = 0;
        private int maxRetries = 3;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private String error;
        private Instant scheduledAt;
        private Long durationMs;
        private String payloadDefect;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder payloadDefect(String payloadDefect) {
            this.payloadDefect = payloadDefect;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(taskId, task.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "Task{id='" + taskId + "', queue='" + queueName + "', type='" + taskType
                + "', status=" + status + ", retry=" + retryCount + "/" + maxRetries + "}";
    }
}
