package robotrader.core.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for the orchestration core.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    public static final List<String> DEFAULT_QUEUES = List.of(
            "portfolio_sync",
            "data_fetcher",
            "ai_analysis",
            "portfolio_analysis",
            "paper_trading_research",
            "paper_trading_execution");

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/robotrader;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private List<String> queueNames = DEFAULT_QUEUES;
    private Duration taskTimeout = Duration.ofSeconds(900);
    private int defaultMaxRetries = 3;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration retryBaseDelay = Duration.ofSeconds(2);
    private Duration retryMaxDelay = Duration.ofMinutes(5);
    private Duration storeRetryDelay = Duration.ofSeconds(5);
    private Duration taskStuckThreshold = Duration.ofMinutes(16);
    private Duration taskReaperInterval = Duration.ofSeconds(30);
    private Duration queueStopTimeout = Duration.ofSeconds(30);
    private Duration statisticsWindow = Duration.ofHours(24);
    private int executionHistorySize = 100;

    // Repository / status settings
    private Duration repositoryTimeout = Duration.ofSeconds(10);
    private Duration statusSourceTimeout = Duration.ofSeconds(5);
    private Duration statusDebounce = Duration.ofMillis(250);
    private Duration statusRefreshInterval = Duration.ofSeconds(30);

    // Broadcast settings
    private int broadcastFailureThreshold = 5;
    private int broadcastSuccessThreshold = 3;
    private Duration broadcastRecoveryTimeout = Duration.ofSeconds(60);
    private Duration broadcastTimeout = Duration.ofSeconds(5);

    // Messaging / events
    private Duration messageResponseTimeout = Duration.ofSeconds(30);
    private boolean eventJournalEnabled = true;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("ROBOTRADER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("ROBOTRADER_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String port = System.getenv("ROBOTRADER_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String queues = System.getenv("ROBOTRADER_QUEUES");
        if (queues != null && !queues.isBlank()) {
            config.queueNames = parseQueueNames(queues);
        }

        String timeout = System.getenv("ROBOTRADER_TASK_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.taskTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
            config.taskStuckThreshold = config.taskTimeout.plusSeconds(60);
        }

        String maxRetries = System.getenv("ROBOTRADER_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        String journal = System.getenv("ROBOTRADER_EVENT_JOURNAL");
        if (journal != null && !journal.isBlank()) {
            config.eventJournalEnabled = Boolean.parseBoolean(journal.trim());
        }

        return config;
    }

    static List<String> parseQueueNames(String raw) {
        List<String> names = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one queue name is required");
        }
        return names;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public List<String> queueNames() {
        return queueNames;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration storeRetryDelay() {
        return storeRetryDelay;
    }

    public Duration taskStuckThreshold() {
        return taskStuckThreshold;
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    public Duration queueStopTimeout() {
        return queueStopTimeout;
    }

    public Duration statisticsWindow() {
        return statisticsWindow;
    }

    public int executionHistorySize() {
        return executionHistorySize;
    }

    public Duration repositoryTimeout() {
        return repositoryTimeout;
    }

    public Duration statusSourceTimeout() {
        return statusSourceTimeout;
    }

    public Duration statusDebounce() {
        return statusDebounce;
    }

    public Duration statusRefreshInterval() {
        return statusRefreshInterval;
    }

    public int broadcastFailureThreshold() {
        return broadcastFailureThreshold;
    }

    public int broadcastSuccessThreshold() {
        return broadcastSuccessThreshold;
    }

    public Duration broadcastRecoveryTimeout() {
        return broadcastRecoveryTimeout;
    }

    public Duration broadcastTimeout() {
        return broadcastTimeout;
    }

    public Duration messageResponseTimeout() {
        return messageResponseTimeout;
    }

    public boolean eventJournalEnabled() {
        return eventJournalEnabled;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withQueueNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("At least one queue name is required");
        }
        this.queueNames = List.copyOf(names);
        return this;
    }

    public CoordinatorConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withRetryDelays(Duration base, Duration max) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        return this;
    }

    public CoordinatorConfig withStoreRetryDelay(Duration delay) {
        this.storeRetryDelay = delay;
        return this;
    }

    public CoordinatorConfig withTaskStuckThreshold(Duration threshold) {
        this.taskStuckThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withTaskReaperInterval(Duration interval) {
        this.taskReaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withQueueStopTimeout(Duration timeout) {
        this.queueStopTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStatisticsWindow(Duration window) {
        this.statisticsWindow = window;
        return this;
    }

    public CoordinatorConfig withRepositoryTimeout(Duration timeout) {
        this.repositoryTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStatusSourceTimeout(Duration timeout) {
        this.statusSourceTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStatusDebounce(Duration debounce) {
        this.statusDebounce = debounce;
        return this;
    }

    public CoordinatorConfig withStatusRefreshInterval(Duration interval) {
        this.statusRefreshInterval = interval;
        return this;
    }

    public CoordinatorConfig withBroadcastThresholds(int failureThreshold, int successThreshold) {
        this.broadcastFailureThreshold = failureThreshold;
        this.broadcastSuccessThreshold = successThreshold;
        return this;
    }

    public CoordinatorConfig withBroadcastRecoveryTimeout(Duration timeout) {
        this.broadcastRecoveryTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withBroadcastTimeout(Duration timeout) {
        this.broadcastTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMessageResponseTimeout(Duration timeout) {
        this.messageResponseTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withEventJournal(boolean enabled) {
        this.eventJournalEnabled = enabled;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", queues=" + queueNames +
                ", taskTimeout=" + taskTimeout +
                ", maxRetries=" + defaultMaxRetries +
                ", eventJournal=" + eventJournalEnabled +
                '}';
    }
}
