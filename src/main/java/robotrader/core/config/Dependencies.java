package robotrader.core.config;

import robotrader.core.api.v1.HealthController;
import robotrader.core.api.v1.QueueController;
import robotrader.core.api.v1.StatusController;
import robotrader.core.broadcast.CircuitBreakerState;
import robotrader.core.coordinator.Coordinator;
import robotrader.core.coordinator.agent.AgentActivityCoordinator;
import robotrader.core.coordinator.agent.AgentCoordinator;
import robotrader.core.coordinator.agent.AgentRegistrationCoordinator;
import robotrader.core.coordinator.broadcast.BroadcastCoordinator;
import robotrader.core.coordinator.broadcast.BroadcastExecutionCoordinator;
import robotrader.core.coordinator.broadcast.BroadcastHealthCoordinator;
import robotrader.core.coordinator.message.MessageCoordinator;
import robotrader.core.coordinator.message.MessageHandlingCoordinator;
import robotrader.core.coordinator.message.MessageRoutingCoordinator;
import robotrader.core.coordinator.queue.QueueCoordinator;
import robotrader.core.coordinator.status.StatusAggregationCoordinator;
import robotrader.core.coordinator.status.StatusBroadcastCoordinator;
import robotrader.core.coordinator.status.StatusCoordinator;
import robotrader.core.coordinator.status.StatusSources;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventJournal;
import robotrader.core.repository.AgentRepository;
import robotrader.core.repository.StateRepository;
import robotrader.core.repository.TaskRepository;
import robotrader.core.scheduler.ExponentialBackoffRetryPolicy;
import robotrader.core.scheduler.MaintenanceScheduler;
import robotrader.core.scheduler.QueueScheduler;
import robotrader.core.scheduler.RetryPolicy;
import robotrader.core.scheduler.TaskExecutorRegistry;
import robotrader.core.scheduler.TaskReaper;
import robotrader.core.server.RouterHandler;
import robotrader.core.server.StatusServer;
import robotrader.core.server.WebSocketBroadcastTransport;
import robotrader.core.store.Database;
import robotrader.core.store.DatabaseStateRepository;
import robotrader.core.store.JdbcAgentRepository;
import robotrader.core.store.JdbcEventJournal;
import robotrader.core.store.JdbcQueueStateRepository;
import robotrader.core.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates and wires the store, event bus, scheduler and coordinators.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.executors().register("fetch_prices", task -> fetcher.fetch(task.payload()));
 * deps.start();        // coordinators, queues, maintenance
 * deps.startServer();  // observer HTTP + WebSocket
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;

    // Infrastructure
    private final Database database;
    private final TaskRepository taskRepository;
    private final DatabaseStateRepository stateRepository;
    private final AgentRepository agentRepository;
    private final EventJournal eventJournal;
    private final EventBus eventBus;

    // Scheduling
    private final TaskExecutorRegistry executors;
    private final QueueScheduler queueScheduler;
    private final TaskReaper taskReaper;
    private final MaintenanceScheduler maintenanceScheduler;

    // Coordinators
    private final QueueCoordinator queueCoordinator;
    private final StatusCoordinator statusCoordinator;
    private final BroadcastCoordinator broadcastCoordinator;
    private final MessageCoordinator messageCoordinator;
    private final AgentCoordinator agentCoordinator;

    // Observer server
    private final WebSocketBroadcastTransport webSocketTransport;
    private final RouterHandler routerHandler;
    private final StatusServer statusServer;

    private boolean started;

    private Dependencies(CoordinatorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);
        this.taskRepository = new JdbcTaskRepository(database, clock);
        this.stateRepository = new DatabaseStateRepository(taskRepository,
                new JdbcQueueStateRepository(database, config.queueNames(), config.statisticsWindow(), clock),
                config.repositoryTimeout());
        this.agentRepository = new JdbcAgentRepository(database);
        this.eventJournal = config.eventJournalEnabled() ? new JdbcEventJournal(database, clock) : EventJournal.NOOP;
        this.eventBus = new EventBus(eventJournal);

        RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
                config.retryBaseDelay().toMillis(), config.retryMaxDelay().toMillis());
        this.executors = new TaskExecutorRegistry();
        this.queueScheduler = new QueueScheduler(taskRepository, executors, eventBus, config, retryPolicy, clock);
        this.taskReaper = new TaskReaper(taskRepository, eventBus, retryPolicy, queueScheduler::isExecuting,
                config, clock);

        // Broadcast domain
        BroadcastHealthCoordinator broadcastHealth = new BroadcastHealthCoordinator(eventBus, config, clock);
        this.broadcastCoordinator = new BroadcastCoordinator(eventBus, broadcastHealth,
                new BroadcastExecutionCoordinator(broadcastHealth, config.broadcastTimeout()));

        // Status domain
        StatusAggregationCoordinator aggregation = new StatusAggregationCoordinator(
                config.statusSourceTimeout(), clock);
        aggregation.addSource("queues", StatusSources.queues(stateRepository))
                .addSource("scheduler", StatusSources.scheduler(queueScheduler))
                .addSource("database", StatusSources.database(database))
                .addSource("events", StatusSources.events(eventBus))
                .addSource("agents", StatusSources.agents(agentRepository))
                .addSource("broadcast", this::broadcastStatus);
        this.statusCoordinator = new StatusCoordinator(aggregation,
                new StatusBroadcastCoordinator(eventBus, aggregation, config.statusDebounce()));

        // Queue, message and agent domains
        this.queueCoordinator = new QueueCoordinator(queueScheduler, stateRepository, eventBus);
        this.messageCoordinator = new MessageCoordinator(
                new MessageRoutingCoordinator(eventBus, config.messageResponseTimeout()),
                new MessageHandlingCoordinator(eventBus));
        this.agentCoordinator = new AgentCoordinator(
                new AgentRegistrationCoordinator(agentRepository, eventBus, clock),
                new AgentActivityCoordinator(agentRepository, eventBus, clock));

        this.maintenanceScheduler = new MaintenanceScheduler(taskReaper, statusCoordinator::refreshNow, config);

        // Observer server
        this.webSocketTransport = new WebSocketBroadcastTransport();
        this.webSocketTransport.setOnConnect(statusCoordinator::forceRefresh);
        this.broadcastCoordinator.setTransport(webSocketTransport);
        this.routerHandler = new RouterHandler()
                .registerController(new HealthController(database, stateRepository, queueCoordinator,
                        broadcastCoordinator))
                .registerController(new StatusController(statusCoordinator))
                .registerController(new QueueController(queueCoordinator));
        this.statusServer = new StatusServer(config, routerHandler, webSocketTransport);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create(CoordinatorConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // ==================== Lifecycle ====================

    /**
     * Initialize every coordinator, start the queue workers and the
     * maintenance scheduler. Register executors before calling this.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        // Consumers of an event subscribe before its producers start
        for (Coordinator coordinator : coordinators()) {
            coordinator.initialize();
        }
        queueCoordinator.startQueues();
        maintenanceScheduler.start();
        started = true;
        statusCoordinator.forceRefresh();
        log.info("Orchestration core started with queues {}", config.queueNames());
    }

    public void startServer() {
        statusServer.start();
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        stopQuietly("status server", statusServer::stop);
        stopQuietly("maintenance scheduler", maintenanceScheduler::stop);

        List<Coordinator> coordinators = coordinators();
        for (int i = coordinators.size() - 1; i >= 0; i--) {
            Coordinator coordinator = coordinators.get(i);
            stopQuietly(coordinator.name(), coordinator::cleanup);
        }
        stopQuietly("queue scheduler", queueScheduler::stopAll);
        stopQuietly("state repository", stateRepository::close);
        stopQuietly("database", database::close);

        started = false;
        log.info("Dependencies closed");
    }

    private List<Coordinator> coordinators() {
        return List.of(broadcastCoordinator, statusCoordinator, agentCoordinator, messageCoordinator,
                queueCoordinator);
    }

    private static void stopQuietly(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Error stopping {}: {}", name, e.getMessage());
        }
    }

    private Map<String, Object> broadcastStatus() {
        CircuitBreakerState state = broadcastCoordinator.circuitState();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("circuit_state", state.phase());
        data.put("circuit_trips", state.trips());
        data.put("websocket_clients", webSocketTransport.clientCount());
        return data;
    }

    // ==================== Accessors ====================

    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public StateRepository stateRepository() {
        return stateRepository;
    }

    public AgentRepository agentRepository() {
        return agentRepository;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public TaskExecutorRegistry executors() {
        return executors;
    }

    public QueueScheduler queueScheduler() {
        return queueScheduler;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    public MaintenanceScheduler maintenanceScheduler() {
        return maintenanceScheduler;
    }

    public QueueCoordinator queueCoordinator() {
        return queueCoordinator;
    }

    public StatusCoordinator statusCoordinator() {
        return statusCoordinator;
    }

    public BroadcastCoordinator broadcastCoordinator() {
        return broadcastCoordinator;
    }

    public MessageCoordinator messageCoordinator() {
        return messageCoordinator;
    }

    public AgentCoordinator agentCoordinator() {
        return agentCoordinator;
    }

    public RouterHandler routerHandler() {
        return routerHandler;
    }

    public StatusServer statusServer() {
        return statusServer;
    }

    public WebSocketBroadcastTransport webSocketTransport() {
        return webSocketTransport;
    }
}
