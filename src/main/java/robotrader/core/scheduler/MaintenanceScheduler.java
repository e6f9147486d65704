package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs periodic housekeeping on a single thread:
 * - TaskReaper: recovers stalled RUNNING tasks
 * - status refresh: forces a fresh status snapshot so observers see time-based changes
 * <p>
 * Can be started again after {@link #stop()}; each start gets a fresh thread.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final Runnable statusRefresh;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    /**
     * @param taskReaper    stalled task recovery
     * @param statusRefresh periodic status refresh (typically StatusCoordinator::refreshNow)
     * @param config        intervals
     */
    public MaintenanceScheduler(TaskReaper taskReaper, Runnable statusRefresh, CoordinatorConfig config) {
        this.taskReaper = taskReaper;
        this.statusRefresh = statusRefresh;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("robotrader-maintenance"));

        long reaperIntervalMs = config.taskReaperInterval().toMillis();
        executor.scheduleAtFixedRate(taskReaper, reaperIntervalMs, reaperIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", reaperIntervalMs);

        long refreshIntervalMs = config.statusRefreshInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("status-refresh", statusRefresh),
                refreshIntervalMs,
                refreshIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Status refresh scheduled every {}ms", refreshIntervalMs);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.info("Maintenance scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    // Keeps the fixed-rate schedule alive when the job throws
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
