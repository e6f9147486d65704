package robotrader.core.coordinator.status;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.model.ComponentStatus;
import robotrader.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects every registered {@link StatusSource} in parallel.
 * A failing or slow source becomes a degraded placeholder; the others still report.
 */
public class StatusAggregationCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(StatusAggregationCoordinator.class);

    static final String NAME = "status_aggregation_coordinator";
    private static final int POOL_SIZE = 8;

    private final Map<String, StatusSource> sources = new LinkedHashMap<>();
    private final Duration sourceTimeout;
    private final Clock clock;
    private ExecutorService pool;
    private volatile boolean initialized;

    public StatusAggregationCoordinator(Duration sourceTimeout, Clock clock) {
        this.sourceTimeout = sourceTimeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        pool = Executors.newFixedThreadPool(POOL_SIZE, new NamedThreadFactory("status-source"));
        initialized = true;
        log.info("Status aggregation initialized with sources {}", sources.keySet());
    }

    @Override
    public synchronized void cleanup() {
        if (pool != null) {
            pool.shutdownNow();
            pool = null;
        }
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Register a source. Registering a name twice replaces the earlier source.
     */
    public synchronized StatusAggregationCoordinator addSource(String name, StatusSource source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name is required");
        }
        sources.put(name, source);
        return this;
    }

    public synchronized boolean removeSource(String name) {
        return sources.remove(name) != null;
    }

    /**
     * Run all sources concurrently, each bounded by the source timeout.
     *
     * @throws IllegalStateException if not initialized
     */
    public StatusSnapshot aggregate() {
        Map<String, CompletableFuture<ComponentStatus>> branches = new LinkedHashMap<>();
        synchronized (this) {
            if (pool == null) {
                throw new IllegalStateException("Status aggregation is not initialized");
            }
            sources.forEach((name, source) -> branches.put(name, collect(name, source)));
        }

        Map<String, ComponentStatus> components = new LinkedHashMap<>();
        branches.forEach((name, future) -> components.put(name, future.join()));
        return StatusSnapshot.of(components, clock.instant());
    }

    private CompletableFuture<ComponentStatus> collect(String name, StatusSource source) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return source.collect();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, pool)
                .orTimeout(sourceTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((data, error) -> {
                    if (error == null) {
                        return ComponentStatus.ok(name, data);
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    String message = cause instanceof TimeoutException
                            ? "timed out after " + sourceTimeout.toMillis() + "ms"
                            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    log.warn("Status source {} degraded: {}", name, message);
                    return ComponentStatus.degraded(name, message);
                });
    }
}
