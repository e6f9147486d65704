package robotrader.core.coordinator.broadcast;

import robotrader.core.broadcast.BroadcastMessage;
import robotrader.core.broadcast.BroadcastTransport;
import robotrader.core.coordinator.Coordinator;
import robotrader.core.error.BroadcastException;
import robotrader.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Delivers broadcast messages through the transport, one at a time.
 * <p>
 * Sends run on a single sender thread so they never block event publishers.
 * Each transport call is bounded by the broadcast timeout. Status snapshots
 * whose hash equals the last delivered one are skipped unless forced.
 */
public class BroadcastExecutionCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(BroadcastExecutionCoordinator.class);

    static final String NAME = "broadcast_execution_coordinator";

    private final BroadcastHealthCoordinator health;
    private final Duration broadcastTimeout;

    private volatile BroadcastTransport transport;
    private volatile String lastSentHash;
    private ExecutorService sender;
    private volatile ExecutorService io;
    private volatile boolean initialized;

    public BroadcastExecutionCoordinator(BroadcastHealthCoordinator health, Duration broadcastTimeout) {
        this.health = health;
        this.broadcastTimeout = broadcastTimeout;
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
        sender = Executors.newSingleThreadExecutor(new NamedThreadFactory("broadcast-sender"));
        io = Executors.newCachedThreadPool(new NamedThreadFactory("broadcast-io"));
        initialized = true;
    }

    @Override
    public synchronized void cleanup() {
        if (sender != null) {
            sender.shutdownNow();
            io.shutdownNow();
            sender = null;
            io = null;
        }
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void setTransport(BroadcastTransport transport) {
        this.transport = transport;
    }

    /** Hash of the last status snapshot that reached the transport. */
    public String lastSentHash() {
        return lastSentHash;
    }

    /**
     * Queue a status snapshot for delivery.
     *
     * @return completes with true if the message reached the transport
     */
    public CompletableFuture<Boolean> submitStatus(BroadcastMessage message, String hash, boolean force) {
        return submit(() -> {
            if (!force && hash != null && hash.equals(lastSentHash)) {
                health.metrics().recordSkippedUnchanged();
                log.debug("Status unchanged ({}), broadcast skipped", hash);
                return false;
            }
            boolean delivered = deliver(message);
            if (delivered) {
                lastSentHash = hash;
            }
            return delivered;
        });
    }

    /**
     * Queue an arbitrary message for delivery through the same breaker.
     */
    public CompletableFuture<Boolean> send(BroadcastMessage message) {
        return submit(() -> deliver(message));
    }

    private CompletableFuture<Boolean> submit(Supplier<Boolean> job) {
        ExecutorService executor;
        synchronized (this) {
            executor = sender;
        }
        if (executor == null) {
            log.warn("Broadcast dropped: {} is not initialized", NAME);
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture.supplyAsync(job, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Broadcast dropped: sender is shut down");
            return CompletableFuture.completedFuture(false);
        }
    }

    // Runs on the sender thread
    private boolean deliver(BroadcastMessage message) {
        BroadcastTransport target = transport;
        if (target == null) {
            log.debug("No broadcast transport configured, dropping {}", message.type());
            return false;
        }
        ExecutorService ioPool = io;
        if (ioPool == null || !health.tryAcquire()) {
            return false;
        }

        long start = System.nanoTime();
        Future<?> call;
        try {
            call = ioPool.submit(() -> {
                target.send(message);
                return null;
            });
        } catch (RejectedExecutionException e) {
            health.recordFailure(new BroadcastException("Broadcast sender closed", e));
            return false;
        }

        try {
            call.get(broadcastTimeout.toMillis(), TimeUnit.MILLISECONDS);
            health.recordSuccess((System.nanoTime() - start) / 1_000_000);
            return true;
        } catch (TimeoutException e) {
            call.cancel(true);
            health.recordFailure(new BroadcastException(
                    "Broadcast timed out after " + broadcastTimeout.toMillis() + "ms", e));
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            health.recordFailure(cause);
            return false;
        } catch (InterruptedException e) {
            call.cancel(true);
            health.recordFailure(e);
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
