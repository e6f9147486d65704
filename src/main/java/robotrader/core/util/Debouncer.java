package robotrader.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces bursts of submissions: only the last task submitted within the
 * delay runs, on the debouncer's own thread.
 */
public final class Debouncer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService ses;
    private final long delayMs;
    private ScheduledFuture<?> future;

    public Debouncer(String name, long delayMs) {
        this.ses = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(name));
        this.delayMs = delayMs;
    }

    public synchronized void submit(Runnable task) {
        if (ses.isShutdown()) {
            return;
        }
        if (future != null) {
            future.cancel(false);
        }
        future = ses.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Debounced task failed", e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        ses.shutdownNow();
    }
}
