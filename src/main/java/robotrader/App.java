package robotrader;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: runs the orchestration core and its observer server
 * until the JVM is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "robotrader-shutdown"));

        try {
            deps.start();
            deps.startServer();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            System.exit(1);
        }

        log.info("robotrader-core running; observers at http://{}:{}/api/v1/status",
                config.serverHost(), deps.statusServer().boundPort());
        stopped.await();
    }
}
