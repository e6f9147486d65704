package robotrader.core.coordinator.queue;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.scheduler.QueueScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Starts and stops queue workers and announces it on the bus.
 */
public class QueueLifecycleCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(QueueLifecycleCoordinator.class);

    static final String NAME = "queue_lifecycle_coordinator";

    private final QueueScheduler scheduler;
    private final EventBus eventBus;
    private volatile boolean initialized;

    public QueueLifecycleCoordinator(QueueScheduler scheduler, EventBus eventBus) {
        this.scheduler = scheduler;
        this.eventBus = eventBus;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize() {
        initialized = true;
    }

    @Override
    public void cleanup() {
        if (areQueuesRunning()) {
            stopQueues();
        }
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void startQueues() {
        int started = 0;
        for (String queueName : scheduler.queueNames()) {
            if (startQueue(queueName)) {
                started++;
            }
        }
        log.info("Started {} queues", started);
    }

    public void stopQueues() {
        List<String> running = runningQueues();
        scheduler.stopAll();
        for (String queueName : running) {
            publish(EventType.QUEUE_STOPPED, queueName);
        }
        log.info("Stopped {} queues", running.size());
    }

    /**
     * @return true if the queue was started by this call
     * @throws IllegalArgumentException if the queue is unknown
     */
    public boolean startQueue(String queueName) {
        boolean started = scheduler.start(queueName);
        if (started) {
            publish(EventType.QUEUE_STARTED, queueName);
        }
        return started;
    }

    /**
     * @return true if the queue was running and has been stopped
     * @throws IllegalArgumentException if the queue is unknown
     */
    public boolean stopQueue(String queueName) {
        boolean stopped = scheduler.stop(queueName);
        if (stopped) {
            publish(EventType.QUEUE_STOPPED, queueName);
        }
        return stopped;
    }

    public boolean areQueuesRunning() {
        return !runningQueues().isEmpty();
    }

    public List<String> runningQueues() {
        List<String> running = new ArrayList<>();
        for (String queueName : scheduler.queueNames()) {
            if (scheduler.isRunning(queueName)) {
                running.add(queueName);
            }
        }
        return running;
    }

    private void publish(EventType type, String queueName) {
        eventBus.publish(Event.of(type, NAME, Map.of("queue_name", queueName)));
    }
}
