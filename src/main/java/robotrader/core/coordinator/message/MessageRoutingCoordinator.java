package robotrader.core.coordinator.message;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queues agent messages and dispatches them on a single router thread.
 * <p>
 * A message whose correlation id matches a pending request completes that
 * request and is not dispatched further. Other messages go to every handler
 * registered for their type, in registration order; a failing handler does not
 * affect the others.
 */
public class MessageRoutingCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(MessageRoutingCoordinator.class);

    static final String NAME = "message_routing_coordinator";
    private static final long POLL_MS = 1000;

    private final EventBus eventBus;
    private final Duration responseTimeout;
    private final BlockingQueue<AgentMessage> queue = new LinkedBlockingQueue<>();
    private final Map<MessageType, List<MessageHandler>> handlers = new EnumMap<>(MessageType.class);
    private final Map<String, CompletableFuture<AgentMessage>> pending = new ConcurrentHashMap<>();
    private final AtomicLong routed = new AtomicLong();

    private volatile Thread router;
    private volatile boolean running;

    public MessageRoutingCoordinator(EventBus eventBus, Duration responseTimeout) {
        this.eventBus = eventBus;
        this.responseTimeout = responseTimeout;
        for (MessageType type : MessageType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void initialize() {
        if (running) {
            return;
        }
        running = true;
        Thread thread = new Thread(this::processLoop, "message-router");
        thread.setDaemon(true);
        router = thread;
        thread.start();
        log.info("Message routing started");
    }

    @Override
    public synchronized void cleanup() {
        if (!running) {
            return;
        }
        running = false;
        Thread thread = router;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        router = null;

        pending.values().forEach(future -> future.cancel(false));
        pending.clear();
        int dropped = queue.size();
        queue.clear();
        log.info("Message routing stopped ({} undelivered messages dropped)", dropped);
    }

    @Override
    public boolean isInitialized() {
        return running;
    }

    public void registerHandler(MessageType type, MessageHandler handler) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("type and handler are required");
        }
        handlers.get(type).add(handler);
        log.debug("Registered handler for {}", type.wireName());
    }

    /**
     * Queue a message for delivery.
     *
     * @throws IllegalStateException if routing is not running
     */
    public void sendMessage(AgentMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        if (!running) {
            throw new IllegalStateException("Message routing is not running");
        }
        queue.add(message);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message_id", message.messageId());
        data.put("message_type", message.messageType().wireName());
        data.put("sender", message.sender());
        data.put("recipient", message.recipient());
        data.put("correlation_id", message.correlationId());
        eventBus.publish(Event.of(EventType.AGENT_MESSAGE_SENT, NAME, data));
    }

    public Optional<AgentMessage> sendRequest(AgentMessage request) {
        return sendRequest(request, responseTimeout);
    }

    /**
     * Send a request and block until a message correlated to it arrives.
     * Must not be called from a message handler or an event handler.
     *
     * @return the response, or empty if none arrived within the timeout
     * @throws IllegalStateException if called on the router thread
     */
    public Optional<AgentMessage> sendRequest(AgentMessage request, Duration timeout) {
        if (Thread.currentThread() == router) {
            throw new IllegalStateException("sendRequest cannot be called from a message handler");
        }
        CompletableFuture<AgentMessage> response = new CompletableFuture<>();
        pending.put(request.messageId(), response);
        try {
            sendMessage(request);
            return Optional.of(response.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("Request {} ({}) timed out after {}ms",
                    request.messageId(), request.messageType().wireName(), timeout.toMillis());
            return Optional.empty();
        } catch (CancellationException e) {
            log.debug("Request {} cancelled", request.messageId());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Request {} failed: {}", request.messageId(), e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            pending.remove(request.messageId());
        }
    }

    public int pendingRequests() {
        return pending.size();
    }

    public int queuedMessages() {
        return queue.size();
    }

    public long routedMessages() {
        return routed.get();
    }

    private void processLoop() {
        while (running) {
            try {
                AgentMessage message = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    route(message);
                }
            } catch (InterruptedException e) {
                if (running) {
                    log.warn("Message router interrupted while running");
                }
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Error processing message", e);
            }
        }
    }

    void route(AgentMessage message) {
        routed.incrementAndGet();
        log.debug("Routing {} from {}", message.messageType().wireName(), message.sender());

        String correlationId = message.correlationId();
        if (correlationId != null) {
            CompletableFuture<AgentMessage> waiting = pending.get(correlationId);
            if (waiting != null) {
                waiting.complete(message);
                return;
            }
        }

        List<MessageHandler> registered = handlers.get(message.messageType());
        if (registered.isEmpty()) {
            log.warn("No handlers registered for message type {}", message.messageType().wireName());
            return;
        }
        for (MessageHandler handler : registered) {
            try {
                handler.handle(message);
            } catch (Exception e) {
                log.error("Handler error for {} message {}", message.messageType().wireName(),
                        message.messageId(), e);
            }
        }
    }
}
