package robotrader.core.coordinator.message;

import robotrader.core.coordinator.Coordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the agent messaging domain.
 */
public class MessageCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(MessageCoordinator.class);

    static final String NAME = "message_coordinator";

    private final MessageRoutingCoordinator routing;
    private final MessageHandlingCoordinator handling;
    private boolean defaultHandlersRegistered;
    private volatile boolean initialized;

    public MessageCoordinator(MessageRoutingCoordinator routing, MessageHandlingCoordinator handling) {
        this.routing = routing;
        this.handling = handling;
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
        handling.initialize();
        if (!defaultHandlersRegistered) {
            handling.registerDefaultHandlers(routing);
            defaultHandlersRegistered = true;
        }
        routing.initialize();
        initialized = true;
        log.info("Message coordinator initialized");
    }

    @Override
    public synchronized void cleanup() {
        routing.cleanup();
        handling.cleanup();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void sendMessage(AgentMessage message) {
        routing.sendMessage(message);
    }

    public AgentMessage send(MessageType type, String sender, String recipient, Map<String, Object> content) {
        AgentMessage message = AgentMessage.of(type, sender, recipient, content);
        routing.sendMessage(message);
        return message;
    }

    public Optional<AgentMessage> sendRequest(AgentMessage request) {
        return routing.sendRequest(request);
    }

    public void registerHandler(MessageType type, MessageHandler handler) {
        routing.registerHandler(type, handler);
    }

    public int pendingRequests() {
        return routing.pendingRequests();
    }
}
