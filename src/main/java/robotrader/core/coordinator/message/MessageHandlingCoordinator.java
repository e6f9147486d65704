package robotrader.core.coordinator.message;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default handlers: every delivered agent message becomes an
 * AGENT_MESSAGE_RECEIVED event; error reports also raise SYSTEM_ERROR.
 */
public class MessageHandlingCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(MessageHandlingCoordinator.class);

    static final String NAME = "message_handling_coordinator";

    private final EventBus eventBus;
    private volatile boolean initialized;

    public MessageHandlingCoordinator(EventBus eventBus) {
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
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void registerDefaultHandlers(MessageRoutingCoordinator routing) {
        routing.registerHandler(MessageType.ANALYSIS_RESPONSE, this::onMessage);
        routing.registerHandler(MessageType.DECISION_PROPOSAL, this::onMessage);
        routing.registerHandler(MessageType.VOTE, this::onMessage);
        routing.registerHandler(MessageType.STATUS_UPDATE, this::onMessage);
        routing.registerHandler(MessageType.ERROR_REPORT, this::onErrorReport);
    }

    void onMessage(AgentMessage message) {
        log.debug("{} from {}", message.messageType().wireName(), message.sender());
        eventBus.publish(Event.of(EventType.AGENT_MESSAGE_RECEIVED, NAME, received(message)));
    }

    void onErrorReport(AgentMessage message) {
        log.error("Agent error from {}: {}", message.sender(), message.content());
        eventBus.publish(Event.of(EventType.AGENT_MESSAGE_RECEIVED, NAME, received(message)));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", message.sender());
        data.put("message_id", message.messageId());
        data.put("error", message.content());
        eventBus.publish(Event.of(EventType.SYSTEM_ERROR, NAME, data));
    }

    private static Map<String, Object> received(AgentMessage message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message_id", message.messageId());
        data.put("message_type", message.messageType().wireName());
        data.put("agent_id", message.sender());
        data.put("recipient", message.recipient());
        data.put("correlation_id", message.correlationId());
        data.put("content", message.content());
        return data;
    }
}
