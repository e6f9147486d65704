package robotrader.core.coordinator.message;

@FunctionalInterface
public interface MessageHandler {
    void handle(AgentMessage message) throws Exception;
}
