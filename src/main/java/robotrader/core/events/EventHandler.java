package robotrader.core.events;

/**
 * Callback invoked for each delivered event.
 * Exceptions are caught and logged by the bus.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;
}
