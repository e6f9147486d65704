package robotrader.core.broadcast;

/**
 * Push channel to observers (WebSocket clients, a test recorder, ...).
 * <p>
 * Called from a single sender thread. Implementations signal failure by
 * throwing; the caller bounds each call with the broadcast timeout.
 */
@FunctionalInterface
public interface BroadcastTransport {

    void send(BroadcastMessage message) throws Exception;
}
