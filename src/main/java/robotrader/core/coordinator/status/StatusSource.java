package robotrader.core.coordinator.status;

/**
 * One component of the system status. Runs on the aggregation pool under a
 * timeout; throwing marks the component degraded.
 */
@FunctionalInterface
public interface StatusSource {

    /** @return JSON-serializable component data */
    Object collect() throws Exception;
}
