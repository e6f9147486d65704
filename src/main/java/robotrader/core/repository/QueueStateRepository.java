package robotrader.core.repository;

import robotrader.core.model.QueueState;
import robotrader.core.model.QueueStatistics;

import java.util.Map;

/**
 * Read-only aggregation of task rows into queue states.
 */
public interface QueueStateRepository {

    /**
     * State of one queue. An unknown or empty queue yields an IDLE state.
     */
    QueueState getStatus(String queueName);

    /**
     * States of every configured queue plus any queue that has rows,
     * computed with at most two queries.
     */
    Map<String, QueueState> getAllStatuses();

    /**
     * Totals across all queues.
     */
    QueueStatistics getStatistics();
}
