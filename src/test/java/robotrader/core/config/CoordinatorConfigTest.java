package robotrader.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(CoordinatorConfig.DEFAULT_QUEUES, config.queueNames());
        assertEquals(6, config.queueNames().size());
        assertEquals(Duration.ofSeconds(900), config.taskTimeout());
        assertEquals(3, config.defaultMaxRetries());
        assertEquals(Duration.ofMinutes(16), config.taskStuckThreshold());
        assertEquals(5, config.broadcastFailureThreshold());
        assertEquals(3, config.broadcastSuccessThreshold());
        assertEquals(Duration.ofSeconds(60), config.broadcastRecoveryTimeout());
        assertEquals(Duration.ofHours(24), config.statisticsWindow());
        assertTrue(config.eventJournalEnabled());
    }

    @Test
    void queueNamesAreTrimmedAndDeduplicated() {
        assertEquals(List.of("data_fetcher", "ai_analysis"),
                CoordinatorConfig.parseQueueNames(" data_fetcher, ai_analysis ,,data_fetcher"));
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.parseQueueNames(" , "));
    }

    @Test
    void withersUpdateInPlace() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withQueueNames(List.of("portfolio_sync"))
                .withBroadcastThresholds(2, 1)
                .withServerPort(0);

        assertEquals(List.of("portfolio_sync"), config.queueNames());
        assertEquals(2, config.broadcastFailureThreshold());
        assertEquals(1, config.broadcastSuccessThreshold());
        assertEquals(0, config.serverPort());
        assertThrows(IllegalArgumentException.class, () -> config.withQueueNames(List.of()));
    }

    @Test
    void toStringNamesQueues() {
        assertTrue(CoordinatorConfig.defaults().toString().contains("data_fetcher"));
    }
}
