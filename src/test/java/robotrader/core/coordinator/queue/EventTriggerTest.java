package robotrader.core.coordinator.queue;

import robotrader.core.events.Event;
import robotrader.core.events.EventType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTriggerTest {

    private static Event completed(String queue, String taskType, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>(extra);
        data.put("queue_name", queue);
        data.put("task_type", taskType);
        return Event.of(EventType.TASK_COMPLETED, "test", data);
    }

    @Test
    void matchesTypeAndSourceQueue() {
        EventTrigger trigger = EventTrigger.on("fetch-then-analyze", EventType.TASK_COMPLETED,
                "data_fetcher", "ai_analysis", "score_news");

        assertTrue(trigger.matches(completed("data_fetcher", "fetch_prices", Map.of())));
        assertFalse(trigger.matches(completed("portfolio_sync", "fetch_prices", Map.of())));
        assertFalse(trigger.matches(Event.of(EventType.TASK_FAILED, "test", Map.of("queue_name", "data_fetcher"))));
    }

    @Test
    void conditionsSupportListsComparisonsAndWildcards() {
        EventTrigger trigger = EventTrigger.on("big-moves", EventType.TASK_COMPLETED, null, "ai_analysis", "score")
                .withCondition(Map.of(
                        "symbol", List.of("AAPL", "MSFT"),
                        "change_pct", ">5",
                        "volume", "all",
                        "market", "NASDAQ"));

        Map<String, Object> hit = Map.of("symbol", "AAPL", "change_pct", 7.5, "volume", 10, "market", "NASDAQ");
        assertTrue(trigger.matches(completed("data_fetcher", "fetch", hit)));

        assertFalse(trigger.matches(completed("data_fetcher", "fetch",
                Map.of("symbol", "TSLA", "change_pct", 7.5, "volume", 10, "market", "NASDAQ"))));
        assertFalse(trigger.matches(completed("data_fetcher", "fetch",
                Map.of("symbol", "AAPL", "change_pct", 2, "volume", 10, "market", "NASDAQ"))));
        assertFalse(trigger.matches(completed("data_fetcher", "fetch",
                Map.of("symbol", "AAPL", "change_pct", "high", "volume", 10, "market", "NASDAQ"))));
        assertFalse(trigger.matches(completed("data_fetcher", "fetch",
                Map.of("symbol", "AAPL", "change_pct", 7.5, "market", "NASDAQ"))), "missing key");
        assertFalse(trigger.matches(completed("data_fetcher", "fetch",
                Map.of("symbol", "AAPL", "change_pct", 7.5, "volume", 10, "market", "NYSE"))));
    }

    @Test
    void ignoresTasksItWouldCreateItself() {
        EventTrigger trigger = EventTrigger.on("any-completion", EventType.TASK_COMPLETED, null,
                "ai_analysis", "score_news");

        assertFalse(trigger.matches(completed("ai_analysis", "score_news", Map.of())));
        assertTrue(trigger.matches(completed("ai_analysis", "other_type", Map.of())));
    }

    @Test
    void selfFeedingIsDetected() {
        assertTrue(EventTrigger.on("loop", EventType.TASK_COMPLETED, "ai_analysis", "ai_analysis", "x")
                .isSelfFeeding());
        assertFalse(EventTrigger.on("any", EventType.TASK_COMPLETED, null, "ai_analysis", "x").isSelfFeeding());
    }
}
