package robotrader.core.coordinator.status;

import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;
import robotrader.core.repository.AgentRepository;
import robotrader.core.repository.StateRepository;
import robotrader.core.scheduler.QueueScheduler;
import robotrader.core.store.Database;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in status sources. Each reports only values that change with system
 * state, so an idle system keeps producing the same snapshot hash.
 */
public final class StatusSources {

    private StatusSources() {
    }

    public static StatusSource queues(StateRepository stateRepository) {
        return stateRepository::getAllStatuses;
    }

    public static StatusSource scheduler(QueueScheduler scheduler) {
        return scheduler::workerStatuses;
    }

    public static StatusSource database(Database database) {
        return () -> {
            if (!database.isHealthy()) {
                throw new IllegalStateException("Database connection is not valid");
            }
            Map<String, Object> stats = database.poolStats();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("pool_name", stats.get("pool_name"));
            data.put("max_pool_size", stats.get("max_pool_size"));
            return data;
        };
    }

    public static StatusSource events(EventBus eventBus) {
        return () -> {
            Map<String, Integer> perType = new LinkedHashMap<>();
            for (EventType type : EventType.values()) {
                int count = eventBus.subscriberCount(type);
                if (count > 0) {
                    perType.put(type.wireName(), count);
                }
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("subscriptions", eventBus.totalSubscriptions());
            data.put("subscriptions_by_type", perType);
            data.put("handler_failures", eventBus.handlerFailureCount());
            data.put("dead_letters", eventBus.journal().countDeadLetters());
            return data;
        };
    }

    public static StatusSource agents(AgentRepository agentRepository) {
        return () -> {
            List<AgentProfile> agents = agentRepository.findAll();
            Map<AgentRole, Integer> activeByRole = new EnumMap<>(AgentRole.class);
            int active = 0;
            for (AgentProfile agent : agents) {
                if (agent.active()) {
                    active++;
                    activeByRole.merge(agent.role(), 1, Integer::sum);
                }
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("registered", agents.size());
            data.put("active", active);
            data.put("active_by_role", activeByRole);
            return data;
        };
    }
}
