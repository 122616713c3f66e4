package com.baton.core.health;

import com.baton.core.config.BatonProperties;
import com.baton.core.events.EventBus;
import com.baton.core.store.IssueQuery;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.store.TicketStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TicketStoreClient store;
    private final EventBus eventBus;
    private final BatonProperties properties;

    public HealthCheckService(TicketStoreClient store, EventBus eventBus, BatonProperties properties) {
        this.store = store;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTicketStore());
        results.add(checkEpicBroadcast());
        return results;
    }

    private HealthStatus checkTicketStore() {
        try {
            int issues = store.listIssues(IssueQuery.all()).size();
            return new HealthStatus("ticket-store", HealthStatus.Status.UP,
                    "Ticket store reachable (" + store.getClass().getSimpleName() + ")",
                    Map.of("issues", String.valueOf(issues)));
        } catch (TicketStoreException e) {
            log.warn("Ticket store health check failed: {}", e.getMessage());
            return new HealthStatus("ticket-store", HealthStatus.Status.DOWN,
                    "Ticket store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkEpicBroadcast() {
        if (!properties.getBroadcast().isEpicOnBlock()) {
            return new HealthStatus("epic-broadcast", HealthStatus.Status.DEGRADED,
                    "Blocking violations are not broadcast to epics", Map.of());
        }
        return new HealthStatus("epic-broadcast", HealthStatus.Status.UP,
                "Broadcasting blocking violations to epics",
                Map.of("subscribers", String.valueOf(eventBus.subscriberCount())));
    }
}
