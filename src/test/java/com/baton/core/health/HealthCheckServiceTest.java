package com.baton.core.health;

import com.baton.core.config.BatonProperties;
import com.baton.core.events.EventBus;
import com.baton.core.store.InMemoryTicketStore;
import com.baton.core.store.IssueQuery;
import com.baton.core.store.NewIssue;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.store.TicketStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reachable store and broadcast enabled -> all UP")
    void allUp() {
        var store = new InMemoryTicketStore();
        store.createIssue(new NewIssue(null, "Epic", "", Set.of("epic"), null));
        var service = new HealthCheckService(store, new EventBus(), new BatonProperties());

        List<HealthStatus> results = service.checkAll();

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(s -> s.status() == HealthStatus.Status.UP));
        assertEquals("1", component(results, "ticket-store").metadata().get("issues"));
    }

    @Test
    @DisplayName("store errors -> ticket-store DOWN")
    void storeDown() {
        var store = mock(TicketStoreClient.class);
        when(store.listIssues(any(IssueQuery.class))).thenThrow(new TicketStoreException("connection refused"));
        var service = new HealthCheckService(store, new EventBus(), new BatonProperties());

        HealthStatus status = component(service.checkAll(), "ticket-store");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("epic broadcast disabled -> DEGRADED")
    void broadcastDisabled() {
        var properties = new BatonProperties();
        properties.getBroadcast().setEpicOnBlock(false);
        var service = new HealthCheckService(new InMemoryTicketStore(), new EventBus(), properties);

        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "epic-broadcast").status());
    }
}
