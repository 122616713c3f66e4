package com.baton.core.concurrency;

import com.baton.core.config.BatonProperties;
import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.metrics.BatonMetrics;
import com.baton.core.store.InMemoryTicketStore;
import com.baton.core.store.NewIssue;
import com.baton.core.workitem.WorkItemRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OptimisticUpdaterTest {

    private InMemoryTicketStore store;
    private SimpleMeterRegistry registry;
    private OptimisticUpdater updater;
    private String id;

    @BeforeEach
    void setUp() {
        store = new InMemoryTicketStore();
        registry = new SimpleMeterRegistry();
        var properties = new BatonProperties();
        properties.getStore().setMaxWriteAttempts(3);
        updater = new OptimisticUpdater(new WorkItemRepository(store, properties), new BatonMetrics(registry), properties);
        id = store.createIssue(new NewIssue(null, "Parser", "", Set.of(), null)).id();
    }

    @Test
    @DisplayName("a write that loses one race is retried on a fresh read")
    void retriesOnStaleRevision() {
        AtomicInteger attempts = new AtomicInteger();

        String result = updater.update(id, item -> {
            if (attempts.incrementAndGet() == 1) {
                store.postComment(id, "bob", "concurrent edit");
            }
            store.updateLabels(id, item.revision(), Set.of("state:ready"), Set.of());
            return "written";
        });

        assertEquals("written", result);
        assertEquals(2, attempts.get());
        assertEquals(1.0, registry.find("baton.store.write_retries").counter().count());
        assertTrue(store.findIssue(id).orElseThrow().labels().contains("state:ready"));
    }

    @Test
    @DisplayName("gives up with CONCURRENT_UPDATE after the attempt limit")
    void givesUp() {
        var e = assertThrows(CoordinationException.class, () -> updater.update(id, item -> {
            store.postComment(id, "bob", "always first");
            return store.updateLabels(id, item.revision(), Set.of("state:ready"), Set.of());
        }));

        assertEquals(RuleViolation.CONCURRENT_UPDATE, e.getRule());
        assertEquals(3.0, registry.find("baton.store.write_retries").counter().count());
        assertFalse(store.findIssue(id).orElseThrow().labels().contains("state:ready"));
    }
}
