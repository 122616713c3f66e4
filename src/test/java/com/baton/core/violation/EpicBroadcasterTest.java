package com.baton.core.violation;

import com.baton.core.config.BatonProperties;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.store.TicketStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EpicBroadcasterTest {

    private EventBus eventBus;
    private TicketStoreClient store;
    private BatonProperties properties;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        store = mock(TicketStoreClient.class);
        properties = new BatonProperties();
    }

    private CoordinationEvent violation(String level, String epicId) {
        return new CoordinationEvent(CoordinationEvent.VIOLATION_RECORDED, "7", epicId, "alice",
                Map.of("kind", "SELF_APPROVAL", "level", level, "occurrences", 3, "detail", ""), Instant.now());
    }

    @Test
    @DisplayName("block-level violations are echoed on the epic")
    void broadcastsBlock() {
        new EpicBroadcaster(eventBus, store, properties).register();

        eventBus.publish(violation("BLOCK", "1"));

        verify(store).postComment(eq("1"), eq("baton"), contains("#7 is blocked: SELF_APPROVAL by @alice"));
    }

    @Test
    @DisplayName("reminders, warnings and items outside an epic are not broadcast")
    void ignoresLowerLevels() {
        new EpicBroadcaster(eventBus, store, properties).register();

        eventBus.publish(violation("WARNING", "1"));
        eventBus.publish(violation("BLOCK", null));
        eventBus.publish(new CoordinationEvent(CoordinationEvent.PHASE_TRANSITIONED, "7", "1", "alice",
                Map.of("level", "BLOCK"), Instant.now()));

        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("disabled broadcast does not subscribe")
    void disabled() {
        properties.getBroadcast().setEpicOnBlock(false);
        new EpicBroadcaster(eventBus, store, properties).register();

        assertEquals(0, eventBus.subscriberCount());
    }

    @Test
    @DisplayName("a failing epic write is logged and does not propagate")
    void storeFailure() {
        when(store.postComment(anyString(), anyString(), anyString())).thenThrow(new TicketStoreException("down"));
        var broadcaster = new EpicBroadcaster(eventBus, store, properties);

        assertDoesNotThrow(() -> broadcaster.onEvent(violation("BLOCK", "1")));
    }
}
