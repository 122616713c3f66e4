package com.baton.core.violation;

import com.baton.core.config.BatonProperties;
import com.baton.core.events.CoordinationEvent;
import com.baton.core.events.EventBus;
import com.baton.core.model.EnforcementLevel;
import com.baton.core.store.TicketStoreClient;
import com.baton.core.store.TicketStoreException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Echoes block-level violations onto the parent epic so every actor in the epic sees them.
 * <p>
 * The epic comment is an independent single-issue write; a failure is logged and the
 * work-item record stands on its own.
 */
@Component
public class EpicBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EpicBroadcaster.class);

    private final EventBus eventBus;
    private final TicketStoreClient store;
    private final BatonProperties properties;

    public EpicBroadcaster(EventBus eventBus, TicketStoreClient store, BatonProperties properties) {
        this.eventBus = eventBus;
        this.store = store;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        if (!properties.getBroadcast().isEpicOnBlock()) {
            log.info("Epic broadcast of blocking violations is disabled");
            return;
        }
        eventBus.subscribeAll(this::onEvent);
    }

    void onEvent(CoordinationEvent event) {
        if (!CoordinationEvent.VIOLATION_RECORDED.equals(event.eventType()) || event.epicId() == null) {
            return;
        }
        if (!EnforcementLevel.BLOCK.name().equals(event.payload().get("level"))) {
            return;
        }
        String body = String.format("#%s is blocked: %s by @%s reached %s occurrences. "
                        + "Dependent merges, closes and wave advances wait until it is corrected.",
                event.workItemId(), event.payload().get("kind"), event.actor(), event.payload().get("occurrences"));
        try {
            store.postComment(event.epicId(), properties.getEngineActor(), body);
            log.info("Broadcast blocking violation on {} to epic {}", event.workItemId(), event.epicId());
        } catch (TicketStoreException e) {
            log.warn("Could not broadcast blocking violation on {} to epic {}: {}",
                    event.workItemId(), event.epicId(), e.getMessage());
        }
    }
}
