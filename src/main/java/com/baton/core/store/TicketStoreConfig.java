package com.baton.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link TicketStoreClient} bean.
 * <p>
 * A tracker-specific adapter registered elsewhere takes precedence; otherwise the
 * in-memory store is used, which is suitable for development and testing but not
 * durable across restarts.
 */
@Configuration
public class TicketStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TicketStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(TicketStoreClient.class)
    public TicketStoreClient inMemoryTicketStore() {
        log.info("No ticket store adapter configured; using in-memory ticket store (state will not persist across restarts)");
        return new InMemoryTicketStore();
    }
}
