package com.forgeloop.core.transition;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link TransitionStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcTransitionStore} is created and its
 * tables are ensured. Otherwise an {@link InMemoryTransitionStore} is used, which loses its
 * history on restart.
 */
@Configuration
public class TransitionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TransitionStoreConfig.class);

    @Bean
    public TransitionStore transitionStore(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper)
            throws Exception {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.info("No DataSource available; using in-memory transition store (history will not persist across restarts)");
            return new InMemoryTransitionStore();
        }
        log.info("Configuring JDBC transition store");
        var store = new JdbcTransitionStore(available, objectMapper);
        store.createTables();
        return store;
    }
}
