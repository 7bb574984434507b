package com.colloquy.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link ConversationStore}: JDBC when a {@link DataSource} is configured,
 * in-memory otherwise.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public ConversationStore conversationStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory conversation store (transcripts will not persist across restarts)");
            return new InMemoryConversationStore();
        }
        log.info("Configuring JDBC conversation store");
        var store = new JdbcConversationStore(ds);
        store.createTables();
        return store;
    }
}
