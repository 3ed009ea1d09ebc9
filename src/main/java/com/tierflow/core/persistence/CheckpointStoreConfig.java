package com.tierflow.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tierflow.config.TierflowProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the {@link CheckpointStore} bean.
 * <p>
 * When {@code tierflow.checkpoint.jdbc.url} is set, a pooled {@link JdbcCheckpointStore}
 * is created against that database. Otherwise an {@link InMemoryCheckpointStore} is used
 * as a fallback, which does not survive restarts.
 */
@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Bean
    public TaskStateCodec taskStateCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new TaskStateCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tierflow.checkpoint.jdbc", name = "url")
    public HikariDataSource checkpointDataSource(TierflowProperties properties) {
        var jdbc = properties.getCheckpoint().getJdbc();
        var config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaxPoolSize());
        config.setPoolName("tierflow-checkpoints");
        return new HikariDataSource(config);
    }

    /**
     * JDBC-backed store, activated when a checkpoint database is configured.
     * Creates the required table on startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "tierflow.checkpoint.jdbc", name = "url")
    public CheckpointStore jdbcCheckpointStore(DataSource checkpointDataSource, TaskStateCodec codec,
                                               TierflowProperties properties) throws Exception {
        log.info("Configuring JDBC checkpoint store");
        var store = new JdbcCheckpointStore(checkpointDataSource, codec,
                properties.getCheckpoint().getRetention(), Clock.systemUTC());
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore memoryCheckpointStore(TaskStateCodec codec, TierflowProperties properties) {
        log.info("No checkpoint database configured; using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore(codec, properties.getCheckpoint().getRetention(), Clock.systemUTC());
    }
}
