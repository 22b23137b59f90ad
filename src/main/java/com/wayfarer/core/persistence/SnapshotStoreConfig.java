package com.wayfarer.core.persistence;

import com.wayfarer.core.config.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Provides the {@link SnapshotStore} bean.
 * <p>
 * {@code wayfarer.snapshots.store=memory} selects an in-memory store that forgets runs on
 * restart. Otherwise snapshots are written as JSON files under
 * {@code wayfarer.snapshots.directory}.
 */
@Configuration
public class SnapshotStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "wayfarer.snapshots", name = "store", havingValue = "memory")
    public SnapshotStore inMemorySnapshotStore() {
        log.info("Using in-memory snapshot store (runs will not survive a restart)");
        return new InMemorySnapshotStore();
    }

    @Bean
    @ConditionalOnMissingBean(SnapshotStore.class)
    public SnapshotStore fileSnapshotStore(WorkflowProperties properties) {
        Path directory = Path.of(properties.getSnapshotDirectory());
        log.info("Using file snapshot store at {}", directory);
        return new FileSnapshotStore(directory);
    }
}
