package com.triagebot.core.memory;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.error.TriageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Set;

/**
 * Spring {@link Configuration} selecting the {@link IssueMemoryStore} from
 * {@code triage.memory.store}.
 * <p>
 * {@code jdbc} persists to the configured {@link DataSource}; {@code in-memory} keeps
 * records for the life of the process; {@code none} registers no store, which runs the
 * pipeline without duplicate detection or storage. Either store is wrapped in a
 * {@link TimeLimitedMemoryStore} using {@code triage.memory.timeout}. Any other value
 * fails the context at startup.
 */
@Configuration
public class MemoryStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryStoreConfig.class);

    static final Set<String> STORE_TYPES = Set.of("jdbc", "in-memory", "none");

    public MemoryStoreConfig(TriageProperties properties) {
        String store = properties.getMemory().getStore();
        if (!STORE_TYPES.contains(store)) {
            throw new TriageConfigurationException(
                    "triage.memory.store must be one of jdbc, in-memory or none, got '" + store + "'");
        }
        if ("none".equals(store)) {
            log.info("Issue memory disabled; duplicate detection and storage are skipped");
        }
    }

    @Bean
    @ConditionalOnProperty(prefix = "triage.memory", name = "store", havingValue = "jdbc")
    public IssueMemoryStore jdbcIssueMemoryStore(DataSource dataSource, TriageProperties properties) throws Exception {
        log.info("Configuring JDBC issue memory for repository '{}'", properties.getRepository());
        var store = new JdbcIssueMemoryStore(dataSource, properties.getRepository(),
                properties.getEmbedding().getDimension());
        store.createTables();
        return new TimeLimitedMemoryStore(store, properties.getMemory().getTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "triage.memory", name = "store", havingValue = "in-memory", matchIfMissing = true)
    public IssueMemoryStore inMemoryIssueMemoryStore(TriageProperties properties) {
        log.info("Using in-memory issue memory (records will not persist across restarts)");
        return new TimeLimitedMemoryStore(
                new InMemoryIssueMemoryStore(properties.getEmbedding().getDimension()),
                properties.getMemory().getTimeout());
    }
}
