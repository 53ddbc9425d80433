package io.lift.indexer.supervisor;

import io.lift.indexer.config.IndexerProperties;
import io.lift.indexer.source.SchemaKind;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.source.SourceKey;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the configured sources on boot when {@code lift.indexer.auto-start} is set.
 */
@Component
public class IndexerAutoStartRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexerAutoStartRunner.class);

    private final IndexerProperties properties;
    private final IndexerSupervisor supervisor;

    public IndexerAutoStartRunner(IndexerProperties properties, IndexerSupervisor supervisor) {
        this.properties = properties;
        this.supervisor = supervisor;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isAutoStart()) {
            log.info("Indexer auto-start disabled");
            return;
        }
        List<SourceConfig> configs = sourceConfigs(properties);
        StartResult result = supervisor.start(configs);
        log.info("Indexer auto-start: outcome={}, pollers={}", result.outcome(), result.activePollerCount());
    }

    static List<SourceConfig> sourceConfigs(IndexerProperties properties) {
        return properties.getSources().stream()
            .map(IndexerAutoStartRunner::toSourceConfig)
            .toList();
    }

    private static SourceConfig toSourceConfig(IndexerProperties.Source source) {
        SchemaKind schemaKind;
        try {
            schemaKind = SchemaKind.parse(source.getSchemaKind());
        } catch (IllegalArgumentException e) {
            throw new IndexerConfigurationException(e.getMessage());
        }
        return new SourceConfig(
            new SourceKey(source.getNetworkId(), source.getContractAddress(), schemaKind),
            source.getStartHeight() == null ? SourceConfig.DEFAULT_START_HEIGHT : source.getStartHeight(),
            source.getConfirmations() == null ? SourceConfig.DEFAULT_CONFIRMATIONS : source.getConfirmations(),
            source.getBatchSize() == null ? SourceConfig.DEFAULT_BATCH_SIZE : source.getBatchSize()
        );
    }
}
