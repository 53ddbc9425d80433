package io.lift.indexer.supervisor;

import io.lift.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RetrySweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetrySweepScheduler.class);

    private final IndexerProperties properties;
    private final IndexerSupervisor supervisor;

    public RetrySweepScheduler(IndexerProperties properties, IndexerSupervisor supervisor) {
        this.properties = properties;
        this.supervisor = supervisor;
    }

    @Scheduled(
        fixedDelayString = "${lift.indexer.retry-sweep.interval-ms:60000}",
        initialDelayString = "${lift.indexer.retry-sweep.interval-ms:60000}"
    )
    public void sweep() {
        if (!properties.getRetrySweep().isEnabled()) {
            return;
        }
        try {
            RetrySweepResult result = supervisor.retryFailedEvents(properties.getRetrySweep().getBatchSize());
            if (result.processed() + result.failed() + result.skipped() > 0) {
                log.info(
                    "Scheduled retry sweep: processed={}, failed={}, skipped={}",
                    result.processed(),
                    result.failed(),
                    result.skipped()
                );
            }
        } catch (RuntimeException e) {
            log.error("Scheduled retry sweep failed", e);
        }
    }
}
