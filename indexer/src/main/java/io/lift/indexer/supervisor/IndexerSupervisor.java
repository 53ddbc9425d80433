package io.lift.indexer.supervisor;

import io.lift.indexer.chain.ChainReader;
import io.lift.indexer.config.IndexerProperties;
import io.lift.indexer.decoder.EventDecoderRegistry;
import io.lift.indexer.handler.DispatchOutcome;
import io.lift.indexer.handler.EventDispatcher;
import io.lift.indexer.poller.Poller;
import io.lift.indexer.poller.PollerRegistry;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.source.SourceKey;
import io.lift.indexer.store.CursorRecord;
import io.lift.indexer.store.CursorStore;
import io.lift.indexer.store.EventFilter;
import io.lift.indexer.store.EventPage;
import io.lift.indexer.store.EventProcessingStatus;
import io.lift.indexer.store.EventStore;
import io.lift.indexer.store.IndexedEvent;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator entry point: owns the running pollers and exposes status, health, event inspection and the retry sweep.
 */
@Service
public class IndexerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(IndexerSupervisor.class);

    private final PollerRegistry pollers;
    private final ChainReader chainReader;
    private final EventDecoderRegistry decoders;
    private final EventStore eventStore;
    private final CursorStore cursorStore;
    private final EventDispatcher dispatcher;
    private final IndexerProperties properties;
    private final Clock clock;

    private volatile boolean running;

    public IndexerSupervisor(
        PollerRegistry pollers,
        ChainReader chainReader,
        EventDecoderRegistry decoders,
        EventStore eventStore,
        CursorStore cursorStore,
        EventDispatcher dispatcher,
        IndexerProperties properties,
        Clock clock
    ) {
        this.pollers = pollers;
        this.chainReader = chainReader;
        this.decoders = decoders;
        this.eventStore = eventStore;
        this.cursorStore = cursorStore;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized StartResult start(List<SourceConfig> configs) {
        if (running) {
            log.warn("Indexer already running with {} poller(s); start ignored", pollers.size());
            return new StartResult(StartResult.Outcome.ALREADY_RUNNING, pollers.size());
        }
        validate(configs);

        Instant now = clock.instant();
        try {
            for (SourceConfig config : configs) {
                activateSource(config, now);
            }
        } catch (RuntimeException e) {
            int cancelled = pollers.cancelAll();
            log.error("Indexer start failed; cancelled {} poller(s) already started", cancelled, e);
            throw e;
        }
        running = true;
        log.info("Indexer started with {} poller(s)", pollers.size());
        return new StartResult(StartResult.Outcome.ACCEPTED, pollers.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running && pollers.size() == 0) {
            return;
        }
        int cancelled = pollers.cancelAll();
        running = false;
        log.info("Indexer stopped; cancelled {} poller(s)", cancelled);
    }

    /**
     * Re-activates one source while the indexer is running, e.g. after {@link #deactivate(SourceKey)}. The cursor
     * keeps its height.
     *
     * @return false when the indexer is not running or the source is already polling
     */
    public synchronized boolean activate(SourceConfig config) {
        validate(config == null ? null : List.of(config));
        if (!running) {
            log.warn("Indexer is not running; activate ignored for {}", config.key());
            return false;
        }
        if (pollers.find(config.key()).isPresent()) {
            return false;
        }
        activateSource(config, clock.instant());
        return true;
    }

    /**
     * Stops polling one source and marks its cursor inactive. The cursor keeps its height for a later
     * {@link #activate(SourceConfig)} or start.
     *
     * @return false when no cursor exists for the key
     */
    public synchronized boolean deactivate(SourceKey key) {
        if (cursorStore.find(key).isEmpty()) {
            return false;
        }
        pollers.cancel(key);
        cursorStore.setActive(key, false, clock.instant());
        log.info("Deactivated source {}", key);
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public IndexerStatus status() {
        return new IndexerStatus(running, pollers.size(), cursorStore.findAll());
    }

    public IndexerHealth health() {
        Instant now = clock.instant();
        Duration staleThreshold = Duration.ofMillis(properties.getStaleThresholdMs());
        List<String> issues = new ArrayList<>();
        if (!running) {
            issues.add("indexer is not running");
        }

        List<SourceHealth> sources = new ArrayList<>();
        for (CursorRecord cursor : cursorStore.findAll()) {
            boolean erroring = cursor.errorCount() > 0;
            boolean stale = cursor.lastSyncAt() == null
                || Duration.between(cursor.lastSyncAt(), now).compareTo(staleThreshold) > 0;
            if (cursor.active()) {
                if (erroring) {
                    issues.add(cursor.key() + " has " + cursor.errorCount() + " consecutive error(s): " + cursor.lastError());
                }
                if (cursor.lastSyncAt() == null) {
                    issues.add(cursor.key() + " has never synced");
                } else if (stale) {
                    issues.add(cursor.key() + " last synced at " + cursor.lastSyncAt());
                }
            }
            sources.add(new SourceHealth(
                cursor.key(),
                cursor.active(),
                cursor.lastProcessedHeight(),
                cursor.lastSyncAt(),
                cursor.errorCount(),
                cursor.lastError(),
                erroring,
                stale
            ));
        }

        long failed = eventStore.countByStatus(EventProcessingStatus.FAILED);
        long needsIntervention = eventStore.countByStatus(EventProcessingStatus.NEEDS_MANUAL_INTERVENTION);
        if (needsIntervention > 0) {
            issues.add(needsIntervention + " event(s) reached the retry cap and need manual intervention");
        }

        return new IndexerHealth(
            issues.isEmpty(),
            running,
            pollers.size(),
            sources,
            failed,
            needsIntervention,
            issues,
            now
        );
    }

    /**
     * Re-applies business logic to failed events below their retry cap, oldest first, using the stored payload.
     */
    public RetrySweepResult retryFailedEvents(int limit) {
        if (limit <= 0) {
            throw new IndexerConfigurationException("limit must be > 0: " + limit);
        }
        List<IndexedEvent> candidates = eventStore.findRetryable(limit);
        if (candidates.isEmpty()) {
            return RetrySweepResult.empty();
        }

        int processed = 0;
        int failed = 0;
        int skipped = 0;
        for (IndexedEvent event : candidates) {
            DispatchOutcome outcome;
            try {
                outcome = dispatcher.dispatch(event);
            } catch (RuntimeException e) {
                log.error("Retry dispatch failed for event {}", event.id(), e);
                outcome = DispatchOutcome.CONFLICT;
            }
            switch (outcome) {
                case PROCESSED -> processed++;
                case FAILED -> failed++;
                default -> skipped++;
            }
        }
        log.info(
            "Retry sweep finished: candidates={}, processed={}, failed={}, skipped={}",
            candidates.size(),
            processed,
            failed,
            skipped
        );
        return new RetrySweepResult(processed, failed, skipped);
    }

    public EventPage listEvents(EventFilter filter) {
        return eventStore.find(filter == null ? EventFilter.all() : filter);
    }

    public Optional<IndexedEvent> getEvent(UUID id) {
        return eventStore.findById(id);
    }

    private void validate(List<SourceConfig> configs) {
        if (configs == null) {
            throw new IndexerConfigurationException("source configs are required");
        }
        Set<SourceKey> seen = new HashSet<>();
        for (SourceConfig config : configs) {
            if (config == null) {
                throw new IndexerConfigurationException("source config must not be null");
            }
            if (!seen.add(config.key())) {
                throw new IndexerConfigurationException("Duplicate source: " + config.key());
            }
            if (!chainReader.supportsNetwork(config.networkId())) {
                throw new IndexerConfigurationException("No RPC client configured for network " + config.networkId());
            }
        }
    }

    private void activateSource(SourceConfig config, Instant now) {
        CursorRecord cursor = cursorStore.ensureActive(config.key(), now);
        log.info(
            "Activating source: source={}, cursor={}, startHeight={}, confirmations={}, batchSize={}",
            config.key(),
            cursor.lastProcessedHeight(),
            config.startHeight(),
            config.confirmations(),
            config.batchSize()
        );
        pollers.register(newPoller(config));
    }

    private Poller newPoller(SourceConfig config) {
        return new Poller(
            config,
            chainReader,
            decoders,
            eventStore,
            cursorStore,
            dispatcher,
            clock,
            properties.getMaxRetries()
        );
    }
}
