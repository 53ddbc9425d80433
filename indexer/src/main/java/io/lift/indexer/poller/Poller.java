package io.lift.indexer.poller;

import io.lift.indexer.chain.ChainReader;
import io.lift.indexer.chain.RawLog;
import io.lift.indexer.decoder.DecodeResult;
import io.lift.indexer.decoder.EventDecoderRegistry;
import io.lift.indexer.handler.DispatchOutcome;
import io.lift.indexer.handler.EventDispatcher;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.source.SourceKey;
import io.lift.indexer.store.CursorRecord;
import io.lift.indexer.store.CursorStore;
import io.lift.indexer.store.EventProcessingStatus;
import io.lift.indexer.store.EventStore;
import io.lift.indexer.store.IndexedEvent;
import io.lift.indexer.store.NewIndexedEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scan loop for one source. A tick reads the head, fetches the next confirmed range, stores every log, dispatches
 * the new rows and then advances the cursor. Any failure before the cursor write leaves the cursor untouched and is
 * recorded on it instead.
 */
public class Poller {

    private static final Logger log = LoggerFactory.getLogger(Poller.class);

    private final SourceConfig source;
    private final ChainReader chainReader;
    private final EventDecoderRegistry decoders;
    private final EventStore eventStore;
    private final CursorStore cursorStore;
    private final EventDispatcher dispatcher;
    private final Clock clock;
    private final int maxRetries;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public Poller(
        SourceConfig source,
        ChainReader chainReader,
        EventDecoderRegistry decoders,
        EventStore eventStore,
        CursorStore cursorStore,
        EventDispatcher dispatcher,
        Clock clock,
        int maxRetries
    ) {
        this.source = source;
        this.chainReader = chainReader;
        this.decoders = decoders;
        this.eventStore = eventStore;
        this.cursorStore = cursorStore;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    public SourceConfig source() {
        return source;
    }

    public SourceKey key() {
        return source.key();
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    /**
     * Runs one tick unless the previous one is still in flight. Never throws.
     */
    public TickResult tick() {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Skipping tick for {}: previous tick still running", key());
            return TickResult.of(TickResult.Status.BUSY);
        }
        ScanRange range = null;
        try {
            Optional<CursorRecord> cursor = cursorStore.find(key());
            if (cursor.isEmpty() || !cursor.get().active()) {
                return TickResult.of(TickResult.Status.INACTIVE);
            }

            long head = chainReader.headHeight(source.networkId());
            Optional<ScanRange> next = ScanRange.next(
                cursor.get().lastProcessedHeight(),
                source.startHeight(),
                head,
                source.confirmations(),
                source.batchSize()
            );
            if (next.isEmpty()) {
                log.debug("No new confirmed range for {}: head={}, cursor={}", key(), head, cursor.get().lastProcessedHeight());
                return TickResult.of(TickResult.Status.NO_NEW_RANGE);
            }
            range = next.get();
            return scan(range);
        } catch (RuntimeException e) {
            String message = describe(e);
            log.error("Indexer tick failed: source={}, range={}, error={}", key(), range, message, e);
            recordError(message);
            return TickResult.failed(range, message);
        } finally {
            inFlight.set(false);
        }
    }

    private TickResult scan(ScanRange range) {
        List<RawLog> logs = chainReader.getLogs(
            source.networkId(),
            source.contractAddress(),
            range.fromHeight(),
            range.toHeight()
        );

        Map<String, Instant> blockTimestamps = new HashMap<>();
        for (RawLog rawLog : logs) {
            blockTimestamps.computeIfAbsent(
                rawLog.blockHash(),
                hash -> chainReader.blockTimestamp(source.networkId(), hash)
            );
        }

        // Persist the whole batch before dispatching anything.
        List<IndexedEvent> toDispatch = new ArrayList<>();
        int inserted = 0;
        int duplicates = 0;
        int undecoded = 0;
        for (RawLog rawLog : logs) {
            DecodeResult decoded = decoders.decode(source.schemaKind(), rawLog);
            if (!decoded.isDecoded()) {
                undecoded++;
                log.warn(
                    "Storing undecoded log as Unknown: source={}, tx={}, logIndex={}, reason={}",
                    key(),
                    rawLog.txHash(),
                    rawLog.logIndex(),
                    decoded.error()
                );
            }
            Optional<IndexedEvent> stored = eventStore.insertIfAbsent(
                NewIndexedEvent.from(source, rawLog, blockTimestamps.get(rawLog.blockHash()), decoded, maxRetries)
            );
            if (stored.isPresent()) {
                inserted++;
                toDispatch.add(stored.get());
                continue;
            }
            duplicates++;
            // A row stored by an interrupted tick that never reached dispatch.
            eventStore.findByLogKey(source.networkId(), rawLog.txHash(), rawLog.logIndex())
                .filter(existing -> existing.status() == EventProcessingStatus.PENDING)
                .ifPresent(toDispatch::add);
        }

        int processed = 0;
        int failed = 0;
        int notStarted = 0;
        for (IndexedEvent event : toDispatch) {
            DispatchOutcome outcome = dispatchSafely(event);
            if (outcome == DispatchOutcome.PROCESSED) {
                processed++;
            } else if (outcome == DispatchOutcome.FAILED) {
                failed++;
            } else if (outcome == DispatchOutcome.NOT_STARTED) {
                notStarted++;
            }
        }

        if (notStarted > 0) {
            // The range is rescanned and its PENDING rows dispatched again on the next tick.
            String message = notStarted + " event(s) in blocks " + range.fromHeight() + ".." + range.toHeight()
                + " were not handled: handler pool busy";
            log.warn("Holding cursor for {}: {}", key(), message);
            recordError(message);
            return new TickResult(
                TickResult.Status.FAILED,
                range,
                logs.size(),
                inserted,
                duplicates,
                undecoded,
                processed,
                failed,
                message
            );
        }

        cursorStore.advance(key(), range.toHeight(), clock.instant());
        if (!logs.isEmpty()) {
            log.info(
                "Indexed range: source={}, from={}, to={}, logs={}, inserted={}, duplicates={}, undecoded={}, processed={}, failed={}",
                key(),
                range.fromHeight(),
                range.toHeight(),
                logs.size(),
                inserted,
                duplicates,
                undecoded,
                processed,
                failed
            );
        }
        return new TickResult(
            TickResult.Status.ADVANCED,
            range,
            logs.size(),
            inserted,
            duplicates,
            undecoded,
            processed,
            failed,
            null
        );
    }

    /**
     * A dispatch error is recorded as a failed attempt. If that write fails too, the exception aborts the tick so
     * the cursor stays below the still PENDING row.
     */
    private DispatchOutcome dispatchSafely(IndexedEvent event) {
        try {
            return dispatcher.dispatch(event);
        } catch (RuntimeException e) {
            log.error("Dispatch failed for event {} on {}", event.id(), key(), e);
            try {
                eventStore.markFailed(event.id(), event.retryCount(), describe(e));
            } catch (RuntimeException markError) {
                if (markError != e) {
                    markError.addSuppressed(e);
                }
                throw markError;
            }
            return DispatchOutcome.FAILED;
        }
    }

    private void recordError(String message) {
        try {
            cursorStore.recordError(key(), message, clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to record tick error for {}", key(), e);
        }
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
