package io.lift.indexer.handler;

import io.lift.indexer.config.IndexerProperties;
import io.lift.indexer.event.UnknownPayload;
import io.lift.indexer.store.EventStore;
import io.lift.indexer.store.IndexedEvent;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the business handler for one stored event and records the outcome on the row. Used by the pollers for new
 * rows and by the retry sweep for failed ones.
 */
@Component
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final BusinessHandlerRegistry handlers;
    private final EventStore eventStore;
    private final Executor handlerExecutor;
    private final Duration handlerTimeout;
    private final Clock clock;

    public EventDispatcher(
        BusinessHandlerRegistry handlers,
        EventStore eventStore,
        @Qualifier("handlerExecutor") Executor handlerExecutor,
        IndexerProperties properties,
        Clock clock
    ) {
        this.handlers = handlers;
        this.eventStore = eventStore;
        this.handlerExecutor = handlerExecutor;
        this.handlerTimeout = Duration.ofMillis(properties.getHandlerTimeoutMs());
        this.clock = clock;
    }

    public DispatchOutcome dispatch(IndexedEvent event) {
        if (event.processed() || event.decodedArgs() instanceof UnknownPayload) {
            return DispatchOutcome.SKIPPED;
        }

        HandlerResult result = invoke(event);
        if (result == null) {
            return DispatchOutcome.NOT_STARTED;
        }
        if (result.success()) {
            if (!eventStore.markProcessed(event.id(), event.retryCount(), clock.instant())) {
                log.info("Event {} changed concurrently; processed outcome not recorded", event.id());
                return DispatchOutcome.CONFLICT;
            }
            return DispatchOutcome.PROCESSED;
        }

        log.warn(
            "Business handler failed: eventId={}, event={}, tx={}, logIndex={}, attempt={}, error={}",
            event.id(),
            event.eventName(),
            event.txHash(),
            event.logIndex(),
            event.retryCount() + 1,
            result.error()
        );
        if (!eventStore.markFailed(event.id(), event.retryCount(), result.error())) {
            log.info("Event {} changed concurrently or reached its retry cap; failure not recorded", event.id());
            return DispatchOutcome.CONFLICT;
        }
        return DispatchOutcome.FAILED;
    }

    /**
     * Runs the handler on the handler pool and waits up to the timeout. On timeout the worker is interrupted.
     *
     * @return null when the handler never started: the pool rejected the task or it was still queued at the deadline
     */
    private HandlerResult invoke(IndexedEvent event) {
        Optional<BusinessHandler> handler = handlers.handlerFor(event.schemaKind());
        if (handler.isEmpty()) {
            return HandlerResult.failed("No business handler registered for schemaKind " + event.schemaKind());
        }

        DecodedEvent decoded = DecodedEvent.from(event);
        AtomicBoolean started = new AtomicBoolean(false);
        FutureTask<HandlerResult> task = new FutureTask<>(() -> {
            started.set(true);
            return handler.get().apply(decoded);
        });
        try {
            handlerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Handler pool rejected event {}; left for a later attempt: {}", event.id(), e.getMessage());
            return null;
        }

        try {
            HandlerResult result = task.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result == null ? HandlerResult.failed("Handler returned no result") : result;
        } catch (TimeoutException e) {
            task.cancel(true);
            if (!started.get()) {
                log.warn(
                    "Handler for event {} did not start within {} ms; left for a later attempt",
                    event.id(),
                    handlerTimeout.toMillis()
                );
                return null;
            }
            return HandlerResult.failed("Handler timed out after " + handlerTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("Business handler threw for event {}", event.id(), cause);
            return HandlerResult.failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            return started.get() ? HandlerResult.failed("Interrupted while waiting for handler") : null;
        }
    }
}
