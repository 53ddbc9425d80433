package io.lift.indexer.poller;

import io.lift.indexer.source.SourceKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Running pollers and their timers, one per source key. Cancelling a timer lets an in-flight tick finish.
 */
public class PollerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PollerRegistry.class);

    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final Map<SourceKey, Handle> handles = new ConcurrentHashMap<>();

    public PollerRegistry(TaskScheduler scheduler, Duration pollInterval) {
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    /**
     * @return false when a poller for the same key is already registered
     */
    public boolean register(Poller poller) {
        if (handles.containsKey(poller.key())) {
            return false;
        }
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(poller::tick, pollInterval);
        handles.put(poller.key(), new Handle(poller, future));
        log.info("Started poller: source={}, intervalMs={}", poller.key(), pollInterval.toMillis());
        return true;
    }

    public boolean cancel(SourceKey key) {
        Handle handle = handles.remove(key);
        if (handle == null) {
            return false;
        }
        handle.future().cancel(false);
        log.info("Stopped poller: source={}", key);
        return true;
    }

    public int cancelAll() {
        int cancelled = 0;
        for (SourceKey key : List.copyOf(handles.keySet())) {
            if (cancel(key)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public Optional<Poller> find(SourceKey key) {
        Handle handle = handles.get(key);
        return handle == null ? Optional.empty() : Optional.of(handle.poller());
    }

    public List<Poller> pollers() {
        List<Poller> pollers = new ArrayList<>();
        handles.values().forEach(handle -> pollers.add(handle.poller()));
        return pollers;
    }

    public int size() {
        return handles.size();
    }

    private record Handle(Poller poller, ScheduledFuture<?> future) {
    }
}
