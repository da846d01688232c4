package io.github.drompincen.clawwatch.runtime.listener;

import io.github.drompincen.clawwatch.protocol.api.ListenerStatsDto;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.runtime.listener.watcher.Watcher;
import io.github.drompincen.clawwatch.runtime.router.EventRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one poll cycle at a time over the registered watchers and hands every event to the
 * {@link EventRouter}. A failing watcher or event is logged and skipped; the cycle goes on.
 */
public class EventListener {

    private static final Logger log = LoggerFactory.getLogger(EventListener.class);

    private final WatermarkStore store;
    private final EventRouter router;
    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final AtomicLong pollCount = new AtomicLong();
    private final AtomicLong totalEvents = new AtomicLong();

    public EventListener(WatermarkStore store, EventRouter router) {
        this.store = store;
        this.router = router;
    }

    /**
     * Registers a watcher if its source is available on this machine. An unavailable watcher
     * is dropped for the lifetime of the process.
     */
    public boolean addWatcher(Watcher watcher) {
        if (!watcher.isAvailable()) {
            log.info("Watcher '{}' is not available, skipping", watcher.getName());
            return false;
        }
        watchers.add(watcher);
        log.info("Registered watcher '{}'", watcher.getName());
        return true;
    }

    /**
     * Runs one poll cycle. Returns the number of events routed, or -1 when another cycle was
     * still running.
     */
    public int poll() {
        if (!polling.compareAndSet(false, true)) {
            log.warn("Poll cycle still running, skipping this tick");
            return -1;
        }
        try {
            long cycle = pollCount.incrementAndGet();
            int routed = 0;
            for (Watcher watcher : watchers) {
                List<ListenerEvent> events;
                try {
                    events = watcher.poll(store);
                } catch (Exception e) {
                    log.error("Watcher '{}' failed in cycle {}", watcher.getName(), cycle, e);
                    continue;
                }
                if (!events.isEmpty()) {
                    log.info("Watcher '{}' found {} event(s)", watcher.getName(), events.size());
                }
                for (ListenerEvent event : events) {
                    totalEvents.incrementAndGet();
                    try {
                        router.handle(event);
                        routed++;
                    } catch (Exception e) {
                        log.error("Failed to route {} event {}", event.source(), event.rawId(), e);
                    }
                }
            }
            log.debug("Poll cycle {} complete, {} event(s) routed", cycle, routed);
            return routed;
        } finally {
            polling.set(false);
        }
    }

    /**
     * Clears all watermarks. Refused while a poll cycle is running.
     */
    public boolean resetWatermarks() {
        if (!polling.compareAndSet(false, true)) {
            return false;
        }
        try {
            store.reset();
            return true;
        } finally {
            polling.set(false);
        }
    }

    public List<String> getWatcherNames() {
        return watchers.stream().map(Watcher::getName).toList();
    }

    public ListenerStatsDto getStats() {
        return new ListenerStatsDto(watchers.size(), getWatcherNames(), pollCount.get(), totalEvents.get());
    }
}
