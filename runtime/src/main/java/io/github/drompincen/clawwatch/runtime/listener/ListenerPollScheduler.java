package io.github.drompincen.clawwatch.runtime.listener;

import io.github.drompincen.clawwatch.protocol.api.ListenerStatsDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.TimeUnit;

/**
 * Timer for the {@link EventListener}. Fixed-delay scheduling means a tick never starts
 * while the previous one is still running.
 */
public class ListenerPollScheduler {

    private static final Logger log = LoggerFactory.getLogger(ListenerPollScheduler.class);

    private final EventListener listener;

    public ListenerPollScheduler(EventListener listener) {
        this.listener = listener;
    }

    @Scheduled(fixedDelayString = "${clawwatch.poll-interval:30}",
            initialDelayString = "${clawwatch.initial-delay:5}",
            timeUnit = TimeUnit.SECONDS)
    public void tick() {
        try {
            listener.poll();
        } catch (Exception e) {
            log.error("Poll cycle failed", e);
        }
    }

    @Scheduled(fixedRate = 300, initialDelay = 300, timeUnit = TimeUnit.SECONDS)
    public void heartbeat() {
        ListenerStatsDto stats = listener.getStats();
        log.info("Listener heartbeat: {} watcher(s) {}, {} poll(s), {} event(s)",
                stats.watchers(), stats.watcherNames(), stats.pollCount(), stats.totalEvents());
    }
}
