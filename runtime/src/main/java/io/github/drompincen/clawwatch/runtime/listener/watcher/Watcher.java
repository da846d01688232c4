package io.github.drompincen.clawwatch.runtime.listener.watcher;

import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;

import java.util.List;

/**
 * A source of {@link ListenerEvent}s that reads incrementally against its own watermarks.
 * Implementations update and save the store right after computing a batch, never before.
 */
public interface Watcher {

    /** Stable identifier, also the namespace of this watcher's watermarks. */
    String getName();

    /** Cheap environment check, evaluated once when the watcher is registered. */
    boolean isAvailable();

    /** Returns events new since the last successful poll, in ascending source order. */
    List<ListenerEvent> poll(WatermarkStore store);
}
