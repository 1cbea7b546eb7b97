// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.registry.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.covenant.core.agent.event.RegistryEvent;
import sh.covenant.core.logging.DebugLogger;
import sh.covenant.core.logging.LogFormatter;

/**
 * Append-only log of committed events.
 * <p>
 * Appends happen under the ledger's write lock. Reads take a snapshot and may run
 * concurrently with them.
 */
public final class EventLog {

    private static final Logger LOG = LoggerFactory.getLogger(EventLog.class);

    private final List<RegistryEvent> events = new CopyOnWriteArrayList<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    EventLog() {
    }

    /** Snapshot of every committed event, oldest first. */
    public List<RegistryEvent> all() {
        return List.copyOf(events);
    }

    /** Snapshot of committed events of one type, oldest first. */
    public <E extends RegistryEvent> List<E> ofType(final Class<E> type) {
        Objects.requireNonNull(type, "type");
        final List<E> result = new ArrayList<>();
        for (RegistryEvent event : events) {
            if (type.isInstance(event)) {
                result.add(type.cast(event));
            }
        }
        return result;
    }

    public int size() {
        return events.size();
    }

    /** Registers a listener for events committed from now on. */
    public void subscribe(final EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** @return true if the listener was subscribed */
    public boolean unsubscribe(final EventListener listener) {
        return listeners.remove(listener);
    }

    void append(final long sequence, final List<RegistryEvent> committed) {
        events.addAll(committed);
        for (RegistryEvent event : committed) {
            DebugLogger.logEvent(LogFormatter.formatEvent(event.signature(), event.topic().value(), event));
            for (EventListener listener : listeners) {
                try {
                    listener.onEvent(sequence, event);
                } catch (RuntimeException e) {
                    // the transaction stays committed; remaining listeners still run
                    LOG.error("Event listener {} failed on {} at seq={}", listener, event.signature(), sequence, e);
                }
            }
        }
    }
}
