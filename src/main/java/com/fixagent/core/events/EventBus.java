package com.fixagent.core.events;

import com.fixagent.core.trial.TrialState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub for trial lifecycle events.
 * <p>
 * Every listener carries a filter; {@link #publish} delivers synchronously on
 * the publishing thread, in subscription order. A listener that throws is
 * logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Predicate<TrialEvent> filter, Consumer<TrialEvent> consumer) {}

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(TrialEvent event) {
        log.debug("Publishing {} ({}) for trial {}", event.eventType(), event.state(), event.trialName());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliverSafely(listener.consumer(), event);
            }
        }
    }

    /** Events of one trial. */
    public Subscription subscribe(String trialId, Consumer<TrialEvent> consumer) {
        return register(event -> trialId.equals(event.trialId()), consumer);
    }

    /** Events of every trial entering {@code state}. */
    public Subscription subscribeToState(TrialState state, Consumer<TrialEvent> consumer) {
        return register(event -> event.state() == state, consumer);
    }

    public Subscription subscribeAll(Consumer<TrialEvent> consumer) {
        return register(event -> true, consumer);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Predicate<TrialEvent> filter, Consumer<TrialEvent> consumer) {
        var listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void deliverSafely(Consumer<TrialEvent> consumer, TrialEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for trial {}: {}", event.state(), event.trialName(), e.getMessage(), e);
        }
    }
}
