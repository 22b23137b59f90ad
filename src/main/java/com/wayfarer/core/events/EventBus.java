package com.wayfarer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers planning run events to listeners, synchronously on the publishing thread.
 * <p>
 * Coordinator workers publish task events concurrently, so listeners must be thread-safe.
 * A listener is scoped either to one run or to every run; a listener that throws is
 * logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public void publish(WayfarerEvent event) {
        Objects.requireNonNull(event, "event");
        log.debug("{} [{}] {}", event.type().label(), event.runId(), event.describe());
        for (Subscription subscription : subscriptions) {
            if (subscription.accepts(event)) {
                subscription.deliver(event);
            }
        }
    }

    /**
     * Listens to the events of one run.
     */
    public Subscription subscribe(String runId, Consumer<WayfarerEvent> listener) {
        return register(new Subscription(Objects.requireNonNull(runId, "runId"), listener));
    }

    /**
     * Listens to the events of every run, including run-less ones.
     */
    public Subscription subscribeAll(Consumer<WayfarerEvent> listener) {
        return register(new Subscription(null, listener));
    }

    int subscriberCount() {
        return subscriptions.size();
    }

    private Subscription register(Subscription subscription) {
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * A registered listener. Closing it stops delivery; closing twice is harmless.
     */
    public final class Subscription implements AutoCloseable {

        private final String runId;
        private final Consumer<WayfarerEvent> listener;

        private Subscription(String runId, Consumer<WayfarerEvent> listener) {
            this.runId = runId;
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        private boolean accepts(WayfarerEvent event) {
            return runId == null || runId.equals(event.runId());
        }

        private void deliver(WayfarerEvent event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed on {}: {}", runId != null ? runId : "all runs",
                        event.type().label(), e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            subscriptions.remove(this);
        }
    }
}
