package work.packhost.kernel.workflow;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory pub/sub for workflow events. Subscribers register per pack or globally; a failing
 * subscriber never affects the publishing workflow.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<WorkflowEvent>>> packSubscribers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<WorkflowEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        log.debug("Publishing {} from pack {}", event.eventType(), event.packId());
        List<Consumer<WorkflowEvent>> packSubs = packSubscribers.get(event.packId());
        if (packSubs != null) {
            for (Consumer<WorkflowEvent> subscriber : packSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<WorkflowEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String packId, Consumer<WorkflowEvent> consumer) {
        packSubscribers.computeIfAbsent(packId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<WorkflowEvent>> subs = packSubscribers.get(packId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<WorkflowEvent> subscriber, WorkflowEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
