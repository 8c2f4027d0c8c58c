package work.packhost.kernel.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventBusTest {
    private static WorkflowEvent event(String packId) {
        return new WorkflowEvent("tick", packId, "i", "w", "s", null, Instant.now());
    }

    @Test
    void deliversToPackAndGlobalSubscribers() {
        var bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("a", e -> seen.add("a:" + e.packId()));
        bus.subscribeAll(e -> seen.add("all:" + e.packId()));

        bus.publish(event("a"));
        bus.publish(event("b"));

        assertEquals(List.of("a:a", "all:a", "all:b"), seen);
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        var bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("a", e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("a", e -> seen.add(e.eventType()));

        bus.publish(event("a"));

        assertEquals(List.of("tick"), seen);
    }

    @Test
    void unsubscribeStopsDelivery() {
        var bus = new EventBus();
        List<String> seen = new ArrayList<>();
        var subscription = bus.subscribe("a", e -> seen.add(e.eventType()));

        subscription.unsubscribe();
        bus.publish(event("a"));

        assertEquals(List.of(), seen);
    }
}
