package com.advocacypacket.core.bus;

import com.advocacypacket.core.events.Event;
import com.advocacypacket.core.events.RegionAggregated;
import com.advocacypacket.core.events.SnapshotDegraded;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishRoutesOnlyToSubscribersOfThatType() {
        EventBus bus = new EventBus();
        AtomicInteger degradedHits = new AtomicInteger();
        AtomicInteger regionHits = new AtomicInteger();

        bus.subscribe(SnapshotDegraded.class, event -> degradedHits.incrementAndGet());
        bus.subscribe(RegionAggregated.class, event -> regionHits.incrementAndGet());

        bus.publish(new SnapshotDegraded(NOW, "tribe-1", "corrupt"));

        assertEquals(1, degradedHits.get());
        assertEquals(0, regionHits.get());
    }

    @Test
    void catchAllHandlersSeeEveryEventInPublishOrder() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribeAll(event -> seen.add(event.type()));

        bus.publish(new SnapshotDegraded(NOW, "tribe-1", "oversized"));
        bus.publish(new RegionAggregated(NOW, "pnw", 3, 2, 1));

        assertEquals(List.of("SnapshotDegraded", "RegionAggregated"), seen);
    }

    @Test
    void failingHandlerIsReportedAndDeliveryContinues() {
        AtomicReference<Exception> captured = new AtomicReference<>();
        AtomicReference<Event> failedEvent = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> {
            failedEvent.set(event);
            captured.set(error);
        });
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(SnapshotDegraded.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(SnapshotDegraded.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new SnapshotDegraded(NOW, "tribe-1", "corrupt"));

        assertEquals(2, safeHits.get());
        assertNotNull(captured.get());
        assertEquals("boom", captured.get().getMessage());
        assertEquals("SnapshotDegraded", failedEvent.get().type());
    }
}
