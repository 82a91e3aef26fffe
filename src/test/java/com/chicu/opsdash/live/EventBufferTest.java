package com.chicu.opsdash.live;

import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBufferTest {

    private static TelemetryEvent ev(String id, long sec) {
        return TelemetryEvent.builder().id(id).timestamp(Instant.ofEpochSecond(1_700_000_000L + sec)).build();
    }

    @Test
    void sortedNewestFirstAndBounded() {
        EventBuffer buf = new EventBuffer(2);
        assertTrue(buf.merge(List.of(ev("a", 1), ev("c", 3), ev("b", 2))));

        assertEquals(List.of("c", "b"), buf.snapshot().stream().map(TelemetryEvent::getId).toList());
        assertEquals(2, buf.size());
    }

    @Test
    void sameIdReplacesOlderVersion() {
        EventBuffer buf = new EventBuffer(10);
        buf.merge(List.of(ev("a", 1)));
        TelemetryEvent updated = ev("a", 1).toBuilder().read(true).build();
        buf.merge(List.of(updated));

        assertEquals(1, buf.size());
        assertTrue(buf.snapshot().get(0).isRead());
    }

    @Test
    void unchangedMergeReportsNoChange() {
        EventBuffer buf = new EventBuffer(10);
        buf.merge(List.of(ev("a", 1)));
        assertFalse(buf.merge(List.of(ev("a", 1))));
        assertFalse(buf.merge(List.of()));
    }

    @Test
    void snapshotIsDetached() {
        EventBuffer buf = new EventBuffer(10);
        buf.merge(List.of(ev("a", 1)));
        buf.snapshot().get(0).setRead(true);
        assertFalse(buf.snapshot().get(0).isRead());
    }
}
