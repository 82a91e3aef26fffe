package com.chicu.opsdash.live;

import com.chicu.opsdash.common.time.LenientTimestamps;
import com.chicu.opsdash.source.mapper.AlertRecordMapper;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiveEventDecoderTest {

    private final LiveEventDecoder decoder = new LiveEventDecoder(new ObjectMapper(), new AlertRecordMapper(),
            new LenientTimestamps(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC)));

    @Test
    void initCarriesBatch() {
        List<TelemetryEvent> events = decoder.decode(LiveEventDecoder.INIT,
                "[{\"id\":\"a1\",\"ts\":\"2024-01-01T00:00:01Z\",\"event\":\"live_metrics_breach\"},"
                        + "{\"id\":\"a2\",\"ts\":\"2024-01-01T00:00:02Z\"}]");

        assertEquals(List.of("a1", "a2"), events.stream().map(TelemetryEvent::getId).toList());
        assertEquals("live_metrics_breach", events.get(0).getEvent());
    }

    @Test
    void initAcceptsWrappedBatch() {
        List<TelemetryEvent> events = decoder.decode(LiveEventDecoder.INIT,
                "{\"alerts\":[{\"id\":\"a1\",\"ts\":\"2024-01-01T00:00:01Z\"}]}");

        assertEquals(1, events.size());
    }

    @Test
    void alertCarriesOneEvent() {
        List<TelemetryEvent> events = decoder.decode(LiveEventDecoder.ALERT,
                "{\"id\":\"a9\",\"ts\":1704067205000,\"title\":\"VaR breach\"}");

        assertEquals(1, events.size());
        assertEquals("VaR breach", events.get(0).getTitle());
        assertEquals(Instant.parse("2024-01-01T00:00:05Z"), events.get(0).getTimestamp());
    }

    @Test
    void brokenOrUnknownGivesNothing() {
        assertTrue(decoder.decode(LiveEventDecoder.ALERT, "{oops").isEmpty());
        assertTrue(decoder.decode(LiveEventDecoder.ALERT, "").isEmpty());
        assertTrue(decoder.decode("heartbeat", "{\"id\":\"x\"}").isEmpty());
        assertFalse(decoder.isKnown("heartbeat"));
    }
}
