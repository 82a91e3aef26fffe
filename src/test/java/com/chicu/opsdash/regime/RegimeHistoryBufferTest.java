package com.chicu.opsdash.regime;

import com.chicu.opsdash.telemetry.model.RegimeSegment;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RegimeHistoryBufferTest {

    private static final String KEY = "regime_history_buffer";
    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
    }

    private static RegimeSegment regime(String id, String label, double confidence) {
        return RegimeSegment.builder().id(id).label(label).confidence(confidence).build();
    }

    @Test
    void sameLabelExtendsHead() {
        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);

        buffer.record(regime("r1", "trend", 0.6), T0);
        buffer.record(regime("r1", "trend", 0.8), T0.plusSeconds(30));

        List<RegimeSegment> segments = buffer.segments();
        assertEquals(1, segments.size());
        assertEquals(T0, segments.get(0).getStart());
        assertEquals(T0.plusSeconds(30), segments.get(0).getEnd());
        assertEquals(0.8, segments.get(0).getConfidence());
    }

    @Test
    void newLabelPushesNewestFirst() {
        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);

        buffer.record(regime("r1", "trend", 0.6), T0);
        buffer.record(regime("r2", "range", 0.7), T0.plusSeconds(30));

        assertEquals(List.of("range", "trend"), buffer.segments().stream().map(RegimeSegment::getLabel).toList());
    }

    @Test
    void capacityDropsOldest() {
        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(store, objectMapper, KEY, 3);

        for (int i = 0; i < 5; i++) {
            buffer.record(regime("r" + i, "label-" + i, 0.5), T0.plusSeconds(i));
        }

        assertEquals(3, buffer.size());
        assertEquals("label-4", buffer.segments().get(0).getLabel());
        assertEquals("label-2", buffer.segments().get(2).getLabel());
    }

    @Test
    void historySurvivesRestart() {
        RegimeHistoryBuffer first = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);
        first.record(regime("r1", "trend", 0.6), T0);
        first.record(regime("r2", "range", 0.7), T0.plusSeconds(60));

        RegimeHistoryBuffer restored = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);

        assertEquals(2, restored.size());
        assertEquals("r2", restored.segments().get(0).getId());
        assertEquals(T0.plusSeconds(60), restored.segments().get(0).getStart());
    }

    @Test
    void corruptStoredValueStartsEmpty() {
        store.put(KEY, "{not json");

        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);

        assertEquals(0, buffer.size());
    }

    @Test
    void failedPersistKeepsInMemoryHistory() {
        KeyValueStore broken = new KeyValueStore() {
            @Override
            public Optional<String> get(String key) {
                return Optional.empty();
            }

            @Override
            public void put(String key, String value) {
                throw new UncheckedIOException(new java.io.IOException("disk full"));
            }

            @Override
            public void remove(String key) {
            }
        };
        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(broken, objectMapper, KEY, 50);

        assertDoesNotThrow(() -> buffer.record(regime("r1", "trend", 0.6), T0));
        assertEquals(1, buffer.size());
    }

    @Test
    void labellessRegimeIsIgnored() {
        RegimeHistoryBuffer buffer = new RegimeHistoryBuffer(store, objectMapper, KEY, 50);

        buffer.record(RegimeSegment.builder().id("x").build(), T0);
        buffer.record(null, T0);

        assertEquals(0, buffer.size());
        assertTrue(store.get(KEY).isEmpty());
    }
}
