package com.chicu.opsdash.regime;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.RegimeSegment;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegimeTimelineServiceTest {

    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");

    @Mock private SourceAdapter<RegimeSegment> source;

    private RegimeHistoryBuffer history;

    @BeforeEach
    void setUp() {
        history = new RegimeHistoryBuffer(new InMemoryKeyValueStore(),
                new ObjectMapper().registerModule(new JavaTimeModule()), "regime", 50);
    }

    private RegimeTimelineService serviceAt(Instant now) {
        return new RegimeTimelineService(source, history, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static RegimeSegment regime(String id, String label, Instant start) {
        return RegimeSegment.builder().id(id).label(label).start(start).confidence(0.7).build();
    }

    @Test
    void refreshRecordsCurrentRegime() {
        when(source.fetchSingle(anyMap())).thenReturn(Optional.of(regime("r1", "trend", T0)));

        RegimeTimeline timeline = serviceAt(T0.plusSeconds(90)).refresh();

        assertEquals(1, timeline.segments().size());
        assertEquals(T0, timeline.from());
        assertEquals(T0.plusSeconds(90), timeline.to());
    }

    @Test
    void unavailableSourceLeavesHistoryAlone() {
        history.record(regime("r1", "trend", T0), T0.plusSeconds(10));
        when(source.fetchSingle(anyMap())).thenReturn(Optional.empty());

        RegimeTimeline timeline = serviceAt(T0.plusSeconds(60)).refresh();

        assertEquals(1, timeline.segments().size());
        assertEquals(T0.plusSeconds(10), timeline.to());
    }

    @Test
    void paletteColorsAssignedByPosition() {
        history.record(regime("r1", "trend", T0), T0.plusSeconds(10));
        history.record(regime("r2", "range", T0.plusSeconds(10)), T0.plusSeconds(20));
        history.record(RegimeSegment.builder().id("r3").label("chop").color("#000000").build(), T0.plusSeconds(30));

        RegimeTimeline timeline = serviceAt(T0).timeline();

        assertEquals("#000000", timeline.segments().get(0).getColor());
        assertEquals(RegimeTimelineService.PALETTE.get(1), timeline.segments().get(1).getColor());
        assertEquals(RegimeTimelineService.PALETTE.get(2), timeline.segments().get(2).getColor());
        // цвета не попадают в историю
        assertNull(history.segments().get(1).getColor());
    }

    @Test
    void emptyHistoryHasNoRange() {
        RegimeTimeline timeline = serviceAt(T0).timeline();

        assertTrue(timeline.segments().isEmpty());
        assertNull(timeline.from());
        assertNull(timeline.to());
    }

    @Test
    void selectGivesSegmentRange() {
        history.record(regime("r1", "trend", T0), T0.plusSeconds(300));

        TimeRange range = serviceAt(T0).select("r1");

        assertEquals(T0, range.from());
        assertEquals(T0.plusSeconds(300), range.to());
    }

    @Test
    void selectUnknownIdFails() {
        assertThrows(NoSuchElementException.class, () -> serviceAt(T0).select("nope"));
    }
}
