package com.chicu.opsdash.fusion;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.common.time.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FusionQueryTest {

    @Test
    void namedWindowGoesUpstreamAsCode() {
        FusionQuery q = FusionQuery.builder()
                .venue(" binance ")
                .symbol("BTCUSDT")
                .window(TimeWindow.M15)
                .build();

        Map<String, String> upstream = q.toUpstreamQuery();

        assertEquals("binance", upstream.get("venue"));
        assertEquals("BTCUSDT", upstream.get("symbol"));
        assertEquals("15m", upstream.get("window"));
        assertFalse(upstream.containsKey("from"));
    }

    @Test
    void explicitRangeWinsOverWindow() {
        FusionQuery q = FusionQuery.builder()
                .window(TimeWindow.H4)
                .range(TimeRange.ofEpochMillis(1_700_000_000_000L, 1_700_000_600_000L))
                .build();

        Map<String, String> upstream = q.toUpstreamQuery();

        assertEquals("custom", q.windowCode());
        assertEquals("1700000000000", upstream.get("from"));
        assertEquals("1700000600000", upstream.get("to"));
        assertEquals("custom", upstream.get("window"));
    }

    @Test
    void blankFiltersAreIgnored() {
        FusionQuery q = FusionQuery.builder().venue("  ").symbol("").build();

        assertFalse(q.hasVenue());
        assertFalse(q.hasSymbol());
        assertEquals(Map.of("window", "1h"), q.toUpstreamQuery());
    }
}
