package com.chicu.opsdash.fusion;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.HeatmapResult;
import com.chicu.opsdash.telemetry.model.HeatmapRow;
import com.chicu.opsdash.telemetry.model.ImpactSample;
import com.chicu.opsdash.telemetry.model.LatencySample;
import com.chicu.opsdash.telemetry.model.MergedCell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionTelemetryFusionEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock private SourceAdapter<LatencySample> latencySource;
    @Mock private SourceAdapter<ImpactSample> impactSource;

    private ExecutionTelemetryFusionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExecutionTelemetryFusionEngine(latencySource, impactSource, Runnable::run,
                new DiscrepancyRule(0.25), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static LatencySample lat(String venue, String bucket, String symbol) {
        return LatencySample.builder()
                .venue(venue).bucketKey(bucket).symbol(symbol)
                .p50Latency(12).p95Latency(40).p50Slippage(1.5).p95Slippage(4).fillRate(0.97)
                .build();
    }

    private static ImpactSample imp(String venue, String bucket, double predicted, double realized) {
        return ImpactSample.builder()
                .venue(venue).bucketKey(bucket).symbol("BTCUSDT")
                .predictedCost(predicted).realizedCost(realized)
                .build();
    }

    private static FusionQuery all() {
        return FusionQuery.builder().build();
    }

    private static MergedCell cell(HeatmapResult r, String venue, String bucket) {
        return r.getRows().stream()
                .filter(row -> row.venue().equals(venue))
                .map(row -> row.byBucket().get(bucket))
                .findFirst()
                .orElse(null);
    }

    @Test
    void cellForEveryKeySeenOnEitherSide() {
        HeatmapResult r = engine.merge(all(),
                List.of(lat("binance", "b1", "BTCUSDT")),
                List.of(imp("binance", "b2", 10, 10), imp("okx", "b1", 10, 10)),
                false);

        assertEquals(List.of("binance", "okx"), r.getRows().stream().map(HeatmapRow::venue).toList());
        assertEquals(List.of("b1", "b2"), r.getBuckets());

        MergedCell latOnly = cell(r, "binance", "b1");
        assertTrue(latOnly.hasLatency());
        assertFalse(latOnly.hasImpact());
        assertFalse(latOnly.isDiscrepant());

        MergedCell impOnly = cell(r, "binance", "b2");
        assertFalse(impOnly.hasLatency());
        assertTrue(impOnly.hasImpact());
        assertNull(impOnly.getP50Latency());
    }

    @Test
    void discrepancyCountFollowsRule() {
        HeatmapResult r = engine.merge(all(),
                List.of(),
                List.of(
                        imp("binance", "b1", 100, 130),
                        imp("binance", "b2", 100, 120),
                        imp("binance", "b3", 0, 5),
                        imp("binance", "b4", 0, 0)),
                false);

        assertEquals(2, r.getDiscrepancyCount());
        assertTrue(cell(r, "binance", "b1").isDiscrepant());
        assertFalse(cell(r, "binance", "b2").isDiscrepant());
        assertTrue(cell(r, "binance", "b3").isDiscrepant());
        assertFalse(cell(r, "binance", "b4").isDiscrepant());
    }

    @Test
    void rangeFilterDropsTimedKeysOutsideAndKeepsOpaqueOnes() {
        String inside = "2024-03-01T10:00:00Z";
        String outside = "2024-02-01T10:00:00Z";
        String insideMillis = String.valueOf(Instant.parse("2024-03-01T11:00:00Z").toEpochMilli());

        FusionQuery q = FusionQuery.builder()
                .range(new TimeRange(Instant.parse("2024-03-01T00:00:00Z"), NOW))
                .build();

        HeatmapResult r = engine.merge(q,
                List.of(lat("binance", inside, null), lat("binance", outside, null),
                        lat("binance", insideMillis, null), lat("binance", "3", null),
                        lat("binance", "morning", null)),
                List.of(),
                false);

        assertEquals(List.of(insideMillis, "2024-03-01T10:00:00Z", "3", "morning").stream().sorted().toList(),
                r.getBuckets());
        assertFalse(r.getBuckets().contains(outside));
        assertEquals("custom", r.getWindow());
    }

    @Test
    void explicitRangeBoundsAreInclusive() {
        FusionQuery q = FusionQuery.builder()
                .range(new TimeRange(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T02:00:00Z")))
                .build();

        HeatmapResult r = engine.merge(q,
                List.of(lat("binance", "2024-03-01T00:00:00Z", null),
                        lat("binance", "2024-03-01T02:00:00Z", null),
                        lat("binance", "2024-03-01T04:00:00Z", null)),
                List.of(),
                false);

        assertEquals(List.of("2024-03-01T00:00:00Z", "2024-03-01T02:00:00Z"), r.getBuckets());
    }

    @Test
    void venueAndSymbolFiltersAreCaseInsensitive() {
        FusionQuery q = FusionQuery.builder().venue("BINANCE").symbol("btcusdt").build();

        HeatmapResult r = engine.merge(q,
                List.of(lat("binance", "b1", "BTCUSDT"), lat("binance", "b2", "ETHUSDT"),
                        lat("binance", "b3", null), lat("okx", "b1", "BTCUSDT")),
                List.of(),
                false);

        assertEquals(1, r.getRows().size());
        assertEquals("binance", r.getRows().get(0).venue());
        // запись без символа не отбрасывается
        assertEquals(List.of("b1", "b3"), List.copyOf(r.getRows().get(0).byBucket().keySet()));
        assertEquals(List.of("BTCUSDT"), r.getSymbols());
    }

    @Test
    void failedSideMakesResultPartial() {
        when(latencySource.tryFetch(anyMap())).thenReturn(Optional.of(List.of(lat("binance", "b1", "BTCUSDT"))));
        when(impactSource.tryFetch(anyMap())).thenReturn(Optional.empty());

        HeatmapResult r = engine.fuse(all());

        assertTrue(r.isPartial());
        assertEquals(1, r.getRows().size());
        assertEquals(NOW, r.getGeneratedAt());
    }

    @Test
    void bothSidesAnsweringIsNotPartial() {
        when(latencySource.tryFetch(anyMap())).thenReturn(Optional.of(List.of()));
        when(impactSource.tryFetch(anyMap())).thenReturn(Optional.of(List.of(imp("okx", "b1", 1, 1))));

        HeatmapResult r = engine.fuse(all());

        assertFalse(r.isPartial());
        assertEquals("1h", r.getWindow());
    }

    @Test
    void throwingSourceIsTreatedAsUnavailable() {
        when(latencySource.tryFetch(anyMap())).thenThrow(new IllegalStateException("boom"));
        when(impactSource.tryFetch(anyMap())).thenReturn(Optional.of(List.of()));

        HeatmapResult r = engine.fuse(all());

        assertTrue(r.isPartial());
        assertTrue(r.getRows().isEmpty());
    }
}
