package com.chicu.opsdash.fusion;

import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.HeatmapResult;
import com.chicu.opsdash.telemetry.model.HeatmapRow;
import com.chicu.opsdash.telemetry.model.ImpactSample;
import com.chicu.opsdash.telemetry.model.LatencySample;
import com.chicu.opsdash.telemetry.model.MergedCell;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Склейка latency и impact в heatmap (venue × bucket).
 *
 * Ячейка есть для каждого (venue, bucket), встреченного хотя бы в одном источнике.
 * Упавший источник = пустая сторона, результат помечается partial.
 */
@Slf4j
public class ExecutionTelemetryFusionEngine {

    private final SourceAdapter<LatencySample> latencySource;
    private final SourceAdapter<ImpactSample> impactSource;
    private final Executor ioExecutor;
    private final DiscrepancyRule rule;
    private final Clock clock;

    public ExecutionTelemetryFusionEngine(SourceAdapter<LatencySample> latencySource,
                                          SourceAdapter<ImpactSample> impactSource,
                                          Executor ioExecutor,
                                          DiscrepancyRule rule,
                                          Clock clock) {
        this.latencySource = latencySource;
        this.impactSource = impactSource;
        this.ioExecutor = ioExecutor;
        this.rule = rule;
        this.clock = clock;
    }

    public HeatmapResult fuse(FusionQuery query) {
        Map<String, String> upstream = query.toUpstreamQuery();

        // ---------- 1. fetch ----------
        CompletableFuture<Optional<List<LatencySample>>> latF = CompletableFuture
                .supplyAsync(() -> latencySource.tryFetch(upstream), ioExecutor)
                .exceptionally(ex -> failed(latencySource.getName(), ex));
        CompletableFuture<Optional<List<ImpactSample>>> impF = CompletableFuture
                .supplyAsync(() -> impactSource.tryFetch(upstream), ioExecutor)
                .exceptionally(ex -> failed(impactSource.getName(), ex));

        Optional<List<LatencySample>> latency = latF.join();
        Optional<List<ImpactSample>> impact = impF.join();

        return merge(query, latency.orElseGet(List::of), impact.orElseGet(List::of),
                latency.isEmpty() || impact.isEmpty());
    }

    private <T> Optional<List<T>> failed(String source, Throwable ex) {
        log.warn("⚠ fusion: источник '{}' упал: {}", source, ex.getMessage());
        return Optional.empty();
    }

    /**
     * Шаги 2–5 без сети.
     */
    HeatmapResult merge(FusionQuery query,
                        List<LatencySample> latency,
                        List<ImpactSample> impact,
                        boolean partial) {

        // ---------- 2. index ----------
        Map<String, Map<String, LatencySample>> latIdx = new TreeMap<>();
        Map<String, Map<String, ImpactSample>> impIdx = new TreeMap<>();
        Set<String> bucketKeys = new TreeSet<>();
        Set<String> symbols = new TreeSet<>();

        for (LatencySample s : latency) {
            if (skipBySymbol(query, s.getSymbol())) continue;
            latIdx.computeIfAbsent(s.getVenue(), v -> new TreeMap<>()).put(s.getBucketKey(), s);
            bucketKeys.add(s.getBucketKey());
            if (s.getSymbol() != null) symbols.add(s.getSymbol());
        }
        for (ImpactSample s : impact) {
            if (skipBySymbol(query, s.getSymbol())) continue;
            impIdx.computeIfAbsent(s.getVenue(), v -> new TreeMap<>()).put(s.getBucketKey(), s);
            bucketKeys.add(s.getBucketKey());
            if (s.getSymbol() != null) symbols.add(s.getSymbol());
        }

        // ---------- 5. window filter (ключи) ----------
        if (query.hasRange()) {
            bucketKeys.removeIf(k -> BucketKeys.toInstant(k)
                    .map(ts -> !query.getRange().contains(ts))
                    .orElse(false));
        }

        Set<String> venues = new TreeSet<>(latIdx.keySet());
        venues.addAll(impIdx.keySet());
        if (query.hasVenue()) {
            venues.removeIf(v -> !v.equalsIgnoreCase(query.getVenue().trim()));
        }

        // ---------- 3–4. merge + discrepancy ----------
        List<HeatmapRow> rows = new ArrayList<>(venues.size());
        int discrepancies = 0;

        for (String venue : venues) {
            Map<String, LatencySample> lat = latIdx.getOrDefault(venue, Map.of());
            Map<String, ImpactSample> imp = impIdx.getOrDefault(venue, Map.of());

            Set<String> keys = new TreeSet<>(lat.keySet());
            keys.addAll(imp.keySet());
            keys.retainAll(bucketKeys);

            Map<String, MergedCell> byBucket = new LinkedHashMap<>();
            for (String key : keys) {
                MergedCell cell = cell(lat.get(key), imp.get(key));
                if (cell.isDiscrepant()) discrepancies++;
                byBucket.put(key, cell);
            }
            if (!byBucket.isEmpty()) {
                rows.add(new HeatmapRow(venue, Collections.unmodifiableMap(byBucket)));
            }
        }

        Instant now = clock.instant();
        log.debug("🔥 fusion {}: {} venues, {} buckets, {} discrepant", query.windowCode(),
                rows.size(), bucketKeys.size(), discrepancies);

        return HeatmapResult.builder()
                .rows(List.copyOf(rows))
                .buckets(List.copyOf(bucketKeys))
                .discrepancyCount(discrepancies)
                .symbols(List.copyOf(symbols))
                .window(query.windowCode())
                .generatedAt(now)
                .partial(partial)
                .build();
    }

    private static boolean skipBySymbol(FusionQuery query, String recordSymbol) {
        return query.hasSymbol()
               && recordSymbol != null
               && !recordSymbol.equalsIgnoreCase(query.getSymbol().trim());
    }

    private MergedCell cell(LatencySample lat, ImpactSample imp) {
        MergedCell.MergedCellBuilder b = MergedCell.builder();

        String symbol = null;
        if (lat != null) {
            symbol = lat.getSymbol();
            b.p50Latency(lat.getP50Latency())
                    .p95Latency(lat.getP95Latency())
                    .p50Slippage(lat.getP50Slippage())
                    .p95Slippage(lat.getP95Slippage())
                    .fillRate(lat.getFillRate())
                    .depthUsd(lat.getDepthUsd());
        }
        if (imp != null) {
            if (symbol == null) symbol = imp.getSymbol();
            b.predictedCost(imp.getPredictedCost())
                    .realizedCost(imp.getRealizedCost())
                    .discrepant(rule.isDiscrepant(imp.getPredictedCost(), imp.getRealizedCost()));
        }
        return b.symbol(symbol).build();
    }
}
