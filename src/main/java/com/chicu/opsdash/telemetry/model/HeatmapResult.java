package com.chicu.opsdash.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class HeatmapResult {
    List<HeatmapRow> rows;
    List<String> buckets;
    int discrepancyCount;
    List<String> symbols;

    /** код окна: 15m / 1h / ... или custom */
    String window;

    Instant generatedAt;

    /** true, если хотя бы один из двух источников не ответил */
    boolean partial;

    public static HeatmapResult empty(String window, Instant at) {
        return HeatmapResult.builder()
                .rows(List.of())
                .buckets(List.of())
                .symbols(List.of())
                .discrepancyCount(0)
                .window(window)
                .generatedAt(at)
                .partial(true)
                .build();
    }
}
