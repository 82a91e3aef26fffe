package com.chicu.opsdash.telemetry.model;

import lombok.Builder;
import lombok.Value;

/**
 * Телеметрия исполнения по площадке и бакету.
 * Латентность - мс, проскальзывание - bps, fillRate - 0..1.
 */
@Value
@Builder
public class LatencySample {
    String venue;
    String bucketKey;
    String symbol;

    double p50Latency;
    double p95Latency;
    double p50Slippage;
    double p95Slippage;
    double fillRate;

    /** null, если источник не прислал глубину */
    Double depthUsd;
}
