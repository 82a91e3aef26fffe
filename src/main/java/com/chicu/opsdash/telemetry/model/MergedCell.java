package com.chicu.opsdash.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Ячейка heatmap: latency-часть и impact-часть одного (venue, bucket).
 *
 * Поля отсутствующей стороны остаются null - ноль тут исказил бы картину.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MergedCell {
    String symbol;

    Double p50Latency;
    Double p95Latency;
    Double p50Slippage;
    Double p95Slippage;
    Double fillRate;
    Double depthUsd;

    Double predictedCost;
    Double realizedCost;

    boolean discrepant;

    public boolean hasLatency() {
        return p50Latency != null;
    }

    public boolean hasImpact() {
        return predictedCost != null;
    }
}
