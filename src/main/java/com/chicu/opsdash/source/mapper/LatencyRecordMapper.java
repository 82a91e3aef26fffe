package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.LatencySample;
import com.fasterxml.jackson.databind.JsonNode;

/** /api/execution/latency → LatencySample */
public class LatencyRecordMapper implements RecordMapper<LatencySample> {

    @Override
    public LatencySample map(JsonNode item, Context ctx) {
        Double depth = JsonFields.optionalNumber(item, FieldAliases.DEPTH_USD);

        return LatencySample.builder()
                .venue(ExecutionKeys.venue(item))
                .bucketKey(ExecutionKeys.bucket(item))
                .symbol(ExecutionKeys.symbol(item))
                .p50Latency(JsonFields.number(item, FieldAliases.P50_LATENCY))
                .p95Latency(JsonFields.number(item, FieldAliases.P95_LATENCY))
                .p50Slippage(JsonFields.number(item, FieldAliases.P50_SLIPPAGE))
                .p95Slippage(JsonFields.number(item, FieldAliases.P95_SLIPPAGE))
                .fillRate(JsonFields.number(item, FieldAliases.FILL_RATE))
                // нулевая глубина = данных нет
                .depthUsd(depth != null && depth != 0.0 ? depth : null)
                .build();
    }
}
