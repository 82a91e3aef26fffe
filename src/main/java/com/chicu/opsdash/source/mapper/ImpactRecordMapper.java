package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.ImpactSample;
import com.fasterxml.jackson.databind.JsonNode;

/** realized / impact логи исполнения → ImpactSample */
public class ImpactRecordMapper implements RecordMapper<ImpactSample> {

    @Override
    public ImpactSample map(JsonNode item, Context ctx) {
        return ImpactSample.builder()
                .venue(ExecutionKeys.venue(item))
                .bucketKey(ExecutionKeys.bucket(item))
                .symbol(ExecutionKeys.symbol(item))
                .predictedCost(JsonFields.number(item, FieldAliases.PREDICTED_COST))
                .realizedCost(JsonFields.number(item, FieldAliases.REALIZED_COST))
                .build();
    }
}
