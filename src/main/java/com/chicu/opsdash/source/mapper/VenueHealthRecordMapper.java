package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.VenueHealth;
import com.fasterxml.jackson.databind.JsonNode;

/** /api/venue/health */
public class VenueHealthRecordMapper implements RecordMapper<VenueHealth> {

    @Override
    public VenueHealth map(JsonNode item, Context ctx) {
        return VenueHealth.builder()
                .venue(ExecutionKeys.venue(item))
                .latencyMs(JsonFields.number(item, FieldAliases.VENUE_LATENCY))
                .spreadBps(JsonFields.number(item, FieldAliases.VENUE_SPREAD))
                .depthUsd(JsonFields.number(item, FieldAliases.DEPTH_USD))
                .build();
    }
}
