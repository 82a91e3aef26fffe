package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.RegimeSegment;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Текущий режим рынка → RegimeSegment, end = сейчас.
 * Ответ - один объект, а не массив.
 */
public class RegimeRecordMapper implements RecordMapper<RegimeSegment> {

    @Override
    public RegimeSegment map(JsonNode item, Context ctx) {
        if (item == null || !item.isObject()) {
            return null;
        }
        Instant now = ctx.timestamps().now();

        String label = JsonFields.text(item, FieldAliases.REGIME_LABEL, "Regime");
        Instant start = JsonFields.text(item, FieldAliases.REGIME_START)
                .map(ctx.timestamps()::parse)
                .orElse(now);

        List<RegimeSegment.Marker> markers = new ArrayList<>();
        JsonNode events = item.get("events");
        if (events != null && events.isArray()) {
            for (JsonNode e : events) {
                Instant ts = JsonFields.text(e, FieldAliases.MARKER_TS)
                        .map(ctx.timestamps()::parse)
                        .orElse(now);
                markers.add(new RegimeSegment.Marker(ts, JsonFields.text(e, FieldAliases.MARKER_LABEL, "event")));
            }
        }

        return RegimeSegment.builder()
                .id(JsonFields.text(item, FieldAliases.ID).orElse(label))
                .label(label)
                .start(start)
                .end(now)
                .confidence(JsonFields.optionalNumber(item, FieldAliases.REGIME_CONFIDENCE))
                .events(markers)
                .color(JsonFields.text(item, List.of("color")).orElse(null))
                .build();
    }
}
