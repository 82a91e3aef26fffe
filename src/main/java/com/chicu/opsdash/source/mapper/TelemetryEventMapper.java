package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Map;

/**
 * Общая часть маппинга в TelemetryEvent: id, время, read, event, details.
 */
public abstract class TelemetryEventMapper implements RecordMapper<TelemetryEvent> {

    private static final ObjectMapper DETAILS_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    protected final EventSource source;

    protected TelemetryEventMapper(EventSource source) {
        this.source = source;
    }

    public EventSource getSource() {
        return source;
    }

    protected Instant timestamp(JsonNode item, Context ctx) {
        return JsonFields.firstPresent(item, FieldAliases.TIMESTAMP)
                .map(v -> v.isNumber()
                        ? ctx.timestamps().parse(v.numberValue())
                        : ctx.timestamps().parse(v.asText()))
                .orElseGet(ctx.timestamps()::now);
    }

    /**
     * id источника; если его нет - детерминированный source-epochMs-ordinal,
     * чтобы повторная выборка тех же данных дала те же id.
     */
    protected String id(JsonNode item, Instant ts, Context ctx) {
        return JsonFields.text(item, FieldAliases.ID)
                .orElse(source.tag() + "-" + ts.toEpochMilli() + "-" + ctx.ordinal());
    }

    protected TelemetryEvent.TelemetryEventBuilder base(JsonNode item, Context ctx) {
        Instant ts = timestamp(item, ctx);
        return TelemetryEvent.builder()
                .id(id(item, ts, ctx))
                .timestamp(ts)
                .source(source)
                .read(JsonFields.bool(item, FieldAliases.READ).orElse(false))
                .event(JsonFields.text(item, FieldAliases.EVENT).orElse(null))
                .details(details(item));
    }

    protected Map<String, Object> details(JsonNode item) {
        return JsonFields.firstPresent(item, FieldAliases.DETAILS)
                .filter(JsonNode::isObject)
                .map(d -> DETAILS_MAPPER.convertValue(d, DETAILS_TYPE))
                .orElse(Map.of());
    }
}
