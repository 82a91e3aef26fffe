package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/** /api/data/anomalies: critical → ERROR, остальное → WARNING */
public class AnomalyRecordMapper extends TelemetryEventMapper {

    public AnomalyRecordMapper() {
        super(EventSource.ANOMALIES);
    }

    @Override
    public TelemetryEvent map(JsonNode item, Context ctx) {
        String type = JsonFields.text(item, FieldAliases.ANOMALY_TYPE, "").toLowerCase(Locale.ROOT);
        String symbol = JsonFields.text(item, FieldAliases.ANOMALY_SYMBOL, "-");

        boolean critical = JsonFields.bool(item, FieldAliases.ANOMALY_CRITICAL).orElse(false)
                || "critical".equalsIgnoreCase(JsonFields.text(item, FieldAliases.SEVERITY, ""));

        return base(item, ctx)
                .title("Feed anomaly: " + symbol)
                .message(symbol + " • " + (type.isEmpty() ? "unknown" : type) + " anomaly")
                .severity(critical ? Severity.ERROR : Severity.WARNING)
                .acknowledged(JsonFields.bool(item, FieldAliases.ANOMALY_ACK).orElse(false))
                .build();
    }
}
