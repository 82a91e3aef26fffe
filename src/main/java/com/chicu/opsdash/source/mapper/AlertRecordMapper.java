package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** /api/alerts и поток /events/alerts */
public class AlertRecordMapper extends TelemetryEventMapper {

    public AlertRecordMapper() {
        super(EventSource.ALERTS);
    }

    @Override
    public List<String> listKeys() {
        return List.of("items", "alerts", "events");
    }

    @Override
    public TelemetryEvent map(JsonNode item, Context ctx) {
        String message = JsonFields.text(item, FieldAliases.ALERT_MESSAGE)
                .orElseGet(() -> detailsMessage(item));

        return base(item, ctx)
                .title(JsonFields.text(item, FieldAliases.ALERT_TITLE, "Alert"))
                .message(message)
                .severity(Severity.from(JsonFields.text(item, FieldAliases.SEVERITY, null)))
                .build();
    }

    private static String detailsMessage(JsonNode item) {
        JsonNode details = item.get("details");
        return JsonFields.text(details, List.of("message"), "");
    }
}
