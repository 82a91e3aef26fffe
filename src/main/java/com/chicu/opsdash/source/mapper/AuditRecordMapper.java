package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;

/** /api/system/audit: success=false → WARNING, иначе INFO */
public class AuditRecordMapper extends TelemetryEventMapper {

    public AuditRecordMapper() {
        super(EventSource.AUDIT);
    }

    @Override
    public TelemetryEvent map(JsonNode item, Context ctx) {
        boolean failed = JsonFields.bool(item, FieldAliases.AUDIT_SUCCESS)
                .map(ok -> !ok)
                .orElse(false);

        String action = JsonFields.text(item, FieldAliases.AUDIT_ACTION, "unknown");
        String message = JsonFields.text(item, FieldAliases.AUDIT_DETAILS)
                .orElseGet(() -> "Actor " + JsonFields.text(item, FieldAliases.AUDIT_ACTOR, "-"));

        return base(item, ctx)
                .title("Audit: " + action)
                .message(message)
                .severity(failed ? Severity.WARNING : Severity.INFO)
                .read(false)
                .build();
    }
}
