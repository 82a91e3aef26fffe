package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * /api/compliance/logs.
 *
 * В ленту попадают только нарушения: status/severity содержит
 * fail, error или violation → ERROR. Остальные записи журнала пропускаются.
 */
public class ComplianceRecordMapper extends TelemetryEventMapper {

    private static final List<String> VIOLATION_MARKERS = List.of("fail", "error", "violation");

    public ComplianceRecordMapper() {
        super(EventSource.COMPLIANCE);
    }

    public static boolean isViolation(String statusText) {
        if (statusText == null) return false;
        String s = statusText.toLowerCase(Locale.ROOT);
        return VIOLATION_MARKERS.stream().anyMatch(s::contains);
    }

    @Override
    public TelemetryEvent map(JsonNode item, Context ctx) {
        String status = JsonFields.text(item, FieldAliases.COMPLIANCE_STATUS, "");
        if (!isViolation(status)) {
            return null;
        }

        String rule = JsonFields.text(item, FieldAliases.COMPLIANCE_RULE, "Violation");
        String message = JsonFields.text(item, List.of("message"))
                .orElseGet(() -> "Trade " + JsonFields.text(item, FieldAliases.COMPLIANCE_TRADE, "")
                        + " by " + JsonFields.text(item, FieldAliases.COMPLIANCE_USER, ""));

        return base(item, ctx)
                .title("Compliance: " + rule)
                .message(message)
                .severity(Severity.ERROR)
                // серверного read-состояния у журнала нет
                .read(false)
                .build();
    }
}
