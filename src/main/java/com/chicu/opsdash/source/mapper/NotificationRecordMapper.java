package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** /api/notifications - список лежит в data.notifications или data.items */
public class NotificationRecordMapper extends TelemetryEventMapper {

    public NotificationRecordMapper() {
        super(EventSource.NOTIFICATIONS);
    }

    @Override
    public List<String> listKeys() {
        return List.of("notifications", "items");
    }

    @Override
    public TelemetryEvent map(JsonNode item, Context ctx) {
        return base(item, ctx)
                .title(JsonFields.text(item, FieldAliases.NOTIFICATION_TITLE, "Notification"))
                .message(JsonFields.text(item, FieldAliases.NOTIFICATION_MESSAGE, ""))
                .severity(Severity.from(JsonFields.text(item, FieldAliases.SEVERITY, null)))
                .build();
    }
}
