package com.chicu.opsdash.aggregate;

import com.chicu.opsdash.telemetry.model.TelemetryEvent;

import java.time.Instant;
import java.util.List;

public record AlertFeedSnapshot(List<TelemetryEvent> items,
                                long unreadCount,
                                Instant refreshedAt) {
}
