package com.chicu.opsdash.live;

import com.chicu.opsdash.common.enums.ChannelMode;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;

import java.time.Instant;
import java.util.List;

/**
 * Неизменяемый снимок канала для REST и STOMP.
 */
public record LiveChannelState(String feed,
                               ChannelMode mode,
                               Instant cursor,
                               List<TelemetryEvent> events,
                               int fallbacks) {

    public boolean isLive() {
        return mode != null && mode.isLive();
    }
}
