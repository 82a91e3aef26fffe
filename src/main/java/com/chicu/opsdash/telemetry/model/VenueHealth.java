package com.chicu.opsdash.telemetry.model;

import lombok.Builder;
import lombok.Value;

/** Состояние площадки: задержка, спред, глубина */
@Value
@Builder
public class VenueHealth {
    String venue;
    double latencyMs;
    double spreadBps;
    double depthUsd;
}
