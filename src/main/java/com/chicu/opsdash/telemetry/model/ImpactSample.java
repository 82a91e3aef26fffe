package com.chicu.opsdash.telemetry.model;

import lombok.Builder;
import lombok.Value;

/** Предсказанная vs реализованная стоимость исполнения по площадке и бакету */
@Value
@Builder
public class ImpactSample {
    String venue;
    String bucketKey;
    String symbol;
    double predictedCost;
    double realizedCost;
}
