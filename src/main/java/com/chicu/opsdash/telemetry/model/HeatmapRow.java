package com.chicu.opsdash.telemetry.model;

import java.util.Map;

/** Строка heatmap: площадка → (бакет → ячейка), бакеты по возрастанию */
public record HeatmapRow(String venue, Map<String, MergedCell> byBucket) {
}
