package com.chicu.opsdash.telemetry.model;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.common.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 🔔 ЕДИНЫЙ КОНТРАКТ СОБЫТИЯ ДЛЯ ЛЕНТЫ
 * alerts / notifications / compliance / audit / anomalies → одна форма.
 *
 * Мутируется только действиями read / acknowledge.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryEvent {

    /** id источника или синтетический source-epochMs-ordinal */
    private String id;

    /** всегда валидный: битая метка → время приёма */
    private Instant timestamp;

    private String title;
    private String message;

    @Builder.Default
    private Severity severity = Severity.INFO;

    private boolean read;

    /** имеет смысл только для anomalies */
    private boolean acknowledged;

    private EventSource source;

    /** тип события у источника, например live_metrics_breach */
    private String event;

    @Builder.Default
    private Map<String, Object> details = Map.of();

    /**
     * Ключ в общей ленте. id уникален только внутри своего источника:
     * notification 1 и anomaly 1 - разные события.
     */
    public String getKey() {
        return source != null ? source.tag() + ":" + id : id;
    }

    public TelemetryEvent copy() {
        return toBuilder().build();
    }
}
