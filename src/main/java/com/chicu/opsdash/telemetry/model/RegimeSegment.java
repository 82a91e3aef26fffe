package com.chicu.opsdash.telemetry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Отрезок рыночного режима на таймлайне.
 * Хранится в истории режимов, сериализуется в KeyValueStore.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RegimeSegment {

    private String id;
    private String label;
    private Instant start;
    private Instant end;

    /** 0..1, может отсутствовать */
    private Double confidence;

    @Builder.Default
    private List<Marker> events = new ArrayList<>();

    private String color;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Marker {
        private Instant ts;
        private String label;
    }
}
