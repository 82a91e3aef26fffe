package com.chicu.opsdash.live;

import com.chicu.opsdash.common.time.LenientTimestamps;
import com.chicu.opsdash.source.PayloadEnvelope;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Разбор SSE-событий потока алертов.
 *  - init  → JSON-массив (или обёртка с массивом)
 *  - alert → один JSON-объект
 * Остальные имена событий игнорируются. Битый JSON → пустой список.
 */
@Slf4j
public class LiveEventDecoder {

    public static final String INIT = "init";
    public static final String ALERT = "alert";

    private final ObjectMapper objectMapper;
    private final RecordMapper<TelemetryEvent> mapper;
    private final LenientTimestamps timestamps;

    public LiveEventDecoder(ObjectMapper objectMapper,
                            RecordMapper<TelemetryEvent> mapper,
                            LenientTimestamps timestamps) {
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.timestamps = timestamps;
    }

    public boolean isKnown(String eventName) {
        return INIT.equals(eventName) || ALERT.equals(eventName);
    }

    public List<TelemetryEvent> decode(String eventName, String data) {
        if (!isKnown(eventName) || data == null || data.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.warn("⚠ live '{}': битый JSON пропущен: {}", eventName, e.getOriginalMessage());
            return List.of();
        }

        List<JsonNode> items;
        if (INIT.equals(eventName)) {
            items = PayloadEnvelope.of(root).items(mapper.listKeys().toArray(String[]::new));
        } else {
            JsonNode body = PayloadEnvelope.of(root).unwrap();
            items = body.isObject() ? List.of(body) : List.of();
        }

        List<TelemetryEvent> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                TelemetryEvent ev = mapper.map(items.get(i), new RecordMapper.Context(timestamps, i));
                if (ev != null) {
                    out.add(ev);
                }
            } catch (RuntimeException e) {
                log.warn("⚠ live '{}': запись #{} пропущена: {}", eventName, i, e.getMessage());
            }
        }
        return out;
    }
}
