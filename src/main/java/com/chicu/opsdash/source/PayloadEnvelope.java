package com.chicu.opsdash.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Ответ апстрима в одной из двух форм:
 *  - WRAPPED: {status, data: ...}
 *  - BARE:    объект или массив как есть
 *
 * Разворачивается один раз здесь, а не через "data || body" в каждом месте вызова.
 */
public final class PayloadEnvelope {

    public enum Kind { WRAPPED, BARE }

    private final Kind kind;
    private final String status;
    private final JsonNode body;

    private PayloadEnvelope(Kind kind, String status, JsonNode body) {
        this.kind = kind;
        this.status = status;
        this.body = body;
    }

    public static PayloadEnvelope of(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new PayloadEnvelope(Kind.BARE, null, MissingNode.getInstance());
        }
        if (root.isObject() && root.has("data") && !root.get("data").isNull()) {
            String status = root.hasNonNull("status") ? root.get("status").asText() : null;
            return new PayloadEnvelope(Kind.WRAPPED, status, root.get("data"));
        }
        return new PayloadEnvelope(Kind.BARE, null, root);
    }

    public Kind getKind() {
        return kind;
    }

    /** status из обёртки, для BARE - null */
    public String getStatus() {
        return status;
    }

    public JsonNode unwrap() {
        return body;
    }

    /**
     * Массив записей: либо сам body, либо первое из listKeys, оказавшееся массивом.
     * Ничего не нашли → пустой список.
     */
    public List<JsonNode> items(String... listKeys) {
        JsonNode arr = null;
        if (body.isArray()) {
            arr = body;
        } else if (body.isObject()) {
            for (String key : listKeys) {
                JsonNode candidate = body.get(key);
                if (candidate != null && candidate.isArray()) {
                    arr = candidate;
                    break;
                }
            }
        }
        if (arr == null) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(arr.size());
        arr.forEach(out::add);
        return out;
    }
}
