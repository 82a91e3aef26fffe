package com.chicu.opsdash.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Единый поиск "первого присутствующего" поля по таблице FieldAliases
 * и приведение типов. Ничего не бросает.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Первое поле из candidates, которое есть и не null.
     * Пустая строка считается отсутствием значения.
     */
    public static Optional<JsonNode> firstPresent(JsonNode node, List<String> candidates) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String key : candidates) {
            JsonNode v = node.get(key);
            if (v == null || v.isNull() || v.isMissingNode()) continue;
            if (v.isTextual() && v.asText().isBlank()) continue;
            return Optional.of(v);
        }
        return Optional.empty();
    }

    public static Optional<String> text(JsonNode node, List<String> candidates) {
        return firstPresent(node, candidates)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    public static String text(JsonNode node, List<String> candidates, String fallback) {
        return text(node, candidates).orElse(fallback);
    }

    /**
     * Число для полей, критичных для отображения:
     * отсутствие, мусор, NaN, Infinity → 0.
     */
    public static double number(JsonNode node, List<String> candidates) {
        Double d = optionalNumber(node, candidates);
        return d != null ? d : 0.0;
    }

    /** Опциональное число: отсутствие или нечисловое значение → null */
    public static Double optionalNumber(JsonNode node, List<String> candidates) {
        Optional<JsonNode> v = firstPresent(node, candidates);
        if (v.isEmpty()) return null;
        double d = toDouble(v.get());
        return Double.isFinite(d) ? d : null;
    }

    /**
     * true/false; строки "true"/"1"/"yes" → true.
     * Пусто → Optional.empty(), чтобы отличать false от отсутствия.
     */
    public static Optional<Boolean> bool(JsonNode node, List<String> candidates) {
        return firstPresent(node, candidates).map(v -> {
            if (v.isBoolean()) return v.booleanValue();
            if (v.isNumber()) return v.doubleValue() != 0.0;
            String s = v.asText().trim().toLowerCase();
            return s.equals("true") || s.equals("1") || s.equals("yes");
        });
    }

    private static double toDouble(JsonNode v) {
        if (v.isNumber()) {
            return v.doubleValue();
        }
        if (v.isBoolean()) {
            return v.booleanValue() ? 1.0 : 0.0;
        }
        if (v.isTextual()) {
            try {
                return Double.parseDouble(v.asText().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
