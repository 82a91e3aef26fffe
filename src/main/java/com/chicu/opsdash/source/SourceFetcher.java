package com.chicu.opsdash.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * Один GET к апстриму.
 *
 * Контракт: не бросает. Сеть, не-2xx, пустое тело, битый JSON → Optional.empty().
 */
public interface SourceFetcher {

    Optional<JsonNode> get(String path, Map<String, String> query);

    default Optional<JsonNode> get(String path) {
        return get(path, Map.of());
    }
}
