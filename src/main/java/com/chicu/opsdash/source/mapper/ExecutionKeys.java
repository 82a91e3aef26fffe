package com.chicu.opsdash.source.mapper;

import com.chicu.opsdash.source.FieldAliases;
import com.chicu.opsdash.source.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

/** Ключ склейки (venue, bucket) для обоих execution-источников */
final class ExecutionKeys {

    static final String UNKNOWN_VENUE = "Unknown";
    static final String DEFAULT_BUCKET = "0";

    private ExecutionKeys() {
    }

    static String venue(JsonNode item) {
        return JsonFields.text(item, FieldAliases.VENUE, UNKNOWN_VENUE);
    }

    static String bucket(JsonNode item) {
        return JsonFields.text(item, FieldAliases.BUCKET, DEFAULT_BUCKET);
    }

    /** null, если символа нет */
    static String symbol(JsonNode item) {
        return JsonFields.text(item, FieldAliases.SYMBOL).orElse(null);
    }
}
