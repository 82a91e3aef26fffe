package com.chicu.opsdash.source;

import com.chicu.opsdash.common.time.LenientTimestamps;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Отображение одной сырой записи источника в каноническую форму.
 *
 * @param <T> каноническая запись
 */
public interface RecordMapper<T> {

    /**
     * @return запись или null, если запись не должна попасть в результат
     */
    T map(JsonNode item, Context ctx);

    /** Поля, в которых источник может держать массив записей внутри data */
    default List<String> listKeys() {
        return List.of("items");
    }

    /**
     * Контекст одной выборки: разбор времени и порядковый номер записи
     * (для синтетических id).
     */
    record Context(LenientTimestamps timestamps, int ordinal) {
    }
}
