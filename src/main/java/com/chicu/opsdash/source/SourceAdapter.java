package com.chicu.opsdash.source;

import com.chicu.opsdash.common.time.LenientTimestamps;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Адаптер одного логического источника.
 *
 * Пробует пути-кандидаты по порядку, побеждает первый, вернувший разбираемый ответ.
 * Если все кандидаты упали - пустой список. Наружу ничего не бросает.
 */
@Slf4j
public class SourceAdapter<T> {

    private final String name;
    private final List<String> candidatePaths;
    private final SourceFetcher fetcher;
    private final RecordMapper<T> mapper;
    private final LenientTimestamps timestamps;

    public SourceAdapter(String name,
                         List<String> candidatePaths,
                         SourceFetcher fetcher,
                         RecordMapper<T> mapper,
                         LenientTimestamps timestamps) {
        if (candidatePaths == null || candidatePaths.isEmpty()) {
            throw new IllegalArgumentException("source '" + name + "': пустой список путей");
        }
        this.name = name;
        this.candidatePaths = List.copyOf(candidatePaths);
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.timestamps = timestamps;
    }

    public String getName() {
        return name;
    }

    public List<String> getCandidatePaths() {
        return candidatePaths;
    }

    public List<T> fetch() {
        return fetch(Map.of());
    }

    public List<T> fetch(Map<String, String> query) {
        return tryFetch(query).orElseGet(List::of);
    }

    /**
     * Как fetch, но отличает "источник ответил пусто" от "источник недоступен".
     *
     * @return пусто, если не ответил ни один кандидат
     */
    public Optional<List<T>> tryFetch(Map<String, String> query) {
        Optional<PayloadEnvelope> envelope = fetchEnvelope(query);
        if (envelope.isEmpty()) {
            log.warn("⚠ source '{}': все {} кандидата недоступны", name, candidatePaths.size());
            return Optional.empty();
        }
        return Optional.of(mapAll(envelope.get().items(mapper.listKeys().toArray(String[]::new))));
    }

    /** Для источников, которые отдают один объект, а не список */
    public Optional<T> fetchSingle(Map<String, String> query) {
        return fetchEnvelope(query)
                .map(PayloadEnvelope::unwrap)
                .flatMap(body -> mapAll(List.of(body)).stream().findFirst());
    }

    /** Сырой развёрнутый ответ первого живого кандидата (для pass-through snapshot) */
    public Optional<PayloadEnvelope> fetchEnvelope(Map<String, String> query) {
        for (String path : candidatePaths) {
            try {
                Optional<JsonNode> root = fetcher.get(path, query);
                if (root.isPresent()) {
                    log.debug("source '{}' ← {}", name, path);
                    return Optional.of(PayloadEnvelope.of(root.get()));
                }
            } catch (RuntimeException e) {
                log.warn("⚠ source '{}' path {} failed: {}", name, path, e.getMessage());
            }
        }
        return Optional.empty();
    }

    List<T> mapAll(List<JsonNode> items) {
        List<T> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                T rec = mapper.map(items.get(i), new RecordMapper.Context(timestamps, i));
                if (rec != null) {
                    out.add(rec);
                }
            } catch (RuntimeException e) {
                log.warn("⚠ source '{}': запись #{} пропущена: {}", name, i, e.getMessage());
            }
        }
        return out;
    }
}
