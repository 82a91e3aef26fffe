package com.chicu.opsdash.regime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище в одном JSON-файле.
 * Запись: временный файл рядом + атомарная замена.
 */
@Slf4j
public class FileKeyValueStore implements KeyValueStore {

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> values;

    public FileKeyValueStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.values = load();
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> m = objectMapper.readValue(file.toFile(), MAP_TYPE);
            log.info("💾 kv-store: загружено {} ключей из {}", m.size(), file);
            return m;
        } catch (IOException e) {
            log.warn("⚠ kv-store: {} повреждён, начинаю с пустого: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        values.put(key, value);
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (values.remove(key) != null) {
            flush();
        }
    }

    private void flush() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), values);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("kv-store write failed: " + file, e);
        }
    }
}
