package com.chicu.opsdash.regime;

import java.util.Optional;

/**
 * Строковое key → value хранилище для небольшого состояния между перезапусками.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * @throws java.io.UncheckedIOException если значение не удалось сохранить
     */
    void put(String key, String value);

    void remove(String key);
}
