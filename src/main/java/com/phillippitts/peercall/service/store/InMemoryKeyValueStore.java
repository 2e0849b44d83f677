package com.phillippitts.peercall.service.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent store. Default for {@code store.type=MEMORY} and for tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }
}
