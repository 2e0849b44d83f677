package com.phillippitts.peercall.service.store;

import java.util.Optional;

/**
 * Host-provided persistent string store. Holds the missed-call ledger, the last-incoming-peer
 * marker and the attached user id.
 *
 * <p>Implementations must be thread-safe.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
