package com.yoursp.botdetection.service.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for the shared key-value store holding bot-detection state.
 * Implementations can target Redis or an in-process map.
 * <p>
 * Every operation except {@link #isAvailable()} may throw
 * {@link StoreUnavailableException} when the backing store cannot be reached.
 * </p>
 */
public interface KeyValueStore {

    /**
     * Liveness probe. Distinguishes "store unreachable" from "key absent".
     *
     * @return {@code true} if the store answered
     */
    boolean isAvailable();

    /**
     * @param key the key to read
     * @return the stored value, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Unconditionally store a value, replacing any previous value and TTL.
     *
     * @param key   the key to write
     * @param value the value
     * @param ttl   time-to-live; must be positive
     */
    void set(String key, String value, Duration ttl);

    /**
     * Store a value only if the key does not exist ({@code SET NX EX}).
     *
     * @return {@code true} if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * @param key the key to inspect
     * @return remaining time-to-live, or empty if the key is absent
     */
    Optional<Duration> ttl(String key);
}
