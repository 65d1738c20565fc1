package com.yoursp.botdetection.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process implementation of {@link KeyValueStore} for local development
 * and tests. Active when {@code botdetection.store=memory}.
 * <p>
 * Expiry is evaluated lazily against the injected {@link Clock}. An outage can
 * be simulated with {@link #setAvailable(boolean)}.
 * </p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "botdetection", name = "store", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        log.info("InMemoryKeyValueStore initialized (state is local to this process)");
    }

    public void setAvailable(boolean available) {
        this.available.set(available);
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public Optional<String> get(String key) {
        checkAvailable();
        return live(key).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        checkAvailable();
        entries.put(key, new Entry(value, expiresAt(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        checkAvailable();
        Entry created = new Entry(value, expiresAt(ttl));
        Instant now = clock.instant();
        Entry result = entries.compute(key,
                (k, existing) -> existing == null || existing.isExpired(now) ? created : existing);
        return result == created;
    }

    @Override
    public Optional<Duration> ttl(String key) {
        checkAvailable();
        Instant now = clock.instant();
        return live(key).map(entry -> Duration.between(now, entry.expiresAt()));
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private Instant expiresAt(Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        return clock.instant().plus(ttl);
    }

    private void checkAvailable() {
        if (!available.get()) {
            throw new StoreUnavailableException("In-memory store is marked unavailable", null);
        }
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
