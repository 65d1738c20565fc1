package com.yoursp.botdetection.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link KeyValueStore}.
 * <ul>
 * <li>Liveness is a {@code PING} round-trip</li>
 * <li>TTLs are applied in whole seconds ({@code EX})</li>
 * <li>{@link DataAccessException} is rethrown as {@link StoreUnavailableException}</li>
 * </ul>
 * Connection settings come from {@code spring.data.redis.*}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "botdetection", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisKeyValueStore implements KeyValueStore {

    private static final long KEY_MISSING = -2L;
    private static final long KEY_PERSISTENT = -1L;

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Redis liveness probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET", () -> {
            redisTemplate.opsForValue().set(key, value, ttl.toSeconds(), TimeUnit.SECONDS);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("SET NX", () -> Boolean.TRUE.equals(
                redisTemplate.opsForValue().setIfAbsent(key, value, ttl.toSeconds(), TimeUnit.SECONDS)));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return call("TTL", () -> {
            Long seconds = redisTemplate.getExpire(key, TimeUnit.SECONDS);
            if (seconds == null || seconds == KEY_MISSING || seconds == KEY_PERSISTENT) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofSeconds(seconds));
        });
    }

    private <T> T call(String command, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + command + " failed", e);
        }
    }
}
