package com.faasrt.storage;

import com.faasrt.exception.StoreAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link RuntimeStore} over plain Redis string values.
 */
@Slf4j
public class RedisRuntimeStore implements RuntimeStore {

    private final StringRedisTemplate redis;

    public RedisRuntimeStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    /**
     * Opens a connection and pings. An unreachable server is not fatal here:
     * the loop keeps polling and logs every failed read.
     */
    @Override
    public void connect() {
        try (RedisConnection connection = redis.getRequiredConnectionFactory().getConnection()) {
            log.info("Connected to Redis ({})", connection.ping());
        } catch (RuntimeException e) {
            log.warn("Redis is not reachable yet: {}", e.getMessage());
        }
    }

    @Override
    public String get(String key) {
        try {
            return redis.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new StoreAccessException("GET " + key + " failed", e);
        }
    }

    @Override
    public void set(String key, String value) {
        try {
            redis.opsForValue().set(key, value);
        } catch (DataAccessException e) {
            throw new StoreAccessException("SET " + key + " failed", e);
        }
    }
}
