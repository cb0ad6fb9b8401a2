package com.flagship.invoice_ledger.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store. Keys are namespaced with a fixed prefix so the service
 * can share a database with other tenants.
 */
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private static final String KEY_PREFIX = "invoice-ledger:";

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + key));
        } catch (DataAccessException e) {
            throw new KeyValueStoreException("Redis read failed for key " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ttl == null) {
                redisTemplate.opsForValue().set(KEY_PREFIX + key, value);
            } else {
                redisTemplate.opsForValue().set(KEY_PREFIX + key, value, ttl);
            }
        } catch (DataAccessException e) {
            throw new KeyValueStoreException("Redis write failed for key " + key, e);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            Boolean written = ttl == null
                ? redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + key, value)
                : redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + key, value, ttl);
            return Boolean.TRUE.equals(written);
        } catch (DataAccessException e) {
            throw new KeyValueStoreException("Redis conditional write failed for key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(KEY_PREFIX + key);
        } catch (DataAccessException e) {
            throw new KeyValueStoreException("Redis delete failed for key " + key, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return false;
            }
            try (var connection = connectionFactory.getConnection()) {
                return "PONG".equals(connection.ping());
            }
        } catch (Exception e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
