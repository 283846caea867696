package com.trendwatch.monitor.lock;

import com.trendwatch.monitor.error.CollaboratorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Cross-instance alert locks: {@code SET key token NX PX ttl}, released only by the token that took it. The TTL
 * bounds how long a crashed holder can block an alert; a live holder renews it before each channel it sends to.
 */
public class RedisAlertLockRegistry implements AlertLockRegistry {

  private static final Logger log = LoggerFactory.getLogger(RedisAlertLockRegistry.class);

  private final StringRedisTemplate redis;
  private final String keyPrefix;
  private final Duration ttl;

  public RedisAlertLockRegistry(StringRedisTemplate redis, String keyPrefix, Duration ttl) {
    this.redis = redis;
    this.keyPrefix = keyPrefix;
    this.ttl = ttl;
  }

  @Override
  public Optional<AlertLock> tryAcquire(String alertId) {
    String key = keyPrefix + alertId;
    String token = UUID.randomUUID().toString();
    Boolean acquired;
    try {
      acquired = redis.opsForValue().setIfAbsent(key, token, ttl);
    } catch (DataAccessException e) {
      throw new CollaboratorUnavailableException("Failed to acquire Redis lock " + key, e);
    }
    if (!Boolean.TRUE.equals(acquired)) return Optional.empty();
    return Optional.of(new Held(alertId, key, token));
  }

  private final class Held implements AlertLock {
    private final String alertId;
    private final String key;
    private final String token;

    private Held(String alertId, String key, String token) {
      this.alertId = alertId;
      this.key = key;
      this.token = token;
    }

    @Override
    public String alertId() { return alertId; }

    @Override
    public boolean renew() {
      try {
        String cur = redis.opsForValue().get(key);
        if (!token.equals(cur)) {
          log.warn("Redis lock {} expired or was taken over", key);
          return false;
        }
        return Boolean.TRUE.equals(redis.expire(key, ttl));
      } catch (DataAccessException e) {
        log.warn("Failed to renew Redis lock {}: {}", key, e.getMessage());
        return false;
      }
    }

    @Override
    public void close() {
      try {
        String cur = redis.opsForValue().get(key);
        if (token.equals(cur)) redis.delete(key);
      } catch (DataAccessException e) {
        // the TTL releases it eventually
        log.warn("Failed to release Redis lock {}: {}", key, e.getMessage());
      }
    }
  }
}
