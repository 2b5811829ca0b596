package com.socialnetwork.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-user counters cached in Redis.
 *
 * Keys are {@code <region prefix>:<userId>}, values are JSON. Entries expire after
 * their TTL and are evicted by the services that change the underlying rows.
 *
 * Failure Handling:
 * - every Redis call runs behind the "redis" circuit breaker
 * - a failed or short-circuited lookup is a miss, a failed store or eviction is skipped,
 *   so callers always have the database to fall back on
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SocialCacheService {

    public enum Region {
        FOLLOW_COUNTS("follow:counts"),
        UNREAD_NOTIFICATIONS("notifications:unread");

        private final String prefix;

        Region(String prefix) {
            this.prefix = prefix;
        }

        public String key(Long userId) {
            return prefix + ":" + userId;
        }
    }

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "lookupFallback")
    public <T> Optional<T> lookup(Region region, Long userId, Class<T> type) {
        String key = region.key(userId);
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "storeFallback")
    public void store(Region region, Long userId, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} for cache region {}", value.getClass().getSimpleName(), region, e);
            return;
        }
        redisTemplate.opsForValue().set(region.key(userId), json, ttl);
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "evictFallback")
    public void evict(Region region, Long... userIds) {
        List<String> keys = new ArrayList<>(userIds.length);
        for (Long userId : userIds) {
            keys.add(region.key(userId));
        }
        Long removed = redisTemplate.delete(keys);
        log.debug("Evicted {} of {} {} entries", removed, keys.size(), region);
    }

    private <T> Optional<T> lookupFallback(Region region, Long userId, Class<T> type, Exception e) {
        log.warn("Redis unavailable, {} for user {} read from database: {}", region, userId, e.getMessage());
        return Optional.empty();
    }

    private void storeFallback(Region region, Long userId, Object value, Duration ttl, Exception e) {
        log.warn("Redis unavailable, {} for user {} not cached", region, userId);
    }

    private void evictFallback(Region region, Long[] userIds, Exception e) {
        // stale entries expire with their TTL
        log.warn("Redis unavailable, {} eviction skipped for {} user(s)", region, userIds.length);
    }
}
