package com.flagship.split_escrow.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for deliveries that were already settled.
 *
 * The database remains the source of truth: a cache miss or a Redis outage
 * only means the reconciler does the full check.
 */
@Component
@Slf4j
public class WebhookDeliveryCache {

    private static final String KEY_PREFIX = "webhook:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public WebhookDeliveryCache(Optional<StringRedisTemplate> redisTemplate,
                                @Value("${webhook.dedup-cache.enabled:true}") boolean enabled,
                                @Value("${webhook.dedup-cache.ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public boolean isKnown(String provider, String deliveryKey) {
        if (!enabled || redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(key(provider, deliveryKey)));
        } catch (Exception e) {
            log.warn("Redis lookup failed for webhook {}:{}. Falling back to database. Error: {}",
                    provider, deliveryKey, e.getMessage());
            return false;
        }
    }

    public void remember(String provider, String deliveryKey) {
        if (!enabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(key(provider, deliveryKey), "1", ttl);
        } catch (Exception e) {
            log.debug("Failed to cache webhook delivery in Redis: {}", e.getMessage());
        }
    }

    private static String key(String provider, String deliveryKey) {
        return KEY_PREFIX + provider + ":" + deliveryKey;
    }
}
