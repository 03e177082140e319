package com.vendinghive.config.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class RedisOperator {
    private final RedisTemplate<String, Object> redisTemplate;

    /** 단순 String 값을 TTL과 함께 저장 */
    public void setStringValue(String key, String value, Duration ttl) {
        if (ttl != null) {
            this.redisTemplate.opsForValue().set(key, value, ttl);
        } else {
            this.redisTemplate.opsForValue().set(key, value);
        }
    }

    public String getStringValue(String key) {
        Object v = this.redisTemplate.opsForValue().get(key);
        return v != null ? v.toString() : null;
    }
}
