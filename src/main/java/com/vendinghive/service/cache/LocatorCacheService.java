package com.vendinghive.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.vendinghive.config.LocatorProperties;
import com.vendinghive.config.redis.RedisOperator;
import com.vendinghive.model.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis 캐시 (provider 원본 응답 10분, 우편번호 좌표 7일)
 * Redis 오류는 캐시 miss 로 처리하고 검색은 계속 진행
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocatorCacheService {

    private static final String ZIP_KEY_PREFIX = "locator:zip:";

    private final RedisOperator redisOperator;
    private final ObjectMapper objectMapper;
    private final LocatorProperties properties;

    public Optional<List<JsonNode>> getProviderRecords(String key) {
        String cached = read(key);
        if (cached == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(cached);
            if (!root.isArray()) {
                return Optional.empty();
            }
            List<JsonNode> records = new ArrayList<>();
            root.forEach(records::add);
            return Optional.of(records);
        } catch (JsonProcessingException e) {
            log.warn("[LocatorCacheService] unreadable cache entry {} - ignoring", key);
            return Optional.empty();
        }
    }

    public void putProviderRecords(String key, List<JsonNode> records) {
        ArrayNode array = objectMapper.createArrayNode();
        records.forEach(array::add);
        write(key, array.toString(), properties.getCache().getProviderTtl());
    }

    public Optional<GeoPoint> getZipCenter(String zipCode) {
        String cached = read(ZIP_KEY_PREFIX + zipCode);
        if (cached == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(cached);
            return Optional.of(new GeoPoint(node.path("lat").asDouble(), node.path("lon").asDouble()));
        } catch (JsonProcessingException e) {
            log.warn("[LocatorCacheService] unreadable ZIP cache entry for {} - ignoring", zipCode);
            return Optional.empty();
        }
    }

    public void putZipCenter(String zipCode, GeoPoint center) {
        String value = objectMapper.createObjectNode()
                .put("lat", center.getLatitude())
                .put("lon", center.getLongitude())
                .toString();
        write(ZIP_KEY_PREFIX + zipCode, value, properties.getCache().getGeocodeTtl());
    }

    private String read(String key) {
        if (!properties.getCache().isEnabled()) {
            return null;
        }
        try {
            return redisOperator.getStringValue(key);
        } catch (DataAccessException e) {
            log.warn("[LocatorCacheService] Redis read failed for {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void write(String key, String value, Duration ttl) {
        if (!properties.getCache().isEnabled()) {
            return;
        }
        try {
            redisOperator.setStringValue(key, value, ttl);
        } catch (DataAccessException e) {
            log.warn("[LocatorCacheService] Redis write failed for {}: {}", key, e.getMessage());
        }
    }
}
