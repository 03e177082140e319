package com.vendinghive.service.geocode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.config.LocatorProperties;
import com.vendinghive.exception.GeocodingUnavailableException;
import com.vendinghive.model.GeoPoint;
import com.vendinghive.service.cache.LocatorCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * OpenStreetMap Nominatim 으로 미국 우편번호 지오코딩 (결과는 Redis 캐시)
 */
@Slf4j
@Service
public class NominatimGeocoder implements ZipCodeGeocoder {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LocatorCacheService cacheService;
    private final String searchUrl;

    public NominatimGeocoder(RestTemplate restTemplate, ObjectMapper objectMapper,
                             LocatorCacheService cacheService, LocatorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.cacheService = cacheService;
        this.searchUrl = properties.getProviders().getNominatimUrl() + "/search";
    }

    @Override
    public Optional<GeoPoint> locate(String zipCode) {
        // 12345-6789 는 앞 5자리로 조회
        String zip5 = zipCode.length() > 5 ? zipCode.substring(0, 5) : zipCode;

        Optional<GeoPoint> cached = cacheService.getZipCenter(zip5);
        if (cached.isPresent()) {
            return cached;
        }

        String uri = UriComponentsBuilder.fromHttpUrl(searchUrl)
                .queryParam("q", zip5)
                .queryParam("countrycodes", "us")
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .toUriString();

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            body = response.getBody();
        } catch (RestClientException e) {
            log.error("[NominatimGeocoder] geocoding failed for {}: {}", zip5, e.getMessage());
            throw new GeocodingUnavailableException("ZIP code geocoding service is unavailable", e);
        }

        Optional<GeoPoint> center = parse(body);
        if (center.isPresent()) {
            cacheService.putZipCenter(zip5, center.get());
        } else {
            log.info("[NominatimGeocoder] no match for ZIP {}", zip5);
        }
        return center;
    }

    private Optional<GeoPoint> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isArray() || root.isEmpty()) {
                return Optional.empty();
            }
            JsonNode first = root.get(0);
            // Nominatim 은 좌표를 문자열로 내려줌
            double lat = Double.parseDouble(first.path("lat").asText());
            double lon = Double.parseDouble(first.path("lon").asText());
            return Optional.of(new GeoPoint(lat, lon));
        } catch (JsonProcessingException | NumberFormatException e) {
            log.warn("[NominatimGeocoder] unreadable geocoding response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
