package com.vendinghive.service.provider.google;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.config.LocatorProperties;
import com.vendinghive.exception.ProviderUnavailableException;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;
import com.vendinghive.service.provider.LocationProvider;
import com.vendinghive.service.provider.ProviderQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Google Places API 클라이언트 래퍼
 * Nearby Search 로 place_id 를 모은 뒤 Place Details 로 연락처/영업 상태 보강
 */
@Slf4j
@Service
public class GooglePlacesClient implements LocationProvider {

    /** Nearby Search 가 허용하는 최대 반경 (미터) */
    static final int MAX_RADIUS_METERS = 50_000;

    private static final String DETAIL_FIELDS = "place_id,name,formatted_address,formatted_phone_number,"
            + "international_phone_number,website,rating,user_ratings_total,business_status,"
            + "opening_hours,geometry,types,url";

    @Value("${google.places.api.key:}")
    private String apiKey;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String nearbySearchUrl;
    private final String placeDetailsUrl;
    private final int maxDetailLookups;

    public GooglePlacesClient(RestTemplate restTemplate, ObjectMapper objectMapper, LocatorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.nearbySearchUrl = properties.getProviders().getGooglePlacesUrl() + "/nearbysearch/json";
        this.placeDetailsUrl = properties.getProviders().getGooglePlacesUrl() + "/details/json";
        this.maxDetailLookups = properties.getProviders().getGoogleMaxDetailLookups();
    }

    @Override
    public ProviderSource source() {
        return ProviderSource.GOOGLE_PLACES;
    }

    @Override
    public List<JsonNode> fetch(ProviderQuery query) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[GooglePlacesClient] Google Places API key is not set (GOOGLE_PLACES_API_KEY)");
            throw new ProviderUnavailableException(source(), "Google Places API key is not configured");
        }

        Set<String> types = new LinkedHashSet<>();
        for (PlaceCategory category : query.getCategories()) {
            if (category.hasGoogleType()) {
                types.add(category.getGoogleType());
            }
        }
        if (types.isEmpty()) {
            return new ArrayList<>();
        }

        int radius = Math.min(query.getRadiusMeters(), MAX_RADIUS_METERS);
        Map<String, JsonNode> nearbyByPlaceId = new LinkedHashMap<>();
        for (String type : types) {
            checkInterrupted();
            for (JsonNode result : searchNearby(query.getCenter().getLatitude(), query.getCenter().getLongitude(), radius, type)) {
                String placeId = result.path("place_id").asText(null);
                if (placeId != null) {
                    nearbyByPlaceId.putIfAbsent(placeId, result);
                }
            }
        }

        List<JsonNode> places = new ArrayList<>();
        int detailLookups = 0;
        for (Map.Entry<String, JsonNode> entry : nearbyByPlaceId.entrySet()) {
            JsonNode details = null;
            if (detailLookups < maxDetailLookups) {
                checkInterrupted();
                details = getPlaceDetails(entry.getKey());
                detailLookups++;
            }
            // 상세 조회 실패/한도 초과 시 Nearby 결과 그대로 사용 (연락처 없음)
            places.add(details != null ? details : entry.getValue());
        }

        log.info("[GooglePlacesClient] {} places for types {} within {}m ({} detail lookups)",
                places.size(), types, radius, detailLookups);
        return places;
    }

    /**
     * Nearby Search 1페이지 결과
     */
    List<JsonNode> searchNearby(double latitude, double longitude, int radius, String type) {
        String uri = UriComponentsBuilder.fromHttpUrl(nearbySearchUrl)
                .queryParam("location", latitude + "," + longitude)
                .queryParam("radius", radius)
                .queryParam("type", type)
                .queryParam("key", apiKey)
                .toUriString();

        JsonNode root = call(uri, "Nearby Search");
        String status = root.path("status").asText("UNKNOWN_ERROR");
        if ("ZERO_RESULTS".equals(status)) {
            return new ArrayList<>();
        }
        if (!"OK".equals(status)) {
            String message = root.path("error_message").asText("");
            throw new ProviderUnavailableException(source(),
                    "Google Places returned " + status + (message.isEmpty() ? "" : ": " + message));
        }

        List<JsonNode> results = new ArrayList<>();
        root.path("results").forEach(results::add);
        return results;
    }

    /**
     * Place Details 조회. 실패하면 null (검색 전체를 실패시키지 않음)
     */
    JsonNode getPlaceDetails(String placeId) {
        String uri = UriComponentsBuilder.fromHttpUrl(placeDetailsUrl)
                .queryParam("place_id", placeId)
                .queryParam("fields", DETAIL_FIELDS)
                .queryParam("key", apiKey)
                .toUriString();
        try {
            JsonNode root = call(uri, "Place Details");
            if ("OK".equals(root.path("status").asText()) && root.path("result").isObject()) {
                return root.get("result");
            }
            log.debug("[GooglePlacesClient] Place Details status {} for {}", root.path("status").asText(), placeId);
        } catch (ProviderUnavailableException e) {
            log.debug("[GooglePlacesClient] Place Details failed for {}: {}", placeId, e.getMessage());
        }
        return null;
    }

    private JsonNode call(String uri, String operation) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (HttpStatusCodeException e) {
            throw new ProviderUnavailableException(source(),
                    "HTTP " + e.getStatusCode().value() + " from Google " + operation, e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(source(), "Google " + operation + " unreachable: " + e.getMessage(), e);
        }
        try {
            return objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(source(), "Unreadable Google " + operation + " response", e);
        }
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProviderUnavailableException(source(), "cancelled");
        }
    }
}
