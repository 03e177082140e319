package com.vendinghive.service.provider.osm;

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
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * OpenStreetMap Overpass API 클라이언트
 * 카테고리 태그마다 node/way 를 반경(around) 검색하고 way 는 center 좌표로 받음
 */
@Slf4j
@Service
public class OverpassClient implements LocationProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String overpassUrl;
    private final int queryTimeoutSeconds;

    public OverpassClient(RestTemplate restTemplate, ObjectMapper objectMapper, LocatorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.overpassUrl = properties.getProviders().getOverpassUrl();
        this.queryTimeoutSeconds = queryTimeout(properties.getProviders());
    }

    /**
     * 서버 측 제한이 provider 타임아웃보다 먼저 걸리도록 최대 (provider 타임아웃 - 1)초로 제한
     */
    static int queryTimeout(LocatorProperties.Providers providers) {
        long ceiling = Math.max(1, providers.getTimeout().toSeconds() - 1);
        return (int) Math.min(providers.getOverpassQueryTimeout(), ceiling);
    }

    @Override
    public ProviderSource source() {
        return ProviderSource.OPENSTREETMAP;
    }

    @Override
    public List<JsonNode> fetch(ProviderQuery query) {
        if (query.getCategories().isEmpty()) {
            return new ArrayList<>();
        }
        String overpassQuery = buildQuery(query);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("data", overpassQuery);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(overpassUrl, new HttpEntity<>(form, headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw new ProviderUnavailableException(source(), "HTTP " + e.getStatusCode().value() + " from Overpass API", e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(source(), "Overpass API unreachable: " + e.getMessage(), e);
        }

        List<JsonNode> elements = new ArrayList<>();
        try {
            JsonNode root = objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
            JsonNode array = root.path("elements");
            if (array.isArray()) {
                array.forEach(elements::add);
            }
            if (root.hasNonNull("remark")) {
                // 쿼리 타임아웃 등은 200 + remark 로 옴
                log.warn("[OverpassClient] remark: {}", root.get("remark").asText());
            }
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(source(), "Unreadable Overpass response", e);
        }

        log.info("[OverpassClient] {} elements for {} categories within {}m",
                elements.size(), query.getCategories().size(), query.getRadiusMeters());
        return elements;
    }

    String buildQuery(ProviderQuery query) {
        String around = String.format(Locale.ROOT, "(around:%d,%.6f,%.6f);",
                query.getRadiusMeters(), query.getCenter().getLatitude(), query.getCenter().getLongitude());

        StringBuilder builder = new StringBuilder();
        builder.append("[out:json][timeout:").append(queryTimeoutSeconds).append("];\n(\n");
        for (PlaceCategory category : query.getCategories()) {
            String filter = "[\"" + category.getOsmKey() + "\"=\"" + category.getOsmValue() + "\"]";
            builder.append("  node").append(filter).append(around).append('\n');
            builder.append("  way").append(filter).append(around).append('\n');
        }
        builder.append(");\nout center meta;");
        return builder.toString();
    }
}
