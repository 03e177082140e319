package com.vendinghive.service.provider.osm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.config.LocatorProperties;
import com.vendinghive.exception.ProviderUnavailableException;
import com.vendinghive.model.GeoPoint;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.service.provider.ProviderQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OverpassClientTest {

    private static final String OVERPASS_URL = "https://overpass.test/api/interpreter";

    private MockRestServiceServer server;
    private OverpassClient client;

    private final ProviderQuery query = new ProviderQuery(new GeoPoint(40.7128, -74.006), 8046,
            EnumSet.of(PlaceCategory.RESTAURANT, PlaceCategory.OFFICE));

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        LocatorProperties properties = new LocatorProperties();
        properties.getProviders().setOverpassUrl(OVERPASS_URL);
        client = new OverpassClient(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("카테고리마다 node/way 를 반경 검색하는 쿼리 생성")
    void buildsQuery() {
        String overpassQuery = client.buildQuery(query);

        assertThat(overpassQuery).startsWith("[out:json][timeout:15];");
        assertThat(overpassQuery).contains("node[\"amenity\"=\"restaurant\"](around:8046,40.712800,-74.006000);");
        assertThat(overpassQuery).contains("way[\"building\"=\"office\"](around:8046,40.712800,-74.006000);");
        assertThat(overpassQuery).endsWith("out center meta;");
    }

    @Test
    @DisplayName("쿼리 timeout 은 provider 타임아웃보다 짧게 제한")
    void queryTimeoutStaysBelowProviderTimeout() {
        LocatorProperties properties = new LocatorProperties();
        properties.getProviders().setOverpassQueryTimeout(25);
        properties.getProviders().setTimeout(Duration.ofSeconds(20));

        OverpassClient clamped = new OverpassClient(new RestTemplate(), new ObjectMapper(), properties);

        assertThat(OverpassClient.queryTimeout(properties.getProviders())).isEqualTo(19);
        assertThat(clamped.buildQuery(query)).startsWith("[out:json][timeout:19];");
    }

    @Test
    @DisplayName("elements 배열을 그대로 반환")
    void returnsElements() {
        server.expect(requestTo(OVERPASS_URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"elements\":[{\"type\":\"node\",\"id\":1},{\"type\":\"way\",\"id\":2}]}",
                        MediaType.APPLICATION_JSON));

        List<JsonNode> elements = client.fetch(query);

        assertThat(elements).hasSize(2);
        assertThat(elements.get(1).path("type").asText()).isEqualTo("way");
        server.verify();
    }

    @Test
    @DisplayName("HTTP 오류는 ProviderUnavailableException")
    void wrapsHttpErrors() {
        server.expect(requestTo(OVERPASS_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.fetch(query))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessage("HTTP 429 from Overpass API");
    }

    @Test
    @DisplayName("JSON 이 아닌 응답은 ProviderUnavailableException")
    void rejectsUnreadableResponse() {
        server.expect(requestTo(OVERPASS_URL)).andRespond(withSuccess("<html>busy</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.fetch(query))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessage("Unreadable Overpass response");
    }

    @Test
    @DisplayName("카테고리가 없으면 호출하지 않음")
    void skipsEmptyCategories() {
        ProviderQuery empty = new ProviderQuery(new GeoPoint(1, 2), 100, EnumSet.noneOf(PlaceCategory.class));

        assertThat(client.fetch(empty)).isEmpty();
        server.verify();
    }
}
