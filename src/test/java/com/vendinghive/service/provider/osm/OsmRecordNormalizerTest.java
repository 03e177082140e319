package com.vendinghive.service.provider.osm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.exception.MalformedRecordException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OsmRecordNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OsmRecordNormalizer normalizer = new OsmRecordNormalizer();

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Test
    @DisplayName("node 요소를 후보로 변환 (주소, 연락처, 카테고리)")
    void normalizesNode() throws Exception {
        // given
        JsonNode element = json("{\"type\":\"node\",\"id\":1234,\"lat\":40.7128,\"lon\":-74.006,"
                + "\"tags\":{\"name\":\"Joe's Pizza\",\"amenity\":\"restaurant\",\"addr:housenumber\":\"7\","
                + "\"addr:street\":\"Carmine St\",\"addr:city\":\"New York\",\"addr:state\":\"NY\",\"addr:postcode\":\"10014\","
                + "\"contact:phone\":\"+1 212 555 0100\",\"email\":\"joe@pizza.example\",\"opening_hours\":\"Mo-Su 10:00-04:00\"}}");

        // when
        CandidateLocation candidate = normalizer.normalize(element);

        // then
        assertThat(candidate.getProviderId()).isEqualTo("osm:node/1234");
        assertThat(candidate.getOsmId()).isEqualTo("osm:node/1234");
        assertThat(candidate.getSources()).containsExactly(ProviderSource.OPENSTREETMAP);
        assertThat(candidate.getName()).isEqualTo("Joe's Pizza");
        assertThat(candidate.getCategory()).isEqualTo("amenity:restaurant");
        assertThat(candidate.getPlaceCategories()).containsExactly(PlaceCategory.RESTAURANT);
        assertThat(candidate.getLatitude()).isEqualByComparingTo(new BigDecimal("40.712800"));
        assertThat(candidate.getAddress()).isEqualTo("7 Carmine St, New York, NY 10014");
        assertThat(candidate.getPhone()).isEqualTo("+1 212 555 0100");
        assertThat(candidate.getEmail()).isEqualTo("joe@pizza.example");
        assertThat(candidate.getMapsUrl()).isEqualTo("https://www.openstreetmap.org/node/1234");
        assertThat(candidate.getBusinessHours()).isEqualTo("Mo-Su 10:00-04:00");
        assertThat(candidate.getOperationalStatus()).isEqualTo(OperationalStatus.UNKNOWN);
        assertThat(candidate.getRating()).isNull();
    }

    @Test
    @DisplayName("way 요소는 center 좌표 사용")
    void usesWayCenter() throws Exception {
        JsonNode element = json("{\"type\":\"way\",\"id\":99,\"center\":{\"lat\":41.0,\"lon\":-73.5},"
                + "\"tags\":{\"name\":\"Acme Plant\",\"building\":\"industrial\"}}");

        CandidateLocation candidate = normalizer.normalize(element);

        assertThat(candidate.getProviderId()).isEqualTo("osm:way/99");
        assertThat(candidate.getLongitude()).isEqualByComparingTo("-73.5");
        assertThat(candidate.getPlaceCategories()).containsExactly(PlaceCategory.INDUSTRIAL);
    }

    @Test
    @DisplayName("이름이나 좌표가 없는 요소는 MalformedRecordException")
    void rejectsIncompleteElements() throws Exception {
        assertThatThrownBy(() -> normalizer.normalize(json("{\"type\":\"node\",\"id\":1,\"lat\":1,\"lon\":2,\"tags\":{}}")))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(json("{\"type\":\"way\",\"id\":2,\"tags\":{\"name\":\"X\"}}")))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(json("{\"type\":\"node\",\"id\":3,\"lat\":95,\"lon\":2,\"tags\":{\"name\":\"X\"}}")))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(json("[1,2]")))
                .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    @DisplayName("카테고리 키 우선순위와 알 수 없는 카테고리")
    void extractsCategory() {
        assertThat(normalizer.extractCategory(Map.of("shop", "convenience", "building", "retail"))).isEqualTo("shop:convenience");
        assertThat(normalizer.extractCategory(Map.of("name", "Nothing"))).isEqualTo("unknown");
    }

    @Test
    @DisplayName("주소 태그가 없으면 null, 일부만 있으면 있는 부분만")
    void buildsPartialAddress() {
        assertThat(normalizer.buildAddress(Map.of())).isNull();
        assertThat(normalizer.buildAddress(Map.of("addr:city", "Austin", "addr:postcode", "78701"))).isEqualTo("Austin, 78701");
    }
}
