package com.vendinghive.service.provider.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendinghive.exception.MalformedRecordException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GooglePlaceNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GooglePlaceNormalizer normalizer = new GooglePlaceNormalizer();

    @Test
    @DisplayName("Place Details 결과를 후보로 변환")
    void normalizesDetails() throws Exception {
        // given
        JsonNode result = objectMapper.readTree("{\"place_id\":\"ChIJabc\",\"name\":\"Speedy Gas\","
                + "\"geometry\":{\"location\":{\"lat\":33.4484,\"lng\":-112.074}},"
                + "\"types\":[\"gas_station\",\"convenience_store\",\"store\",\"point_of_interest\"],"
                + "\"formatted_address\":\"1 Central Ave, Phoenix, AZ 85004\",\"international_phone_number\":\"+1 602-555-0100\","
                + "\"website\":\"https://speedy.example\",\"rating\":4.1,\"user_ratings_total\":312,"
                + "\"business_status\":\"OPERATIONAL\",\"opening_hours\":{\"weekday_text\":[\"Monday: Open 24 hours\",\"Tuesday: Open 24 hours\"]}}");

        // when
        CandidateLocation candidate = normalizer.normalize(result);

        // then
        assertThat(candidate.getProviderId()).isEqualTo("ChIJabc");
        assertThat(candidate.getGooglePlaceId()).isEqualTo("ChIJabc");
        assertThat(candidate.getDetailedCategory()).isEqualTo("gas_station, convenience_store, store");
        assertThat(candidate.getPlaceCategories()).containsExactlyInAnyOrder(PlaceCategory.FUEL, PlaceCategory.CONVENIENCE);
        assertThat(candidate.getAddress()).isEqualTo("1 Central Ave, Phoenix, AZ 85004");
        assertThat(candidate.getPhone()).isEqualTo("+1 602-555-0100");
        assertThat(candidate.getMapsUrl()).isEqualTo("https://www.google.com/maps/place/?q=place_id:ChIJabc");
        assertThat(candidate.getBusinessHours()).isEqualTo("Monday: Open 24 hours\nTuesday: Open 24 hours");
        assertThat(candidate.getRating()).isEqualTo(4.1);
        assertThat(candidate.getReviewCount()).isEqualTo(312);
        assertThat(candidate.getOperationalStatus()).isEqualTo(OperationalStatus.OPERATIONAL);
        assertThat(candidate.getEmail()).isNull();
    }

    @Test
    @DisplayName("Nearby 결과는 vicinity 를 주소로, 범위 밖 평점은 버림")
    void normalizesNearbyResult() throws Exception {
        JsonNode result = objectMapper.readTree("{\"place_id\":\"p2\",\"name\":\"Bean There\","
                + "\"geometry\":{\"location\":{\"lat\":1.0,\"lng\":2.0}},\"vicinity\":\"5 Elm St\","
                + "\"rating\":7.5,\"user_ratings_total\":-3,\"business_status\":\"SOMETHING_NEW\"}");

        CandidateLocation candidate = normalizer.normalize(result);

        assertThat(candidate.getAddress()).isEqualTo("5 Elm St");
        assertThat(candidate.getRating()).isNull();
        assertThat(candidate.getReviewCount()).isNull();
        assertThat(candidate.getOperationalStatus()).isEqualTo(OperationalStatus.UNKNOWN);
        assertThat(candidate.getDetailedCategory()).isNull();
    }

    @Test
    @DisplayName("place_id, 이름, 좌표 중 하나라도 없으면 MalformedRecordException")
    void rejectsIncompleteResult() {
        assertThatThrownBy(() -> normalizer.normalize(objectMapper.readTree(
                "{\"name\":\"X\",\"geometry\":{\"location\":{\"lat\":1,\"lng\":2}}}")))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(objectMapper.readTree(
                "{\"place_id\":\"p\",\"geometry\":{\"location\":{\"lat\":1,\"lng\":2}}}")))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(objectMapper.readTree(
                "{\"place_id\":\"p\",\"name\":\"X\",\"geometry\":{}}")))
                .isInstanceOf(MalformedRecordException.class);
    }
}
