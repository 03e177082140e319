package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.PlaceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProximityNameMatcherTest {

    private final ProximityNameMatcher matcher = new ProximityNameMatcher(30.0, 0.6);

    @Test
    @DisplayName("가까운 위치 + 표기만 다른 이름은 같은 장소")
    void matchesNearbySimilarNames() {
        CandidateLocation osm = CandidateFixtures.osm("osm:node/1", "Joe's Café & Grill", 40.712800, -74.006000, PlaceCategory.CAFE);
        CandidateLocation google = CandidateFixtures.google("g1", "Joes Cafe and Grill", 40.712900, -74.006050, PlaceCategory.CAFE);

        assertThat(matcher.isSamePlace(osm, google)).isTrue();
    }

    @Test
    @DisplayName("이름이 같아도 30m 보다 멀면 다른 장소")
    void rejectsDistantPlaces() {
        CandidateLocation first = CandidateFixtures.osm("osm:node/1", "Subway", 40.7128, -74.0060, PlaceCategory.FAST_FOOD);
        CandidateLocation second = CandidateFixtures.google("g1", "Subway", 40.7138, -74.0060, PlaceCategory.FAST_FOOD);

        assertThat(matcher.isSamePlace(first, second)).isFalse();
    }

    @Test
    @DisplayName("가까워도 이름이 다르면 다른 장소")
    void rejectsDifferentNames() {
        CandidateLocation first = CandidateFixtures.osm("osm:node/1", "Blue Bottle Coffee", 40.7128, -74.0060, PlaceCategory.CAFE);
        CandidateLocation second = CandidateFixtures.google("g1", "Harbor Dental Clinic", 40.7128, -74.0060, PlaceCategory.CAFE);

        assertThat(matcher.isSamePlace(first, second)).isFalse();
    }

    @Test
    @DisplayName("이름 정규화: 악센트, &, 특수문자, 공백")
    void normalizesNames() {
        assertThat(ProximityNameMatcher.normalize("  Café  & Bar!! ")).isEqualTo("cafe and bar");
        assertThat(ProximityNameMatcher.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("한쪽 이름이 다른 쪽을 포함하면 유사도 1.0")
    void containmentCountsAsIdentical() {
        assertThat(matcher.nameSimilarity("Starbucks", "Starbucks Coffee")).isEqualTo(1.0);
        assertThat(matcher.nameSimilarity("Main Street Deli", "Main Street Laundry")).isEqualTo(0.5);
    }
}
