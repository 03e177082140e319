package com.vendinghive.service.ranking;

import com.vendinghive.model.BuildingType;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.MachineType;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.SearchRadius;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PreferenceFilterTest {

    private final PreferenceFilter filter = new PreferenceFilter(true);

    private SearchCriteria.SearchCriteriaBuilder criteria() {
        return SearchCriteria.builder()
                .zipCode("10001")
                .radius(SearchRadius.MILES_10)
                .machineType(MachineType.SNACK_MACHINE)
                .buildingTypes(EnumSet.noneOf(BuildingType.class))
                .maxResults(20)
                .minimumRating(BigDecimal.ZERO)
                .excludedCategories(Set.of());
    }

    @Test
    @DisplayName("연락처 필수면 전화/이메일 없는 후보 제거")
    void requiresContactInfo() {
        CandidateLocation withPhone = CandidateFixtures.osm("osm:node/1", "Deli", 40.0, -74.0, PlaceCategory.RESTAURANT)
                .toBuilder().phone("555-0001").build();
        CandidateLocation withEmail = CandidateFixtures.osm("osm:node/2", "Diner", 40.0, -74.0, PlaceCategory.RESTAURANT)
                .toBuilder().email("hi@diner.example").build();
        CandidateLocation none = CandidateFixtures.osm("osm:node/3", "Grill", 40.0, -74.0, PlaceCategory.RESTAURANT)
                .toBuilder().phone("  ").build();

        List<CandidateLocation> kept = filter.filter(List.of(withPhone, withEmail, none),
                criteria().requireContactInfo(true).build());

        assertThat(kept).extracting(CandidateLocation::getName).containsExactly("Deli", "Diner");
    }

    @Test
    @DisplayName("평점 하한 미달은 제거, 평점 없는 후보는 통과")
    void appliesRatingFloor() {
        CandidateLocation low = CandidateFixtures.google("g1", "Low", 40.0, -74.0, PlaceCategory.CAFE)
                .toBuilder().rating(3.4).build();
        CandidateLocation exact = CandidateFixtures.google("g2", "Exact", 40.0, -74.0, PlaceCategory.CAFE)
                .toBuilder().rating(3.5).build();
        CandidateLocation unrated = CandidateFixtures.osm("osm:node/1", "Unrated", 40.0, -74.0, PlaceCategory.CAFE);

        List<CandidateLocation> kept = filter.filter(List.of(low, exact, unrated),
                criteria().minimumRating(new BigDecimal("3.5")).build());

        assertThat(kept).extracting(CandidateLocation::getName).containsExactly("Exact", "Unrated");
    }

    @Test
    @DisplayName("제외 카테고리는 detailed category 에 대소문자 무시 부분 일치")
    void dropsExcludedCategories() {
        CandidateLocation bar = CandidateFixtures.google("g1", "Night Owl", 40.0, -74.0, PlaceCategory.RESTAURANT)
                .toBuilder().detailedCategory("restaurant, Bar, food").build();
        CandidateLocation cafe = CandidateFixtures.osm("osm:node/1", "Bean", 40.0, -74.0, PlaceCategory.CAFE);

        List<CandidateLocation> kept = filter.filter(List.of(bar, cafe),
                criteria().excludedCategories(Set.of("bar")).build());

        assertThat(kept).extracting(CandidateLocation::getName).containsExactly("Bean");
    }

    @Test
    @DisplayName("건물 유형 필터가 없으면 자판기 종류 카테고리만 통과")
    void machineTypeCategoriesWithoutBuildingFilter() {
        CandidateLocation gym = CandidateFixtures.osm("osm:node/1", "Gym", 40.0, -74.0, PlaceCategory.FITNESS_CENTRE);
        CandidateLocation church = CandidateFixtures.osm("osm:node/2", "Chapel", 40.0, -74.0, PlaceCategory.PLACE_OF_WORSHIP);

        List<CandidateLocation> kept = filter.filter(List.of(gym, church), criteria().build());

        assertThat(kept).extracting(CandidateLocation::getName).containsExactly("Gym");
    }

    @Test
    @DisplayName("건물 유형 필터가 있으면 해당 카테고리만 통과")
    void buildingFilterNarrowsCategories() {
        CandidateLocation gym = CandidateFixtures.osm("osm:node/1", "Gym", 40.0, -74.0, PlaceCategory.FITNESS_CENTRE);
        CandidateLocation church = CandidateFixtures.osm("osm:node/2", "Chapel", 40.0, -74.0, PlaceCategory.PLACE_OF_WORSHIP);

        List<CandidateLocation> kept = filter.filter(List.of(gym, church),
                criteria().buildingTypes(EnumSet.of(BuildingType.CHURCHES)).build());

        assertThat(kept).extracting(CandidateLocation::getName).containsExactly("Chapel");
    }

    @Test
    @DisplayName("영구 폐업은 설정에 따라 포함/제외")
    void permanentlyClosedIsConfigurable() {
        CandidateLocation closed = CandidateFixtures.google("g1", "Gone", 40.0, -74.0, PlaceCategory.CAFE)
                .toBuilder().operationalStatus(OperationalStatus.CLOSED_PERMANENTLY).build();

        assertThat(filter.filter(List.of(closed), criteria().build())).hasSize(1);
        assertThat(new PreferenceFilter(false).filter(List.of(closed), criteria().build())).isEmpty();
    }
}
