package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.PlaceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FootTrafficEstimatorTest {

    private final FootTrafficEstimator estimator = new FootTrafficEstimator();

    @Test
    @DisplayName("평점/리뷰가 많은 영업중 주유소는 very_high")
    void busyGasStation() {
        CandidateLocation candidate = CandidateFixtures.google("g1", "Shell", 40.0, -74.0, PlaceCategory.FUEL)
                .toBuilder()
                .rating(4.2)
                .reviewCount(640)
                .build();

        // 10 + 20 + 15 + 10
        assertThat(estimator.points(candidate)).isEqualTo(55);
        assertThat(estimator.estimate(candidate).getFootTraffic()).isEqualTo(FootTraffic.VERY_HIGH);
    }

    @Test
    @DisplayName("정보 없는 OSM 사무실은 카테고리 점수만 받아 low")
    void bareOffice() {
        CandidateLocation candidate = CandidateFixtures.osm("osm:way/5", "Tower", 40.0, -74.0, PlaceCategory.OFFICE);

        assertThat(estimator.points(candidate)).isEqualTo(8);
        assertThat(estimator.estimate(candidate).getFootTraffic()).isEqualTo(FootTraffic.LOW);
    }

    @Test
    @DisplayName("이미 유동인구 값이 있으면 그대로 유지")
    void keepsExistingValue() {
        CandidateLocation candidate = CandidateFixtures.osm("osm:node/9", "Bar", 40.0, -74.0, PlaceCategory.BAR)
                .toBuilder()
                .footTraffic(FootTraffic.HIGH)
                .build();

        assertThat(estimator.estimate(candidate)).isSameAs(candidate);
    }

    @Test
    @DisplayName("점수 구간 경계")
    void levelBoundaries() {
        assertThat(FootTrafficEstimator.levelFor(4)).isEqualTo(FootTraffic.VERY_LOW);
        assertThat(FootTrafficEstimator.levelFor(5)).isEqualTo(FootTraffic.LOW);
        assertThat(FootTrafficEstimator.levelFor(15)).isEqualTo(FootTraffic.MODERATE);
        assertThat(FootTrafficEstimator.levelFor(25)).isEqualTo(FootTraffic.HIGH);
        assertThat(FootTrafficEstimator.levelFor(40)).isEqualTo(FootTraffic.VERY_HIGH);
    }
}
