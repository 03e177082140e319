package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.ContactCompleteness;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityScorerTest {

    private final PriorityScorer scorer = new PriorityScorer(new ScoringWeights());

    @Test
    @DisplayName("연락처 둘 다 + 평점 4.6 + 리뷰 120 + 유동인구 very_high + 영업중 = 115점")
    void scoresFullyQualifiedLead() {
        // given
        CandidateLocation candidate = CandidateFixtures.google("p1", "Main St Diner", 40.0, -74.0, PlaceCategory.RESTAURANT)
                .toBuilder()
                .phone("(555) 010-0000")
                .email("owner@diner.example")
                .rating(4.6)
                .reviewCount(120)
                .footTraffic(FootTraffic.VERY_HIGH)
                .operationalStatus(OperationalStatus.OPERATIONAL)
                .build();

        // when
        int score = scorer.score(candidate);

        // then
        assertThat(score).isEqualTo(115);
    }

    @Test
    @DisplayName("정보가 전혀 없는 후보는 연락처 없음 10점 + 상태 불명 5점")
    void scoresEmptyCandidate() {
        CandidateLocation candidate = CandidateFixtures.osm("osm:node/1", "Corner", 40.0, -74.0, PlaceCategory.CAFE);

        assertThat(scorer.score(candidate)).isEqualTo(15);
        assertThat(scorer.contactCompleteness(candidate)).isEqualTo(ContactCompleteness.NONE);
    }

    @Test
    @DisplayName("영구 폐업은 상태 점수 0, 임시 휴업은 5")
    void statusPoints() {
        CandidateLocation base = CandidateFixtures.osm("osm:node/1", "Corner", 40.0, -74.0, PlaceCategory.CAFE);

        int closed = scorer.score(base.toBuilder().operationalStatus(OperationalStatus.CLOSED_PERMANENTLY).build());
        int temporarilyClosed = scorer.score(base.toBuilder().operationalStatus(OperationalStatus.CLOSED_TEMPORARILY).build());

        assertThat(closed).isEqualTo(10);
        assertThat(temporarilyClosed).isEqualTo(15);
    }

    @Test
    @DisplayName("applyTo 는 원본을 바꾸지 않고 같은 입력에 같은 점수를 반환")
    void applyToIsPure() {
        // given
        CandidateLocation candidate = CandidateFixtures.osm("osm:node/7", "Gym", 40.0, -74.0, PlaceCategory.FITNESS_CENTRE)
                .toBuilder()
                .phone("555-0101")
                .rating(4.1)
                .reviewCount(55)
                .build();

        // when
        CandidateLocation first = scorer.applyTo(candidate);
        CandidateLocation second = scorer.applyTo(candidate);

        // then
        assertThat(candidate.getPriorityScore()).isZero();
        assertThat(candidate.getContactCompleteness()).isNull();
        assertThat(first.getPriorityScore()).isEqualTo(second.getPriorityScore()).isEqualTo(30 + 15 + 10 + 5);
        assertThat(first.getContactCompleteness()).isEqualTo(ContactCompleteness.PHONE_ONLY);
    }

    @Test
    @DisplayName("가중치를 바꾸면 점수에 반영")
    void usesConfiguredWeights() {
        ScoringWeights weights = new ScoringWeights();
        weights.setContactEmailOnly(40);
        PriorityScorer custom = new PriorityScorer(weights);

        CandidateLocation candidate = CandidateFixtures.osm("osm:node/2", "Office", 40.0, -74.0, PlaceCategory.OFFICE)
                .toBuilder()
                .email("front@office.example")
                .build();

        assertThat(custom.score(candidate)).isEqualTo(40 + 5);
    }
}
