package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.ContactCompleteness;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.OperationalStatus;

/**
 * 후보 장소 우선순위 점수 계산기
 * 같은 입력이면 항상 같은 점수 (외부 상태 없음)
 *
 * 점수 = 연락처 + 리뷰 수 + 평점 + 유동인구 + 영업 상태
 */
public class PriorityScorer {

    private final ScoringWeights weights;

    public PriorityScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public int score(CandidateLocation candidate) {
        return contactPoints(contactCompleteness(candidate))
                + reviewPoints(candidate.getReviewCount())
                + ratingPoints(candidate.getRating())
                + trafficPoints(candidate.getFootTraffic())
                + statusPoints(candidate.getOperationalStatus());
    }

    public ContactCompleteness contactCompleteness(CandidateLocation candidate) {
        return ContactCompleteness.of(candidate.hasPhone(), candidate.hasEmail());
    }

    /**
     * 점수와 연락처 등급을 채운 사본 반환 (원본은 수정하지 않음)
     */
    public CandidateLocation applyTo(CandidateLocation candidate) {
        return candidate.toBuilder()
                .priorityScore(score(candidate))
                .contactCompleteness(contactCompleteness(candidate))
                .build();
    }

    private int contactPoints(ContactCompleteness completeness) {
        switch (completeness) {
            case BOTH:
                return weights.getContactBoth();
            case PHONE_ONLY:
                return weights.getContactPhoneOnly();
            case EMAIL_ONLY:
                return weights.getContactEmailOnly();
            default:
                return weights.getContactNone();
        }
    }

    private int reviewPoints(Integer reviewCount) {
        if (reviewCount == null) {
            return 0;
        }
        if (reviewCount >= 100) {
            return weights.getReviewsHigh();
        }
        if (reviewCount >= 50) {
            return weights.getReviewsMedium();
        }
        if (reviewCount >= 10) {
            return weights.getReviewsLow();
        }
        return 0;
    }

    private int ratingPoints(Double rating) {
        if (rating == null) {
            return 0;
        }
        if (rating >= 4.5) {
            return weights.getRatingExcellent();
        }
        if (rating >= 4.0) {
            return weights.getRatingGood();
        }
        if (rating >= 3.5) {
            return weights.getRatingFair();
        }
        return 0;
    }

    private int trafficPoints(FootTraffic traffic) {
        if (traffic == null) {
            return 0;
        }
        switch (traffic) {
            case VERY_HIGH:
                return weights.getTrafficVeryHigh();
            case HIGH:
                return weights.getTrafficHigh();
            case MODERATE:
                return weights.getTrafficModerate();
            case LOW:
                return weights.getTrafficLow();
            default:
                return weights.getTrafficVeryLow();
        }
    }

    private int statusPoints(OperationalStatus status) {
        if (status == OperationalStatus.OPERATIONAL) {
            return weights.getStatusOperational();
        }
        if (status == OperationalStatus.CLOSED_PERMANENTLY) {
            return weights.getStatusClosedPermanently();
        }
        return weights.getStatusUncertain();
    }
}
