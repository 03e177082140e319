package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.OperationalStatus;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * 평점, 리뷰 수, 카테고리, 영업 상태로 유동인구 등급 추정
 * 이미 값이 있는 후보는 건드리지 않음
 */
public class FootTrafficEstimator {

    private static final List<String> HIGH_TRAFFIC_KEYWORDS = List.of(
            "gas_station", "fuel", "convenience", "grocery", "supermarket", "shopping_mall",
            "hospital", "school", "university", "restaurant", "fast_food", "meal_takeaway",
            "transit_station", "airport");

    private static final List<String> MEDIUM_TRAFFIC_KEYWORDS = List.of(
            "office", "hotel", "lodging", "gym", "fitness", "cafe", "bank");

    public CandidateLocation estimate(CandidateLocation candidate) {
        if (candidate.getFootTraffic() != null) {
            return candidate;
        }
        return candidate.toBuilder().footTraffic(levelFor(points(candidate))).build();
    }

    int points(CandidateLocation candidate) {
        int points = 0;

        Double rating = candidate.getRating();
        if (rating != null) {
            if (rating >= 4.5) {
                points += 15;
            } else if (rating >= 4.0) {
                points += 10;
            } else if (rating >= 3.5) {
                points += 5;
            }
        }

        Integer reviews = candidate.getReviewCount();
        if (reviews != null) {
            if (reviews >= 500) {
                points += 20;
            } else if (reviews >= 100) {
                points += 15;
            } else if (reviews >= 50) {
                points += 10;
            } else if (reviews >= 10) {
                points += 5;
            }
        }

        String categoryText = (StringUtils.defaultString(candidate.getCategory()) + " "
                + StringUtils.defaultString(candidate.getDetailedCategory())).toLowerCase(Locale.ROOT);
        if (containsAny(categoryText, HIGH_TRAFFIC_KEYWORDS)) {
            points += 15;
        } else if (containsAny(categoryText, MEDIUM_TRAFFIC_KEYWORDS)) {
            points += 8;
        }

        if (candidate.getOperationalStatus() == OperationalStatus.OPERATIONAL) {
            points += 10;
        }
        return points;
    }

    static FootTraffic levelFor(int points) {
        if (points >= 40) {
            return FootTraffic.VERY_HIGH;
        }
        if (points >= 25) {
            return FootTraffic.HIGH;
        }
        if (points >= 15) {
            return FootTraffic.MODERATE;
        }
        if (points >= 5) {
            return FootTraffic.LOW;
        }
        return FootTraffic.VERY_LOW;
    }

    private boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
