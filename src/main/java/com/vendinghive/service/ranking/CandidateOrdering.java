package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;
import static java.util.Comparator.nullsLast;

/**
 * 후보 정렬 기준
 */
public final class CandidateOrdering {

    /**
     * 최종 랭킹: 점수 내림차순, 리뷰 수 내림차순, 이름 오름차순, provider id 오름차순
     */
    public static final Comparator<CandidateLocation> RANKING =
            Comparator.comparingInt(CandidateLocation::getPriorityScore).reversed()
                    .thenComparing(CandidateOrdering::reviewCountOrZero, Comparator.reverseOrder())
                    .thenComparing(CandidateLocation::getName, nullsLast(String.CASE_INSENSITIVE_ORDER))
                    .thenComparing(CandidateLocation::getProviderId, nullsLast(naturalOrder()));

    /**
     * 중복 제거 전 정렬용 전순서 키. 병합이 읽는 모든 필드를 비교하므로
     * 0 을 반환하는 두 후보는 어느 쪽을 primary 로 골라도 병합 결과가 같음
     */
    public static final Comparator<CandidateLocation> CANONICAL =
            comparing(CandidateLocation::getProviderId, nullsFirst(Comparator.<String>naturalOrder()))
                    .thenComparing(CandidateLocation::getGooglePlaceId, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getOsmId, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getName, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getLatitude, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getLongitude, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getAddress, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getPhone, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getEmail, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getWebsite, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getRating, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getReviewCount, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getCategory, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getDetailedCategory, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getMapsUrl, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getBusinessHours, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getOperationalStatus, nullsFirst(naturalOrder()))
                    .thenComparing(CandidateLocation::getFootTraffic, nullsFirst(naturalOrder()))
                    .thenComparing(candidate -> enumKey(candidate.getSources()))
                    .thenComparing(candidate -> enumKey(candidate.getPlaceCategories()));

    private CandidateOrdering() {
    }

    private static String enumKey(Set<? extends Enum<?>> values) {
        if (values == null) {
            return "";
        }
        return values.stream()
                .map(Enum::name)
                .sorted()
                .collect(Collectors.joining(","));
    }

    private static int reviewCountOrZero(CandidateLocation candidate) {
        return candidate.getReviewCount() != null ? candidate.getReviewCount() : 0;
    }
}
