package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 두 provider 결과를 하나의 후보 목록으로 병합하고 제외 목록을 적용
 *
 * 병합 순서:
 * 1. Google place_id 가 같은 후보끼리 병합
 * 2. 서로 다른 place_id 를 가진 쌍이 아니면서 matcher 가 같은 장소로 판단한 쌍 병합 (더 이상 병합이 없을 때까지 반복)
 * 3. 어떤 provider id 든 제외 목록에 있으면 제거
 */
@Slf4j
public class CandidateDeduplicator {

    private final CandidateMatcher matcher;

    public CandidateDeduplicator(CandidateMatcher matcher) {
        this.matcher = matcher;
    }

    public List<CandidateLocation> deduplicate(Collection<CandidateLocation> candidates, Set<String> excludedIds) {
        List<CandidateLocation> sorted = new ArrayList<>(candidates);
        sorted.sort(CandidateOrdering.CANONICAL);

        List<CandidateLocation> working = mergeByPlaceId(sorted);
        mergeUntilStable(working);

        List<CandidateLocation> result = working.stream()
                .filter(candidate -> !isExcluded(candidate, excludedIds))
                .sorted(CandidateOrdering.CANONICAL)
                .collect(Collectors.toList());

        log.debug("[CandidateDeduplicator] input: {}, merged: {}, after exclusions: {}",
                candidates.size(), working.size(), result.size());
        return result;
    }

    private List<CandidateLocation> mergeByPlaceId(List<CandidateLocation> sorted) {
        Map<String, CandidateLocation> byPlaceId = new LinkedHashMap<>();
        List<CandidateLocation> merged = new ArrayList<>();
        for (CandidateLocation candidate : sorted) {
            if (!candidate.isFromGoogle()) {
                merged.add(candidate);
                continue;
            }
            byPlaceId.merge(candidate.getGooglePlaceId(), candidate, this::merge);
        }
        merged.addAll(byPlaceId.values());
        merged.sort(CandidateOrdering.CANONICAL);
        return merged;
    }

    private void mergeUntilStable(List<CandidateLocation> working) {
        boolean changed = true;
        while (changed) {
            changed = false;
            outer:
            for (int i = 0; i < working.size(); i++) {
                for (int j = i + 1; j < working.size(); j++) {
                    CandidateLocation a = working.get(i);
                    CandidateLocation b = working.get(j);
                    if (hasConflictingPlaceIds(a, b) || !matcher.isSamePlace(a, b)) {
                        continue;
                    }
                    working.set(i, merge(a, b));
                    working.remove(j);
                    working.sort(CandidateOrdering.CANONICAL);
                    changed = true;
                    break outer;
                }
            }
        }
    }

    private boolean hasConflictingPlaceIds(CandidateLocation a, CandidateLocation b) {
        return a.isFromGoogle() && b.isFromGoogle() && !a.getGooglePlaceId().equals(b.getGooglePlaceId());
    }

    private boolean isExcluded(CandidateLocation candidate, Set<String> excludedIds) {
        if (excludedIds == null || excludedIds.isEmpty()) {
            return false;
        }
        for (String id : candidate.allProviderIds()) {
            if (excludedIds.contains(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 두 후보 병합. Google 레코드가 평점/리뷰/상태/이름/좌표를 우선 제공하고
     * 연락처와 주소는 Google 쪽부터 처음 비어있지 않은 값을 사용
     */
    CandidateLocation merge(CandidateLocation a, CandidateLocation b) {
        CandidateLocation primary;
        CandidateLocation secondary;
        if (a.isFromGoogle() != b.isFromGoogle()) {
            primary = a.isFromGoogle() ? a : b;
            secondary = a.isFromGoogle() ? b : a;
        } else if (CandidateOrdering.CANONICAL.compare(a, b) <= 0) {
            primary = a;
            secondary = b;
        } else {
            primary = b;
            secondary = a;
        }
        // OSM 카테고리(key:value)는 OSM 쪽이 원본
        CandidateLocation osmFirst = secondary.getOsmId() != null ? secondary : primary;
        CandidateLocation osmSecond = osmFirst == secondary ? primary : secondary;

        Set<ProviderSource> sources = EnumSet.noneOf(ProviderSource.class);
        sources.addAll(primary.getSources());
        sources.addAll(secondary.getSources());
        Set<PlaceCategory> categories = EnumSet.noneOf(PlaceCategory.class);
        categories.addAll(primary.getPlaceCategories());
        categories.addAll(secondary.getPlaceCategories());

        String googlePlaceId = firstNonBlank(primary.getGooglePlaceId(), secondary.getGooglePlaceId());
        String osmId = firstNonBlank(primary.getOsmId(), secondary.getOsmId());
        String providerId = googlePlaceId != null ? googlePlaceId
                : firstNonBlank(osmId, primary.getProviderId(), secondary.getProviderId());

        boolean primaryHasCoordinates = primary.getLatitude() != null && primary.getLongitude() != null;

        return CandidateLocation.builder()
                .providerId(providerId)
                .googlePlaceId(googlePlaceId)
                .osmId(osmId)
                .sources(sources)
                .name(firstNonBlank(primary.getName(), secondary.getName()))
                .category(firstNonBlank(osmFirst.getCategory(), osmSecond.getCategory()))
                .detailedCategory(firstNonBlank(primary.getDetailedCategory(), secondary.getDetailedCategory()))
                .placeCategories(categories)
                .latitude(primaryHasCoordinates ? primary.getLatitude() : secondary.getLatitude())
                .longitude(primaryHasCoordinates ? primary.getLongitude() : secondary.getLongitude())
                .address(firstNonBlank(primary.getAddress(), secondary.getAddress()))
                .phone(firstNonBlank(primary.getPhone(), secondary.getPhone()))
                .email(firstNonBlank(primary.getEmail(), secondary.getEmail()))
                .website(firstNonBlank(primary.getWebsite(), secondary.getWebsite()))
                .mapsUrl(firstNonBlank(primary.getMapsUrl(), secondary.getMapsUrl()))
                .businessHours(firstNonBlank(primary.getBusinessHours(), secondary.getBusinessHours()))
                .rating(primary.getRating() != null ? primary.getRating() : secondary.getRating())
                .reviewCount(primary.getReviewCount() != null ? primary.getReviewCount() : secondary.getReviewCount())
                .operationalStatus(primary.getOperationalStatus() != OperationalStatus.UNKNOWN
                        ? primary.getOperationalStatus() : secondary.getOperationalStatus())
                .footTraffic(primary.getFootTraffic() != null ? primary.getFootTraffic() : secondary.getFootTraffic())
                .build();
    }

    private static String firstNonBlank(String... values) {
        return StringUtils.firstNonBlank(values);
    }
}
