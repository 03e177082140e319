package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 운영자 조건에 맞지 않는 후보 제거
 * - 평점 하한 미달 (평점 없는 후보는 통과)
 * - 연락처 필수인데 전화/이메일 둘 다 없음
 * - 제외 카테고리 포함 (detailed category, 비어있으면 category 에 대해 대소문자 무시 부분 일치)
 * - 건물 유형 필터가 있으면 해당 카테고리, 없으면 자판기 종류 카테고리에 해당하지 않음
 * - 영구 폐업 (설정으로 허용 가능)
 */
@Slf4j
public class PreferenceFilter {

    private final boolean includePermanentlyClosed;

    public PreferenceFilter(boolean includePermanentlyClosed) {
        this.includePermanentlyClosed = includePermanentlyClosed;
    }

    public List<CandidateLocation> filter(List<CandidateLocation> candidates, SearchCriteria criteria) {
        Set<PlaceCategory> eligible = criteria.eligibleCategories();
        List<CandidateLocation> kept = candidates.stream()
                .filter(candidate -> meetsRatingFloor(candidate, criteria.getMinimumRating()))
                .filter(candidate -> !criteria.isRequireContactInfo() || candidate.hasContactInfo())
                .filter(candidate -> !inExcludedCategory(candidate, criteria.getExcludedCategories()))
                .filter(candidate -> !Collections.disjoint(candidate.getPlaceCategories(), eligible))
                .filter(candidate -> includePermanentlyClosed
                        || candidate.getOperationalStatus() != OperationalStatus.CLOSED_PERMANENTLY)
                .collect(Collectors.toList());
        log.debug("[PreferenceFilter] {} -> {} candidates", candidates.size(), kept.size());
        return kept;
    }

    boolean meetsRatingFloor(CandidateLocation candidate, BigDecimal minimumRating) {
        if (candidate.getRating() == null || minimumRating == null) {
            return true;
        }
        return BigDecimal.valueOf(candidate.getRating()).compareTo(minimumRating) >= 0;
    }

    boolean inExcludedCategory(CandidateLocation candidate, Set<String> excludedCategories) {
        if (excludedCategories == null || excludedCategories.isEmpty()) {
            return false;
        }
        String text = StringUtils.isNotBlank(candidate.getDetailedCategory())
                ? candidate.getDetailedCategory()
                : candidate.getCategory();
        if (StringUtils.isBlank(text)) {
            return false;
        }
        for (String excluded : excludedCategories) {
            if (StringUtils.isNotBlank(excluded) && StringUtils.containsIgnoreCase(text, excluded.trim())) {
                return true;
            }
        }
        return false;
    }
}
