package com.vendinghive.service;

import com.vendinghive.config.LocatorProperties;
import com.vendinghive.dto.request.LocationSearchRequest;
import com.vendinghive.dto.response.LocationSearchResponse;
import com.vendinghive.entity.SearchHistory;
import com.vendinghive.exception.GeocodingUnavailableException;
import com.vendinghive.exception.InvalidZipCodeException;
import com.vendinghive.exception.SearchCancelledException;
import com.vendinghive.exception.SearchHistoryPersistenceException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.GeoPoint;
import com.vendinghive.repository.ExcludedLocationRepository;
import com.vendinghive.repository.UserLocationPreferenceRepository;
import com.vendinghive.service.geocode.ZipCodeGeocoder;
import com.vendinghive.service.provider.CandidateCollector;
import com.vendinghive.service.provider.CollectedCandidates;
import com.vendinghive.service.provider.ProviderQuery;
import com.vendinghive.service.ranking.CandidateDeduplicator;
import com.vendinghive.service.ranking.FootTrafficEstimator;
import com.vendinghive.service.ranking.PreferenceFilter;
import com.vendinghive.service.ranking.PriorityScorer;
import com.vendinghive.service.ranking.RankingAssembler;
import com.vendinghive.service.ranking.SearchContext;
import com.vendinghive.service.ranking.SearchCriteria;
import com.vendinghive.service.ranking.SearchCriteriaResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 위치 검색 메인 서비스
 *
 * 요청 검증/기본값 -> 우편번호 좌표 -> 제외 목록/선호 설정 스냅샷 -> provider 동시 조회 -> 정규화
 * -> 중복 제거(+제외) -> 유동인구 추정 -> 점수 -> 선호 필터 -> 정렬/개수 제한 -> 이력 저장
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationSearchService {

    static final String HISTORY_NOT_RECORDED = "search history could not be recorded";
    static final String GEOCODER_ERROR_KEY = "zip_geocoder";

    private final SearchCriteriaResolver criteriaResolver;
    private final ZipCodeGeocoder zipCodeGeocoder;
    private final ExcludedLocationRepository excludedLocationRepository;
    private final UserLocationPreferenceRepository preferenceRepository;
    private final CandidateCollector candidateCollector;
    private final CandidateDeduplicator candidateDeduplicator;
    private final FootTrafficEstimator footTrafficEstimator;
    private final PriorityScorer priorityScorer;
    private final PreferenceFilter preferenceFilter;
    private final RankingAssembler rankingAssembler;
    private final SearchHistoryRecorder searchHistoryRecorder;
    private final LocatorProperties properties;

    public LocationSearchResponse search(LocationSearchRequest request) {
        String operatorId = criteriaResolver.requireOperatorId(request);
        SearchContext context = loadContext(operatorId);
        SearchCriteria criteria = criteriaResolver.resolve(request, context.findPreference());

        GeoPoint center;
        try {
            center = zipCodeGeocoder.locate(criteria.getZipCode())
                    .orElseThrow(() -> new InvalidZipCodeException(criteria.getZipCode(), "ZIP code could not be located"));
        } catch (GeocodingUnavailableException e) {
            // 중심 좌표 없이는 provider 조회 불가. 빈 결과 + 오류 메타데이터로 응답하고 이력은 남기지 않음
            log.error("[LocationSearchService] search - geocoder unavailable for zip {}: {}",
                    criteria.getZipCode(), e.getMessage(), e);
            Map<String, String> errors = new LinkedHashMap<>();
            errors.put(GEOCODER_ERROR_KEY, e.getMessage());
            return rankingAssembler.toResponse(List.of(), errors, criteria, null, null, List.of());
        }

        log.info("[LocationSearchService] search - operator: {}, zip: {}, radius: {}mi, machine: {}, buildings: {}",
                operatorId, criteria.getZipCode(), criteria.getRadius().getMiles(),
                criteria.getMachineType().getCode(), criteria.getBuildingTypes());

        ProviderQuery query = new ProviderQuery(center, criteria.getRadius().toMeters(), criteria.providerCategories());
        CollectedCandidates collected = candidateCollector.collect(query);

        List<CandidateLocation> merged =
                candidateDeduplicator.deduplicate(collected.getCandidates(), context.getExcludedProviderIds());
        List<CandidateLocation> scored = merged.stream()
                .map(this::withFootTraffic)
                .map(priorityScorer::applyTo)
                .collect(Collectors.toList());
        List<CandidateLocation> filtered = preferenceFilter.filter(scored, criteria);
        List<CandidateLocation> ranked = rankingAssembler.rank(filtered, criteria.getMaxResults());

        // 중간에 취소된 검색은 기록하지 않음
        if (Thread.currentThread().isInterrupted()) {
            throw new SearchCancelledException("Search cancelled before history was recorded", null);
        }

        List<String> warnings = new ArrayList<>();
        SearchHistory recorded = null;
        try {
            recorded = searchHistoryRecorder.record(
                    rankingAssembler.toHistory(context, criteria, center, ranked, collected.getProviderErrors()));
        } catch (SearchHistoryPersistenceException e) {
            warnings.add(HISTORY_NOT_RECORDED);
        }

        log.info("[LocationSearchService] search done - operator: {}, collected: {}, merged: {}, returned: {}",
                operatorId, collected.getCandidates().size(), merged.size(), ranked.size());
        return rankingAssembler.toResponse(ranked, collected.getProviderErrors(), criteria, center, recorded, warnings);
    }

    private SearchContext loadContext(String operatorId) {
        return new SearchContext(
                operatorId,
                excludedLocationRepository.findProviderIdsByOperatorId(operatorId),
                preferenceRepository.findByOperatorId(operatorId).orElse(null));
    }

    private CandidateLocation withFootTraffic(CandidateLocation candidate) {
        return properties.getSearch().isEstimateFootTraffic() ? footTrafficEstimator.estimate(candidate) : candidate;
    }
}
