package com.vendinghive.service;

import com.vendinghive.dto.response.LocatorStatsResponse;
import com.vendinghive.dto.response.RankedLocationResponse;
import com.vendinghive.dto.response.SearchHistoryResponse;
import com.vendinghive.exception.ResourceNotFoundException;
import com.vendinghive.model.MachineType;
import com.vendinghive.repository.ExcludedLocationRepository;
import com.vendinghive.repository.LocationDataRepository;
import com.vendinghive.repository.SearchHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 검색 이력 조회, 최근 리드, 통계
 */
@Service
@RequiredArgsConstructor
public class SearchHistoryService {

    static final int MAX_PAGE_SIZE = 100;
    static final int RECENT_DAYS = 30;
    static final int RECENT_LIMIT = 50;
    static final int TOP_ZIP_CODES = 5;

    private final SearchHistoryRepository searchHistoryRepository;
    private final LocationDataRepository locationDataRepository;
    private final ExcludedLocationRepository excludedLocationRepository;

    @Transactional(readOnly = true)
    public Page<SearchHistoryResponse> list(String operatorId, int page, int size) {
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        return searchHistoryRepository.findByOperatorIdOrderByCreatedAtDesc(operatorId, pageRequest)
                .map(SearchHistoryResponse::summary);
    }

    @Transactional(readOnly = true)
    public SearchHistoryResponse detail(String operatorId, UUID searchId) {
        return searchHistoryRepository.findByIdAndOperatorId(searchId, operatorId)
                .map(SearchHistoryResponse::detail)
                .orElseThrow(() -> new ResourceNotFoundException("Search not found: " + searchId));
    }

    /**
     * 최근 30일 검색 결과 중 점수 높은 순 최대 50개
     */
    @Transactional(readOnly = true)
    public List<RankedLocationResponse> recentLocations(String operatorId) {
        LocalDateTime since = LocalDateTime.now().minusDays(RECENT_DAYS);
        return locationDataRepository.findRecentForOperator(operatorId, since, PageRequest.of(0, RECENT_LIMIT)).stream()
                .map(RankedLocationResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public LocatorStatsResponse stats(String operatorId) {
        LocalDateTime monthStart = LocalDate.now().withDayOfMonth(1).atStartOfDay();

        Double average = searchHistoryRepository.averageResultCount(operatorId);
        List<Object[]> byMachineType = searchHistoryRepository.countByMachineType(operatorId);
        MachineType favorite = byMachineType.isEmpty() ? null : (MachineType) byMachineType.get(0)[0];

        List<LocatorStatsResponse.ZipCodeCount> topZipCodes = searchHistoryRepository
                .countByZipCode(operatorId, PageRequest.of(0, TOP_ZIP_CODES)).stream()
                .map(row -> new LocatorStatsResponse.ZipCodeCount((String) row[0], ((Number) row[1]).longValue()))
                .collect(Collectors.toList());

        return LocatorStatsResponse.builder()
                .totalSearches(searchHistoryRepository.countByOperatorId(operatorId))
                .searchesThisMonth(searchHistoryRepository.countByOperatorIdAndCreatedAtGreaterThanEqual(operatorId, monthStart))
                .averageResults(average == null ? 0.0 : Math.round(average * 10) / 10.0)
                .favoriteMachineType(favorite)
                .topZipCodes(topZipCodes)
                .excludedLocations(excludedLocationRepository.countByOperatorId(operatorId))
                .build();
    }
}
