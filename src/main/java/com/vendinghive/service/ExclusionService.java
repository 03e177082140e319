package com.vendinghive.service;

import com.vendinghive.dto.request.BulkExclusionRequest;
import com.vendinghive.dto.request.ExclusionRequest;
import com.vendinghive.dto.response.BulkExclusionResponse;
import com.vendinghive.dto.response.ExclusionResponse;
import com.vendinghive.entity.ExcludedLocation;
import com.vendinghive.entity.LocationData;
import com.vendinghive.exception.DuplicateExclusionException;
import com.vendinghive.exception.InvalidRequestException;
import com.vendinghive.exception.ResourceNotFoundException;
import com.vendinghive.model.ExclusionReason;
import com.vendinghive.repository.ExcludedLocationRepository;
import com.vendinghive.repository.LocationDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 제외 목록 관리. 제외 항목은 생성/삭제만 가능
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExclusionService {

    private final ExcludedLocationRepository excludedLocationRepository;
    private final LocationDataRepository locationDataRepository;

    @Transactional(readOnly = true)
    public List<ExclusionResponse> list(String operatorId) {
        return excludedLocationRepository.findByOperatorIdOrderByCreatedAtDesc(operatorId).stream()
                .map(ExclusionResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public ExclusionResponse create(String operatorId, ExclusionRequest request) {
        if (StringUtils.isBlank(request.getProviderId())) {
            throw new InvalidRequestException("provider_id", "provider_id is required");
        }
        if (StringUtils.isBlank(request.getLocationName())) {
            throw new InvalidRequestException("location_name", "location_name is required");
        }
        String providerId = request.getProviderId().trim();
        ExclusionReason reason = ExclusionReason.fromCode(request.getReason());

        if (excludedLocationRepository.existsByOperatorIdAndProviderId(operatorId, providerId)) {
            throw new DuplicateExclusionException(providerId);
        }

        ExcludedLocation excluded = ExcludedLocation.builder()
                .operatorId(operatorId)
                .providerId(providerId)
                .locationName(request.getLocationName().trim())
                .reason(reason)
                .notes(StringUtils.trimToNull(request.getNotes()))
                .build();
        try {
            ExcludedLocation saved = excludedLocationRepository.saveAndFlush(excluded);
            log.info("[ExclusionService] operator {} excluded {} ({})", operatorId, providerId, reason.getCode());
            return ExclusionResponse.from(saved);
        } catch (DataIntegrityViolationException e) {
            // 동시 요청으로 unique 제약 위반
            throw new DuplicateExclusionException(providerId);
        }
    }

    @Transactional
    public void delete(String operatorId, Long exclusionId) {
        ExcludedLocation excluded = excludedLocationRepository.findByIdAndOperatorId(exclusionId, operatorId)
                .orElseThrow(() -> new ResourceNotFoundException("Excluded location not found: " + exclusionId));
        excludedLocationRepository.delete(excluded);
        log.info("[ExclusionService] operator {} removed exclusion {}", operatorId, excluded.getProviderId());
    }

    /**
     * 검색 결과(LocationData) 여러 개를 한 번에 제외. 이미 제외된 장소는 기존 항목을 그대로 반환
     */
    @Transactional
    public BulkExclusionResponse bulkExclude(String operatorId, BulkExclusionRequest request) {
        if (request.getLocationIds() == null || request.getLocationIds().isEmpty()) {
            throw new InvalidRequestException("location_ids", "location_ids must not be empty");
        }
        ExclusionReason reason = ExclusionReason.fromCode(request.getReason());
        Set<Long> requestedIds = new LinkedHashSet<>(request.getLocationIds());

        List<LocationData> locations = locationDataRepository.findOwnedByOperator(requestedIds, operatorId);
        Set<Long> foundIds = locations.stream().map(LocationData::getId).collect(Collectors.toSet());

        List<ExclusionResponse> exclusions = new ArrayList<>();
        Set<String> handledProviderIds = new HashSet<>();
        int created = 0;
        int existing = 0;
        for (LocationData location : locations) {
            if (!handledProviderIds.add(location.getProviderId())) {
                continue;
            }
            Optional<ExcludedLocation> current =
                    excludedLocationRepository.findByOperatorIdAndProviderId(operatorId, location.getProviderId());
            if (current.isPresent()) {
                existing++;
                exclusions.add(ExclusionResponse.from(current.get()));
                continue;
            }
            ExcludedLocation saved = excludedLocationRepository.save(ExcludedLocation.builder()
                    .operatorId(operatorId)
                    .providerId(location.getProviderId())
                    .locationName(location.getName())
                    .reason(reason)
                    .notes(StringUtils.trimToNull(request.getNotes()))
                    .build());
            created++;
            exclusions.add(ExclusionResponse.from(saved));
        }

        List<Long> notFound = requestedIds.stream()
                .filter(id -> !foundIds.contains(id))
                .collect(Collectors.toList());
        log.info("[ExclusionService] bulk exclusion for operator {} - created: {}, existing: {}, not found: {}",
                operatorId, created, existing, notFound.size());

        return BulkExclusionResponse.builder()
                .createdCount(created)
                .alreadyExcludedCount(existing)
                .notFoundIds(notFound)
                .exclusions(exclusions)
                .build();
    }
}
