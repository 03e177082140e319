package com.vendinghive.service;

import com.vendinghive.dto.request.PreferenceRequest;
import com.vendinghive.dto.response.PreferenceResponse;
import com.vendinghive.entity.UserLocationPreference;
import com.vendinghive.exception.InvalidRequestException;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import com.vendinghive.model.SearchRadius;
import com.vendinghive.repository.UserLocationPreferenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 운영자 선호 설정 조회/부분 업데이트 (없으면 첫 저장 시 생성)
 */
@Slf4j
@Service
public class PreferenceService {

    private static final BigDecimal MAX_RATING = BigDecimal.valueOf(5);

    private final UserLocationPreferenceRepository preferenceRepository;
    private final TransactionTemplate transactionTemplate;

    public PreferenceService(UserLocationPreferenceRepository preferenceRepository,
                             PlatformTransactionManager transactionManager) {
        this.preferenceRepository = preferenceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Transactional(readOnly = true)
    public Optional<PreferenceResponse> getPreference(String operatorId) {
        return preferenceRepository.findByOperatorId(operatorId).map(PreferenceResponse::from);
    }

    /**
     * 같은 운영자의 첫 저장이 동시에 들어와 unique 제약에 걸리면 새 트랜잭션에서 한 번 더 조회 후 갱신
     */
    public PreferenceResponse upsert(String operatorId, PreferenceRequest request) {
        try {
            return transactionTemplate.execute(status -> applyAndSave(operatorId, request));
        } catch (DataIntegrityViolationException e) {
            log.warn("[PreferenceService] concurrent first save for operator {}, retrying as update", operatorId);
            return transactionTemplate.execute(status -> applyAndSave(operatorId, request));
        }
    }

    private PreferenceResponse applyAndSave(String operatorId, PreferenceRequest request) {
        UserLocationPreference preference = preferenceRepository.findByOperatorId(operatorId)
                .orElseGet(() -> UserLocationPreference.builder().operatorId(operatorId).build());

        if (request.getPreferredMachineTypes() != null) {
            Set<MachineType> machineTypes = EnumSet.noneOf(MachineType.class);
            for (String code : request.getPreferredMachineTypes()) {
                machineTypes.add(MachineType.fromCode(code));
            }
            preference.setPreferredMachineTypes(new LinkedHashSet<>(machineTypes));
        }
        if (request.getPreferredRadius() != null) {
            preference.setPreferredRadius(SearchRadius.fromMiles(request.getPreferredRadius()).getMiles());
        }
        if (request.getPreferredBuildingTypes() != null) {
            Set<BuildingType> buildingTypes = EnumSet.noneOf(BuildingType.class);
            for (String code : request.getPreferredBuildingTypes()) {
                buildingTypes.add(BuildingType.fromCode(code));
            }
            preference.setPreferredBuildingTypes(new LinkedHashSet<>(buildingTypes));
        }
        if (request.getExcludedCategories() != null) {
            preference.setExcludedCategories(trimmed(request.getExcludedCategories()));
        }
        if (request.getMinimumRating() != null) {
            BigDecimal rating = request.getMinimumRating();
            if (rating.signum() < 0 || rating.compareTo(MAX_RATING) > 0) {
                throw new InvalidRequestException("minimum_rating", "Minimum rating must be between 0 and 5: " + rating);
            }
            preference.setMinimumRating(rating);
        }
        if (request.getRequireContactInfo() != null) {
            preference.setRequireContactInfo(request.getRequireContactInfo());
        }

        UserLocationPreference saved = preferenceRepository.saveAndFlush(preference);
        log.info("[PreferenceService] preferences saved for operator {}", operatorId);
        return PreferenceResponse.from(saved);
    }

    private Set<String> trimmed(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                result.add(value.trim());
            }
        }
        return result;
    }
}
