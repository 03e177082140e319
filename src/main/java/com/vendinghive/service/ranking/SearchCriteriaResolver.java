package com.vendinghive.service.ranking;

import com.vendinghive.dto.request.LocationSearchRequest;
import com.vendinghive.entity.UserLocationPreference;
import com.vendinghive.exception.InvalidRequestException;
import com.vendinghive.exception.InvalidZipCodeException;
import com.vendinghive.exception.MissingSearchParameterException;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import com.vendinghive.model.SearchRadius;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 요청 값 검증 + 기본값 적용
 * 우선순위: 요청에 명시된 값 > 저장된 선호 설정 > 시스템 기본값
 * 반경과 자판기 종류는 시스템 기본값이 없어서 둘 다 없으면 실패
 */
public class SearchCriteriaResolver {

    private static final Pattern ZIP_CODE = Pattern.compile("^\\d{5}(-\\d{4})?$");
    private static final BigDecimal MAX_RATING = BigDecimal.valueOf(5);

    private final int defaultMaxResults;
    private final int maxResultsCeiling;

    public SearchCriteriaResolver(int defaultMaxResults, int maxResultsCeiling) {
        this.defaultMaxResults = defaultMaxResults;
        this.maxResultsCeiling = maxResultsCeiling;
    }

    public String requireOperatorId(LocationSearchRequest request) {
        if (StringUtils.isBlank(request.getOperatorId())) {
            throw new MissingSearchParameterException("operator_id");
        }
        return request.getOperatorId().trim();
    }

    public SearchCriteria resolve(LocationSearchRequest request, Optional<UserLocationPreference> preference) {
        return SearchCriteria.builder()
                .zipCode(resolveZipCode(request.getZipCode()))
                .radius(resolveRadius(request.getRadius(), preference))
                .machineType(resolveMachineType(request.getMachineType(), preference))
                .buildingTypes(resolveBuildingTypes(request.getBuildingTypes(), preference))
                .maxResults(resolveMaxResults(request.getMaxResults()))
                .requireContactInfo(request.getRequireContactInfo() != null
                        ? request.getRequireContactInfo()
                        : preference.map(UserLocationPreference::getRequireContactInfo).orElse(false))
                .minimumRating(resolveMinimumRating(request.getMinimumRating(), preference))
                .excludedCategories(preference
                        .map(p -> (Set<String>) new TreeSet<>(p.getExcludedCategories()))
                        .orElseGet(TreeSet::new))
                .build();
    }

    String resolveZipCode(String zipCode) {
        if (StringUtils.isBlank(zipCode)) {
            throw new MissingSearchParameterException("zip_code");
        }
        String trimmed = zipCode.trim();
        if (!ZIP_CODE.matcher(trimmed).matches()) {
            throw new InvalidZipCodeException(trimmed, "Invalid ZIP code format");
        }
        return trimmed;
    }

    SearchRadius resolveRadius(Integer requested, Optional<UserLocationPreference> preference) {
        if (requested != null) {
            return SearchRadius.fromMiles(requested);
        }
        return preference.map(UserLocationPreference::getPreferredSearchRadius)
                .orElseThrow(() -> new MissingSearchParameterException("radius"));
    }

    MachineType resolveMachineType(String requested, Optional<UserLocationPreference> preference) {
        if (StringUtils.isNotBlank(requested)) {
            return MachineType.fromCode(requested);
        }
        // 선호 종류가 여러 개면 카탈로그 순서상 첫 번째
        return preference.map(UserLocationPreference::getPreferredMachineTypes)
                .filter(types -> !types.isEmpty())
                .map(types -> EnumSet.copyOf(types).iterator().next())
                .orElseThrow(() -> new MissingSearchParameterException("machine_type"));
    }

    Set<BuildingType> resolveBuildingTypes(List<String> requested, Optional<UserLocationPreference> preference) {
        Set<BuildingType> resolved = EnumSet.noneOf(BuildingType.class);
        if (requested != null && requested.stream().anyMatch(StringUtils::isNotBlank)) {
            for (String code : requested) {
                if (StringUtils.isNotBlank(code)) {
                    resolved.add(BuildingType.fromCode(code));
                }
            }
            return resolved;
        }
        preference.ifPresent(p -> resolved.addAll(p.getPreferredBuildingTypes()));
        return resolved;
    }

    int resolveMaxResults(Integer requested) {
        int value = requested == null || requested <= 0 ? defaultMaxResults : requested;
        return Math.min(value, maxResultsCeiling);
    }

    BigDecimal resolveMinimumRating(BigDecimal requested, Optional<UserLocationPreference> preference) {
        if (requested != null) {
            if (requested.signum() < 0 || requested.compareTo(MAX_RATING) > 0) {
                throw new InvalidRequestException("minimum_rating", "Minimum rating must be between 0 and 5: " + requested);
            }
            return requested;
        }
        return preference.map(UserLocationPreference::getMinimumRating).orElse(BigDecimal.ZERO);
    }
}
