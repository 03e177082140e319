package com.vendinghive.service.ranking;

import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.SearchRadius;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 기본값 적용이 끝난 검색 조건
 */
@Value
@Builder
public class SearchCriteria {

    String zipCode;
    SearchRadius radius;
    MachineType machineType;
    Set<BuildingType> buildingTypes;
    int maxResults;
    boolean requireContactInfo;
    BigDecimal minimumRating;
    Set<String> excludedCategories;

    public boolean hasBuildingFilter() {
        return buildingTypes != null && !buildingTypes.isEmpty();
    }

    public Set<PlaceCategory> buildingCategories() {
        Set<PlaceCategory> categories = EnumSet.noneOf(PlaceCategory.class);
        if (buildingTypes != null) {
            buildingTypes.forEach(type -> categories.add(type.getCategory()));
        }
        return categories;
    }

    /**
     * provider 에 요청할 카테고리
     * 건물 유형 필터가 없으면 자판기 종류의 카테고리 전부,
     * 있으면 자판기 카테고리와의 교집합 (교집합이 비면 건물 유형 카테고리)
     */
    public Set<PlaceCategory> providerCategories() {
        if (!hasBuildingFilter()) {
            return EnumSet.copyOf(machineType.getCategories());
        }
        Set<PlaceCategory> building = buildingCategories();
        Set<PlaceCategory> narrowed = EnumSet.copyOf(machineType.getCategories());
        narrowed.retainAll(building);
        return narrowed.isEmpty() ? building : narrowed;
    }

    /**
     * 필터 통과 기준이 되는 카테고리
     */
    public Set<PlaceCategory> eligibleCategories() {
        return hasBuildingFilter() ? buildingCategories() : EnumSet.copyOf(machineType.getCategories());
    }

    /**
     * 응답/검색 이력에 남기는 적용 값
     */
    public Map<String, Object> toParameterMap() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("zip_code", zipCode);
        parameters.put("radius", radius.getMiles());
        parameters.put("machine_type", machineType.getCode());
        parameters.put("building_types", buildingTypes.stream().map(BuildingType::getCode).collect(Collectors.toList()));
        parameters.put("max_results", maxResults);
        parameters.put("require_contact_info", requireContactInfo);
        parameters.put("minimum_rating", minimumRating);
        parameters.put("excluded_categories", List.copyOf(excludedCategories));
        return parameters;
    }
}
