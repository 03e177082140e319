package com.vendinghive.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 선호 설정 부분 업데이트 요청. null 필드는 기존 값 유지
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PreferenceRequest {
    private List<String> preferredMachineTypes;
    private Integer preferredRadius;
    private List<String> preferredBuildingTypes;
    private List<String> excludedCategories;
    private BigDecimal minimumRating;
    private Boolean requireContactInfo;
}
