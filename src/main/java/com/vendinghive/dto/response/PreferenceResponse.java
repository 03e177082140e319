package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendinghive.entity.UserLocationPreference;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PreferenceResponse {
    private String operatorId;
    private List<MachineType> preferredMachineTypes;
    private Integer preferredRadius;
    private List<BuildingType> preferredBuildingTypes;
    private List<String> excludedCategories;
    private BigDecimal minimumRating;
    private Boolean requireContactInfo;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static PreferenceResponse from(UserLocationPreference preference) {
        return PreferenceResponse.builder()
                .operatorId(preference.getOperatorId())
                .preferredMachineTypes(List.copyOf(preference.getPreferredMachineTypes()))
                .preferredRadius(preference.getPreferredRadius())
                .preferredBuildingTypes(List.copyOf(preference.getPreferredBuildingTypes()))
                .excludedCategories(List.copyOf(preference.getExcludedCategories()))
                .minimumRating(preference.getMinimumRating())
                .requireContactInfo(preference.getRequireContactInfo())
                .createdAt(preference.getCreatedAt())
                .updatedAt(preference.getUpdatedAt())
                .build();
    }
}
