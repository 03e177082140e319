package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendinghive.entity.ExcludedLocation;
import com.vendinghive.model.ExclusionReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExclusionResponse {
    private Long id;
    private String providerId;
    private String locationName;
    private ExclusionReason reason;
    private String notes;
    private LocalDateTime createdAt;

    public static ExclusionResponse from(ExcludedLocation excluded) {
        return ExclusionResponse.builder()
                .id(excluded.getId())
                .providerId(excluded.getProviderId())
                .locationName(excluded.getLocationName())
                .reason(excluded.getReason())
                .notes(excluded.getNotes())
                .createdAt(excluded.getCreatedAt())
                .build();
    }
}
