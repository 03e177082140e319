package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendinghive.model.MachineType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 운영자 검색 통계 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LocatorStatsResponse {
    private Long totalSearches;
    private Long searchesThisMonth;
    private Double averageResults;
    private MachineType favoriteMachineType; // 검색 기록이 없으면 null
    private List<ZipCodeCount> topZipCodes;
    private Long excludedLocations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ZipCodeCount {
        private String zipCode;
        private Long searches;
    }
}
