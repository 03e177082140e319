package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 위치 검색 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LocationSearchResponse {
    @Builder.Default
    private List<RankedLocationResponse> locations = new ArrayList<>();
    @Builder.Default
    private Map<String, String> providerErrors = new LinkedHashMap<>(); // provider 코드 -> 실패 사유
    private Integer resultCount;
    private UUID searchId; // 기록 실패 시 null
    private Boolean historyRecorded;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private Map<String, Object> searchParameters; // 실제 적용된 값
}
