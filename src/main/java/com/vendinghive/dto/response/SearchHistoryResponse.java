package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendinghive.entity.SearchHistory;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchHistoryResponse {
    private UUID id;
    private String zipCode;
    private Integer radius;
    private MachineType machineType;
    private List<BuildingType> buildingTypes;
    private Integer resultCount;
    private Map<String, Object> searchParameters;
    private LocalDateTime createdAt;
    private List<RankedLocationResponse> locations; // 상세 조회에서만 채움

    public static SearchHistoryResponse summary(SearchHistory history) {
        return SearchHistoryResponse.builder()
                .id(history.getId())
                .zipCode(history.getZipCode())
                .radius(history.getRadius())
                .machineType(history.getMachineType())
                .buildingTypes(List.copyOf(history.getBuildingTypes()))
                .resultCount(history.getResultCount())
                .searchParameters(history.getSearchParameters())
                .createdAt(history.getCreatedAt())
                .build();
    }

    public static SearchHistoryResponse detail(SearchHistory history) {
        SearchHistoryResponse response = summary(history);
        response.setLocations(history.getLocations().stream()
                .map(RankedLocationResponse::from)
                .collect(Collectors.toList()));
        return response;
    }
}
