package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BulkExclusionResponse {
    private Integer createdCount;
    private Integer alreadyExcludedCount;
    @Builder.Default
    private List<Long> notFoundIds = new ArrayList<>(); // 없거나 다른 운영자의 결과
    @Builder.Default
    private List<ExclusionResponse> exclusions = new ArrayList<>();
}
