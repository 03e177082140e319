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
 * 위치 검색 요청 DTO
 * radius / machine_type 이 비어있으면 저장된 선호 설정에서 채움
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LocationSearchRequest {
    private String zipCode; // 12345 또는 12345-6789
    private Integer radius; // 마일: 5, 10, 15, 20, 25, 30, 40
    private String machineType; // snack_machine 또는 snack
    private List<String> buildingTypes;
    private String operatorId;
    private Integer maxResults; // 미지정이면 20, 최대 100
    private Boolean requireContactInfo;
    private BigDecimal minimumRating;
}
