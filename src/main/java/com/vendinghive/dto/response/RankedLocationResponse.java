package com.vendinghive.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendinghive.entity.LocationData;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.ContactCompleteness;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.ProviderSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 순위가 매겨진 후보 장소 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RankedLocationResponse {
    private Long id; // 저장된 LocationData id (일괄 제외에 사용), 기록 실패 시 null
    private Integer rank;
    private String providerId;
    private String googlePlaceId;
    private String osmId;
    private List<String> sources;
    private String name;
    private String category;
    private String detailedCategory;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String address;
    private String phone;
    private String email;
    private String website;
    private String mapsUrl;
    private String businessHours;
    private Double rating;
    private Integer reviewCount;
    private OperationalStatus operationalStatus;
    private FootTraffic footTraffic;
    private Integer priorityScore;
    private ContactCompleteness contactCompleteness;

    public static RankedLocationResponse from(CandidateLocation candidate, int rank) {
        return RankedLocationResponse.builder()
                .rank(rank)
                .providerId(candidate.getProviderId())
                .googlePlaceId(candidate.getGooglePlaceId())
                .osmId(candidate.getOsmId())
                .sources(candidate.getSources().stream().map(ProviderSource::getCode).collect(Collectors.toList()))
                .name(candidate.getName())
                .category(candidate.getCategory())
                .detailedCategory(candidate.getDetailedCategory())
                .latitude(candidate.getLatitude())
                .longitude(candidate.getLongitude())
                .address(candidate.getAddress())
                .phone(candidate.getPhone())
                .email(candidate.getEmail())
                .website(candidate.getWebsite())
                .mapsUrl(candidate.getMapsUrl())
                .businessHours(candidate.getBusinessHours())
                .rating(candidate.getRating())
                .reviewCount(candidate.getReviewCount())
                .operationalStatus(candidate.getOperationalStatus())
                .footTraffic(candidate.getFootTraffic())
                .priorityScore(candidate.getPriorityScore())
                .contactCompleteness(candidate.getContactCompleteness())
                .build();
    }

    public static RankedLocationResponse from(LocationData data) {
        List<String> sources = data.getSources() == null || data.getSources().isBlank()
                ? new ArrayList<>()
                : Arrays.asList(data.getSources().split(","));
        return RankedLocationResponse.builder()
                .id(data.getId())
                .rank(data.getRankPosition())
                .providerId(data.getProviderId())
                .googlePlaceId(data.getGooglePlaceId())
                .osmId(data.getOsmId())
                .sources(sources)
                .name(data.getName())
                .category(data.getCategory())
                .detailedCategory(data.getDetailedCategory())
                .latitude(data.getLatitude())
                .longitude(data.getLongitude())
                .address(data.getAddress())
                .phone(data.getPhone())
                .email(data.getEmail())
                .website(data.getWebsite())
                .mapsUrl(data.getMapsUrl())
                .businessHours(data.getBusinessHours())
                .rating(data.getRating())
                .reviewCount(data.getReviewCount())
                .operationalStatus(data.getOperationalStatus())
                .footTraffic(data.getFootTraffic())
                .priorityScore(data.getPriorityScore())
                .contactCompleteness(data.getContactCompleteness())
                .build();
    }
}
