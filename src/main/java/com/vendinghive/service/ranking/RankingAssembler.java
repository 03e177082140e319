package com.vendinghive.service.ranking;

import com.vendinghive.dto.response.LocationSearchResponse;
import com.vendinghive.dto.response.RankedLocationResponse;
import com.vendinghive.entity.LocationData;
import com.vendinghive.entity.SearchHistory;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.GeoPoint;
import com.vendinghive.model.ProviderSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 정렬, 개수 제한, 응답 및 검색 이력 레코드 생성
 */
public class RankingAssembler {

    private final int maxResultsCeiling;

    public RankingAssembler(int maxResultsCeiling) {
        this.maxResultsCeiling = maxResultsCeiling;
    }

    /**
     * 점수 순 정렬 후 min(요청 개수, 상한) 개만 남김
     */
    public List<CandidateLocation> rank(Collection<CandidateLocation> candidates, int requestedMax) {
        int limit = Math.max(0, Math.min(requestedMax, maxResultsCeiling));
        return candidates.stream()
                .sorted(CandidateOrdering.RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * 저장 전 SearchHistory (순위별 LocationData 포함)
     */
    public SearchHistory toHistory(SearchContext context, SearchCriteria criteria, GeoPoint center,
                                   List<CandidateLocation> ranked, Map<String, String> providerErrors) {
        SearchHistory history = SearchHistory.builder()
                .operatorId(context.getOperatorId())
                .zipCode(criteria.getZipCode())
                .radius(criteria.getRadius().getMiles())
                .machineType(criteria.getMachineType())
                .buildingTypes(criteria.getBuildingTypes().isEmpty()
                        ? EnumSet.noneOf(BuildingType.class)
                        : EnumSet.copyOf(criteria.getBuildingTypes()))
                .resultCount(ranked.size())
                .searchParameters(parameters(criteria, center, providerErrors))
                .build();

        int rank = 1;
        for (CandidateLocation candidate : ranked) {
            history.addLocation(toLocationData(candidate, rank++));
        }
        return history;
    }

    public LocationSearchResponse toResponse(List<CandidateLocation> ranked, Map<String, String> providerErrors,
                                             SearchCriteria criteria, GeoPoint center,
                                             SearchHistory recorded, List<String> warnings) {
        List<RankedLocationResponse> locations = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            RankedLocationResponse location = RankedLocationResponse.from(ranked.get(i), i + 1);
            if (recorded != null && i < recorded.getLocations().size()) {
                location.setId(recorded.getLocations().get(i).getId());
            }
            locations.add(location);
        }

        return LocationSearchResponse.builder()
                .locations(locations)
                .providerErrors(new LinkedHashMap<>(providerErrors))
                .resultCount(locations.size())
                .searchId(recorded != null ? recorded.getId() : null)
                .historyRecorded(recorded != null)
                .warnings(new ArrayList<>(warnings))
                .searchParameters(parameters(criteria, center, providerErrors))
                .build();
    }

    private Map<String, Object> parameters(SearchCriteria criteria, GeoPoint center, Map<String, String> providerErrors) {
        Map<String, Object> parameters = criteria.toParameterMap();
        if (center != null) {
            Map<String, Object> centerMap = new LinkedHashMap<>();
            centerMap.put("latitude", center.getLatitude());
            centerMap.put("longitude", center.getLongitude());
            parameters.put("center", centerMap);
        }
        parameters.put("provider_errors", new LinkedHashMap<>(providerErrors));
        return parameters;
    }

    private LocationData toLocationData(CandidateLocation candidate, int rank) {
        return LocationData.builder()
                .rankPosition(rank)
                .providerId(candidate.getProviderId())
                .googlePlaceId(candidate.getGooglePlaceId())
                .osmId(candidate.getOsmId())
                .sources(candidate.getSources().stream().map(ProviderSource::getCode).collect(Collectors.joining(",")))
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
}
