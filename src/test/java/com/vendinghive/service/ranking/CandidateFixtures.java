package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;

import java.util.EnumSet;

final class CandidateFixtures {

    private CandidateFixtures() {
    }

    static CandidateLocation osm(String osmId, String name, double lat, double lon, PlaceCategory category) {
        return CandidateLocation.builder()
                .providerId(osmId)
                .osmId(osmId)
                .sources(EnumSet.of(ProviderSource.OPENSTREETMAP))
                .name(name)
                .category(category.getOsmKey() + ":" + category.getOsmValue())
                .placeCategories(EnumSet.of(category))
                .latitude(CandidateLocation.toCoordinate(lat))
                .longitude(CandidateLocation.toCoordinate(lon))
                .build();
    }

    static CandidateLocation google(String placeId, String name, double lat, double lon, PlaceCategory category) {
        return CandidateLocation.builder()
                .providerId(placeId)
                .googlePlaceId(placeId)
                .sources(EnumSet.of(ProviderSource.GOOGLE_PLACES))
                .name(name)
                .category(category.getGoogleType())
                .detailedCategory(category.getGoogleType())
                .placeCategories(EnumSet.of(category))
                .latitude(CandidateLocation.toCoordinate(lat))
                .longitude(CandidateLocation.toCoordinate(lon))
                .operationalStatus(OperationalStatus.OPERATIONAL)
                .build();
    }
}
