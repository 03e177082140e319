package com.vendinghive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 정규화된 후보 장소 (검색 1회 동안만 존재)
 * 두 provider 의 레코드가 이 형태로 변환된 뒤 병합/점수화/필터링됨
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidateLocation {

    public static final int COORDINATE_SCALE = 6;

    private String providerId; // Google place_id 가 있으면 그 값, 없으면 osm:<type>/<id>
    private String googlePlaceId;
    private String osmId;

    @Builder.Default
    private Set<ProviderSource> sources = EnumSet.noneOf(ProviderSource.class);

    private String name;
    private String category; // OSM 기반 (amenity:restaurant)
    private String detailedCategory; // Google types 상위 3개

    @Builder.Default
    private Set<PlaceCategory> placeCategories = EnumSet.noneOf(PlaceCategory.class);

    private BigDecimal latitude;
    private BigDecimal longitude;
    private String address;

    private String phone;
    private String email;
    private String website;
    private String mapsUrl;
    private String businessHours;

    private Double rating; // 0-5
    private Integer reviewCount;

    @Builder.Default
    private OperationalStatus operationalStatus = OperationalStatus.UNKNOWN;
    private FootTraffic footTraffic;

    private int priorityScore;
    private ContactCompleteness contactCompleteness;

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public boolean hasContactInfo() {
        return hasPhone() || hasEmail();
    }

    public boolean isFromGoogle() {
        return googlePlaceId != null && !googlePlaceId.isBlank();
    }

    public GeoPoint toGeoPoint() {
        return new GeoPoint(latitude.doubleValue(), longitude.doubleValue());
    }

    /**
     * 제외 목록 대조에 쓰이는 모든 provider id
     */
    public Set<String> allProviderIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (providerId != null) {
            ids.add(providerId);
        }
        if (googlePlaceId != null) {
            ids.add(googlePlaceId);
        }
        if (osmId != null) {
            ids.add(osmId);
        }
        return ids;
    }

    public static BigDecimal toCoordinate(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_UP);
    }
}
