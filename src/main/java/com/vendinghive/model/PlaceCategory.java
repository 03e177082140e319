package com.vendinghive.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 자판기 설치 후보가 될 수 있는 장소 종류
 * OSM 태그(key=value)와 Google Places type 을 함께 가짐 (Google 에 대응 타입이 없으면 null)
 */
public enum PlaceCategory {
    RESTAURANT("amenity", "restaurant", "restaurant"),
    FAST_FOOD("amenity", "fast_food", "meal_takeaway"),
    CAFE("amenity", "cafe", "cafe"),
    BAR("amenity", "bar", "bar"),
    ICE_CREAM("amenity", "ice_cream", null),
    FUEL("amenity", "fuel", "gas_station"),
    HOSPITAL("amenity", "hospital", "hospital"),
    SCHOOL("amenity", "school", "school"),
    UNIVERSITY("amenity", "university", "university"),
    LIBRARY("amenity", "library", "library"),
    CHILDCARE("amenity", "childcare", null),
    PLACE_OF_WORSHIP("amenity", "place_of_worship", "church"),
    CONVENIENCE("shop", "convenience", "convenience_store"),
    HAIRDRESSER("shop", "hairdresser", "hair_care"),
    CAR_REPAIR("shop", "car_repair", "car_repair"),
    LAUNDRY("shop", "laundry", "laundry"),
    OFFICE("building", "office", null),
    INDUSTRIAL("building", "industrial", null),
    FITNESS_CENTRE("leisure", "fitness_centre", "gym"),
    PARK("leisure", "park", "park"),
    ATTRACTION("tourism", "attraction", "tourist_attraction"),
    HOTEL("tourism", "hotel", "lodging"),
    REHABILITATION("healthcare", "rehabilitation", null);

    private final String osmKey;
    private final String osmValue;
    private final String googleType;

    PlaceCategory(String osmKey, String osmValue, String googleType) {
        this.osmKey = osmKey;
        this.osmValue = osmValue;
        this.googleType = googleType;
    }

    public String getOsmKey() {
        return osmKey;
    }

    public String getOsmValue() {
        return osmValue;
    }

    public String getGoogleType() {
        return googleType;
    }

    public boolean hasGoogleType() {
        return googleType != null;
    }

    /**
     * OSM 태그 맵에서 매칭되는 카테고리 전부
     */
    public static Set<PlaceCategory> fromOsmTags(Map<String, String> tags) {
        Set<PlaceCategory> matched = EnumSet.noneOf(PlaceCategory.class);
        if (tags == null || tags.isEmpty()) {
            return matched;
        }
        for (PlaceCategory category : values()) {
            String value = tags.get(category.osmKey);
            if (value != null && category.osmValue.equalsIgnoreCase(value.trim())) {
                matched.add(category);
            }
        }
        return matched;
    }

    /**
     * Google Places types 리스트에서 매칭되는 카테고리 전부
     */
    public static Set<PlaceCategory> fromGoogleTypes(Collection<String> types) {
        Set<PlaceCategory> matched = EnumSet.noneOf(PlaceCategory.class);
        if (types == null || types.isEmpty()) {
            return matched;
        }
        for (String type : types) {
            String normalized = type.toLowerCase(Locale.ROOT);
            for (PlaceCategory category : values()) {
                if (normalized.equals(category.googleType)) {
                    matched.add(category);
                }
            }
            // 교회가 아닌 예배 장소는 place_of_worship 으로만 내려옴
            if (normalized.equals("place_of_worship")) {
                matched.add(PLACE_OF_WORSHIP);
            }
        }
        return matched;
    }
}
