package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vendinghive.exception.InvalidBuildingTypeException;

import java.util.Locale;

/**
 * 검색 시 건물 유형 필터로 쓰이는 값
 */
public enum BuildingType {
    CHURCHES("churches", PlaceCategory.PLACE_OF_WORSHIP),
    FACTORIES("factories", PlaceCategory.INDUSTRIAL),
    HOTELS("hotels", PlaceCategory.HOTEL),
    REHABILITATION_CENTERS("rehabilitation_centers", PlaceCategory.REHABILITATION),
    GYMS("gyms", PlaceCategory.FITNESS_CENTRE),
    HOSPITALS("hospitals", PlaceCategory.HOSPITAL),
    TOWING_COMPANIES("towing_companies", PlaceCategory.CAR_REPAIR),
    LAUNDROMATS("laundromats", PlaceCategory.LAUNDRY),
    OFFICE_BUILDINGS("office_buildings", PlaceCategory.OFFICE),
    INDUSTRIAL_FACILITIES("industrial_facilities", PlaceCategory.INDUSTRIAL),
    DAYCARES("daycares", PlaceCategory.CHILDCARE),
    YMCAS("ymcas", PlaceCategory.FITNESS_CENTRE),
    RESTAURANTS("restaurants", PlaceCategory.RESTAURANT),
    FAST_FOOD("fast_food", PlaceCategory.FAST_FOOD),
    BARBERSHOPS("barbershops", PlaceCategory.HAIRDRESSER),
    GAS_STATIONS("gas_stations", PlaceCategory.FUEL),
    COFFEE_SHOPS("coffee_shops", PlaceCategory.CAFE);

    private final String code;
    private final PlaceCategory category;

    BuildingType(String code, PlaceCategory category) {
        this.code = code;
        this.category = category;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public PlaceCategory getCategory() {
        return category;
    }

    public static BuildingType fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (BuildingType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidBuildingTypeException(value);
    }
}
