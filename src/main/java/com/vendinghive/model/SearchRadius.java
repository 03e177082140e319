package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vendinghive.exception.InvalidRadiusException;

/**
 * 검색 반경 (마일 단위 고정 구간)
 */
public enum SearchRadius {
    MILES_5(5),
    MILES_10(10),
    MILES_15(15),
    MILES_20(20),
    MILES_25(25),
    MILES_30(30),
    MILES_40(40);

    public static final SearchRadius DEFAULT = MILES_10;

    private static final double METERS_PER_MILE = 1609.34;

    private final int miles;

    SearchRadius(int miles) {
        this.miles = miles;
    }

    @JsonValue
    public int getMiles() {
        return miles;
    }

    public int toMeters() {
        return (int) (miles * METERS_PER_MILE);
    }

    public static SearchRadius fromMiles(Integer miles) {
        if (miles != null) {
            for (SearchRadius radius : values()) {
                if (radius.miles == miles) {
                    return radius;
                }
            }
        }
        throw new InvalidRadiusException(miles);
    }
}
