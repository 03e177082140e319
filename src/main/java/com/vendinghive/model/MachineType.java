package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vendinghive.exception.InvalidMachineTypeException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.vendinghive.model.PlaceCategory.*;

/**
 * 자판기 종류 카탈로그
 * 각 종류마다 설치 후보로 적합한 장소 카테고리 목록을 가짐
 */
public enum MachineType {
    SNACK_MACHINE("snack_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, CAFE, CONVENIENCE, FUEL, OFFICE, HOSPITAL, SCHOOL, FITNESS_CENTRE)),
    DRINK_MACHINE("drink_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, CAFE, CONVENIENCE, FUEL, OFFICE, HOSPITAL, SCHOOL, FITNESS_CENTRE)),
    CLAW_MACHINE("claw_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, CAFE, HAIRDRESSER, FUEL, CONVENIENCE, ICE_CREAM, BAR)),
    HOT_FOOD_KIOSK("hot_food_kiosk",
            EnumSet.of(RESTAURANT, FAST_FOOD, OFFICE, HOSPITAL, SCHOOL, INDUSTRIAL)),
    ICE_CREAM_MACHINE("ice_cream_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, CAFE, CONVENIENCE, ATTRACTION, PARK)),
    COFFEE_MACHINE("coffee_machine",
            EnumSet.of(OFFICE, HOSPITAL, SCHOOL, INDUSTRIAL, UNIVERSITY, LIBRARY)),
    COMBO_MACHINE("combo_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, CAFE, CONVENIENCE, FUEL, OFFICE, HOSPITAL, SCHOOL, FITNESS_CENTRE)),
    HEALTHY_SNACK_MACHINE("healthy_snack_machine",
            EnumSet.of(OFFICE, HOSPITAL, SCHOOL, FITNESS_CENTRE, UNIVERSITY, REHABILITATION)),
    FRESH_FOOD_MACHINE("fresh_food_machine",
            EnumSet.of(OFFICE, HOSPITAL, SCHOOL, INDUSTRIAL, UNIVERSITY)),
    TOY_MACHINE("toy_machine",
            EnumSet.of(RESTAURANT, FAST_FOOD, HAIRDRESSER, CONVENIENCE, FUEL, LAUNDRY, BAR));

    private static final String SUFFIX = "_machine";

    private final String code;
    private final Set<PlaceCategory> categories;

    MachineType(String code, Set<PlaceCategory> categories) {
        this.code = code;
        this.categories = Collections.unmodifiableSet(categories);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Set<PlaceCategory> getCategories() {
        return categories;
    }

    /**
     * 코드 또는 "_machine" 을 뺀 축약형(예: "snack")으로 조회
     * @throws InvalidMachineTypeException 카탈로그에 없는 값
     */
    public static MachineType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidMachineTypeException(value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (MachineType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
            if (type.code.endsWith(SUFFIX)
                    && type.code.substring(0, type.code.length() - SUFFIX.length()).equals(normalized)) {
                return type;
            }
        }
        throw new InvalidMachineTypeException(value);
    }
}
