package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 유동인구 추정 등급 (낮음 -> 높음 순서)
 */
public enum FootTraffic {
    VERY_LOW("very_low"),
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    VERY_HIGH("very_high");

    private final String code;

    FootTraffic(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
