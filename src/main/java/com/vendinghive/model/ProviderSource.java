package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 후보 장소 데이터를 제공하는 외부 지리 데이터 소스
 */
public enum ProviderSource {
    OPENSTREETMAP("openstreetmap"),
    GOOGLE_PLACES("google_places");

    private final String code;

    ProviderSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
