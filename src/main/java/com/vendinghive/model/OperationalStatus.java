package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 영업 상태
 */
public enum OperationalStatus {
    OPERATIONAL("operational"),
    CLOSED_TEMPORARILY("closed_temporarily"),
    CLOSED_PERMANENTLY("closed_permanently"),
    UNKNOWN("unknown");

    private final String code;

    OperationalStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Google Places business_status 값 변환 (OPERATIONAL 등). 모르는 값은 UNKNOWN
     */
    public static OperationalStatus fromGoogleStatus(String businessStatus) {
        if (businessStatus == null) {
            return UNKNOWN;
        }
        switch (businessStatus.trim().toUpperCase(Locale.ROOT)) {
            case "OPERATIONAL":
                return OPERATIONAL;
            case "CLOSED_TEMPORARILY":
                return CLOSED_TEMPORARILY;
            case "CLOSED_PERMANENTLY":
                return CLOSED_PERMANENTLY;
            default:
                return UNKNOWN;
        }
    }
}
