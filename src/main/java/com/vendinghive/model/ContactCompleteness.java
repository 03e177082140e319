package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 연락처 보유 수준
 */
public enum ContactCompleteness {
    BOTH("both"),
    PHONE_ONLY("phone_only"),
    EMAIL_ONLY("email_only"),
    NONE("none");

    private final String code;

    ContactCompleteness(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ContactCompleteness of(boolean hasPhone, boolean hasEmail) {
        if (hasPhone && hasEmail) {
            return BOTH;
        }
        if (hasPhone) {
            return PHONE_ONLY;
        }
        return hasEmail ? EMAIL_ONLY : NONE;
    }
}
