package com.vendinghive.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vendinghive.exception.InvalidRequestException;

import java.util.Locale;

/**
 * 운영자가 후보를 제외한 사유
 */
public enum ExclusionReason {
    ALREADY_CONTACTED("already_contacted"),
    NOT_INTERESTED("not_interested"),
    POOR_LOCATION("poor_location"),
    CLOSED("closed"),
    OTHER("other");

    private final String code;

    ExclusionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** null/빈 값이면 OTHER */
    public static ExclusionReason fromCode(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExclusionReason reason : values()) {
            if (reason.code.equals(normalized)) {
                return reason;
            }
        }
        throw new InvalidRequestException("reason", "Invalid exclusion reason: " + value);
    }
}
