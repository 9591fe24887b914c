package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 社区对一次审核决定严厉程度的评价
 */
public enum SeverityRating {
    TOO_STRICT("too_strict"),
    ACCURATE("accurate"),
    TOO_LENIENT("too_lenient");

    private final String code;

    SeverityRating(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SeverityRating fromCode(String code) {
        for (SeverityRating rating : values()) {
            if (rating.code.equalsIgnoreCase(code)) {
                return rating;
            }
        }
        throw new ValidationException("Invalid severity rating: " + code);
    }
}
