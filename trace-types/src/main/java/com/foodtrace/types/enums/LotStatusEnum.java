package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lot lifecycle status. Legal moves between them live in the domain transition policy.
 */
public enum LotStatusEnum {

    CREATED("created"),

    QUARANTINE("quarantine"),

    RELEASED("released"),

    HOLD("hold"),

    REJECTED("rejected"),

    CONSUMED("consumed"),

    FINISHED("finished");

    private final String code;

    LotStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LotStatusEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (LotStatusEnum value : LotStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lot status: " + text);
    }
}
