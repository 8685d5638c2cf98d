package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Flow version lifecycle status.
 */
public enum FlowVersionStatusEnum {

    /**
     * Editable. At most one per definition.
     */
    DRAFT("draft"),

    /**
     * Staged for review; graph no longer editable until returned to draft.
     */
    REVIEW("review"),

    /**
     * Frozen; runs may be created from it.
     */
    PUBLISHED("published"),

    /**
     * Terminal, kept for audit.
     */
    DEPRECATED("deprecated");

    private final String code;

    FlowVersionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Graph of a PUBLISHED or DEPRECATED version is write-once.
     */
    public boolean isImmutable() {
        return this == PUBLISHED || this == DEPRECATED;
    }

    public static FlowVersionStatusEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (FlowVersionStatusEnum value : FlowVersionStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown flow version status: " + text);
    }
}
