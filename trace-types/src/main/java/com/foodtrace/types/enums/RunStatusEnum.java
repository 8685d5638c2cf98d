package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Production run status.
 */
public enum RunStatusEnum {

    /**
     * Created, steps instantiated, not started.
     */
    IDLE("idle"),

    RUNNING("running"),

    /**
     * Paused, e.g. by a failed CCP gate.
     */
    HOLD("hold"),

    COMPLETED("completed"),

    ABORTED("aborted"),

    ARCHIVED("archived");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == ABORTED || this == ARCHIVED;
    }

    public static RunStatusEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (RunStatusEnum value : RunStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + text);
    }
}
