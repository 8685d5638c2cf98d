package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lot type codes used on the production floor.
 */
public enum LotTypeEnum {

    RAW("raw"),
    DEB("deb"),
    BULK("bulk"),
    MIX("mix"),
    SKW("skw"),
    SKW15("skw15"),
    SKW30("skw30"),
    FRZ("frz"),
    FRZ15("frz15"),
    FRZ30("frz30"),
    FG("fg"),
    FG15("fg15"),
    FG30("fg30"),
    PAL("pal"),
    SHIP("ship");

    private final String code;

    LotTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LotTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (LotTypeEnum value : LotTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lot type: " + text);
    }
}
