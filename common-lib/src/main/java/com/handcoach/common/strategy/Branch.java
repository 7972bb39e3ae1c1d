package com.handcoach.common.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Decision point within a street, named after what hero is facing. */
public enum Branch {
    INITIAL, VS_CHECK, VS_BET, VS_RAISE;

    @JsonCreator
    public static Branch from(String text) {
        if (text == null) return null;
        String key = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Branch b : values()) {
            if (b.name().equals(key)) return b;
        }
        return null;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
