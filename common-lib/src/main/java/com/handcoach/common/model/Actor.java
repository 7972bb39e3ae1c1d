package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Actor {
    HERO, VILLAIN;

    public static Actor from(String text) {
        if (text == null) return null;
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "hero", "me", "self" -> HERO;
            case "villain", "opponent", "villian" -> VILLAIN;
            default -> null;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
