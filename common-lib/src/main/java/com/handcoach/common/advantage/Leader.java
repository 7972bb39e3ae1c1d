package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Leader {
    HERO, VILLAIN, EVEN;

    public Leader swapped() {
        return switch (this) {
            case HERO -> VILLAIN;
            case VILLAIN -> HERO;
            case EVEN -> EVEN;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
