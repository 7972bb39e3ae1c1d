package com.handcoach.common.range;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Strength bucket of a combo on a board, strongest first. */
public enum Bucket {
    MONSTER, STRONG, MARGINAL, DRAW_STRONG, DRAW_WEAK, AIR;

    public boolean isValue() {
        return this == MONSTER || this == STRONG;
    }

    public boolean isWeak() {
        return this == DRAW_WEAK || this == AIR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
