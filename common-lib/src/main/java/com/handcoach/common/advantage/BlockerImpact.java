package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BlockerImpact {
    NONE, MODERATE, STRONG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
