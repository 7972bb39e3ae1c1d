package com.handcoach.common.equity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EquityMethod {
    EXACT, HEURISTIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
