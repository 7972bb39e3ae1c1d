package com.handcoach.common.classifier;

import com.fasterxml.jackson.annotation.JsonValue;
import com.handcoach.common.model.Street;

import java.util.Locale;

/**
 * Cause assigned to a mistake. Declaration order is the assignment priority, and also breaks
 * ties when leaks are ranked by frequency.
 */
public enum LeakCategory {
    SPR_AWARENESS("SPR awareness"),
    EQUITY_MISCALCULATION("Pot odds calculations"),
    RANGE_AWARENESS("Range awareness"),
    POSTFLOP_VALUE("Missing value bets"),
    POSTFLOP_BLUFF("Bluffing too much"),
    PREFLOP_MISTAKE("Preflop decision-making"),
    FLOP_MISTAKE("Flop strategy"),
    TURN_MISTAKE("Turn strategy"),
    RIVER_MISTAKE("River strategy");

    private final String displayName;

    LeakCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static LeakCategory forStreet(Street street) {
        return switch (street) {
            case PREFLOP -> PREFLOP_MISTAKE;
            case FLOP -> FLOP_MISTAKE;
            case TURN -> TURN_MISTAKE;
            case RIVER -> RIVER_MISTAKE;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
