package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    FOLD, CHECK, CALL, BET, RAISE;

    public boolean isAggressive() {
        return this == BET || this == RAISE;
    }

    /** Lenient parse of hand-history verbs; an all-in is treated as a raise. */
    @JsonCreator
    public static ActionType from(String text) {
        if (text == null) return null;
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "fold", "folds" -> FOLD;
            case "check", "checks" -> CHECK;
            case "call", "calls", "limp", "limps" -> CALL;
            case "bet", "bets" -> BET;
            case "raise", "raises", "3bet", "3-bet", "4bet", "4-bet", "all-in", "allin", "shove", "jam" -> RAISE;
            default -> null;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
