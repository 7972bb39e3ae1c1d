package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Street {
    PREFLOP(0), FLOP(3), TURN(4), RIVER(5);

    private final int boardSize;

    Street(int boardSize) {
        this.boardSize = boardSize;
    }

    /** Community cards visible on this street. */
    public int boardSize() { return boardSize; }

    @JsonCreator
    public static Street from(String text) {
        if (text == null) return null;
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "preflop", "pre-flop", "pre" -> PREFLOP;
            case "flop" -> FLOP;
            case "turn" -> TURN;
            case "river" -> RIVER;
            default -> null;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
