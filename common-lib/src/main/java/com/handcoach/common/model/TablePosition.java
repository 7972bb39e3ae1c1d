package com.handcoach.common.model;

import java.util.Locale;
import java.util.Map;

/**
 * Seat at the table, ordered by post-flop action: the blinds act first, the button last.
 * Preflop the blinds move to the end: UTG opens and the big blind closes.
 */
public enum TablePosition {
    SB, BB, UTG, UTG1, MP, LJ, HJ, CO, BTN;

    private static final Map<String, TablePosition> ALIASES = Map.ofEntries(
        Map.entry("SMALLBLIND", SB), Map.entry("BIGBLIND", BB),
        Map.entry("EP", UTG), Map.entry("UTG+1", UTG1), Map.entry("UTG+2", MP),
        Map.entry("UTG2", MP), Map.entry("MP1", MP), Map.entry("MP2", LJ),
        Map.entry("LOJACK", LJ), Map.entry("HIJACK", HJ), Map.entry("CUTOFF", CO),
        Map.entry("BUTTON", BTN), Map.entry("DEALER", BTN), Map.entry("BU", BTN),
        Map.entry("D", BTN));

    public int postflopOrder() {
        return ordinal();
    }

    public int preflopOrder() {
        return isBlind() ? values().length + ordinal() : ordinal();
    }

    public boolean isBlind() {
        return this == SB || this == BB;
    }

    /** Parses seat names and their common aliases; {@code null} when unrecognised. */
    public static TablePosition from(String text) {
        if (text == null || text.isBlank()) return null;
        String key = text.trim().toUpperCase(Locale.ROOT).replace(" ", "").replace("_", "");
        for (TablePosition p : values()) {
            if (p.name().equals(key)) return p;
        }
        return ALIASES.get(key);
    }
}
