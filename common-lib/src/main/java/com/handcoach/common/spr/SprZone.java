package com.handcoach.common.spr;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Commitment zone for a stack-to-pot ratio.
 *
 * <pre>
 *   spr &gt; 13       HIGH
 *   8 &lt; spr ≤ 13  MEDIUM_HIGH
 *   4 &lt; spr ≤ 8   MEDIUM
 *   2 &lt; spr ≤ 4   LOW
 *   spr ≤ 2        COMMITTED
 * </pre>
 */
public enum SprZone {
    HIGH, MEDIUM_HIGH, MEDIUM, LOW, COMMITTED;

    public static SprZone of(double spr) {
        if (spr > 13) return HIGH;
        if (spr > 8) return MEDIUM_HIGH;
        if (spr > 4) return MEDIUM;
        if (spr > 2) return LOW;
        return COMMITTED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
