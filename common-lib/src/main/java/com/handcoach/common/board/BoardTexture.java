package com.handcoach.common.board;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Board narrative for a hand: texture tags per post-flop street plus whole-board flags.
 * Produced either by the external narrative service or by {@link BoardTextureClassifier}.
 */
public record BoardTexture(
    @JsonProperty("streets") Map<Street, StreetTexture> streets,
    @JsonProperty("paired") boolean paired,
    @JsonProperty("flush_possible") boolean flushPossible,
    @JsonProperty("straight_possible") boolean straightPossible,
    @JsonProperty("summary") String summary
) {
    public BoardTexture {
        Map<Street, StreetTexture> copy = new EnumMap<>(Street.class);
        if (streets != null) copy.putAll(streets);
        streets = Collections.unmodifiableMap(copy);
    }

    /** Texture for a hand that ended before the flop. */
    public static BoardTexture notReached() {
        return new BoardTexture(Map.of(), false, false, false, "Hand ended preflop; no board to describe");
    }
}
