package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running pot total at the start of each street. A {@code null} or non-positive entry means
 * the street was never reached.
 */
public record PotSizes(
    @JsonProperty("preflop") Double preflop,
    @JsonProperty("flop") Double flop,
    @JsonProperty("turn") Double turn,
    @JsonProperty("river") Double river
) {
    public Double get(Street street) {
        return switch (street) {
            case PREFLOP -> preflop;
            case FLOP -> flop;
            case TURN -> turn;
            case RIVER -> river;
        };
    }

    public boolean isReached(Street street) {
        Double pot = get(street);
        return pot != null && pot > 0;
    }

    /** Pot of the latest reached street, 0 when nothing is set. */
    public double latest() {
        for (int i = Street.values().length - 1; i >= 0; i--) {
            Street s = Street.values()[i];
            if (isReached(s)) return get(s);
        }
        return 0.0;
    }
}
