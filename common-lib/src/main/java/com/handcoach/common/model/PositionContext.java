package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Seat relationship for one hand, computed once and passed to every stage that needs it.
 */
public record PositionContext(
    @JsonProperty("hero") TablePosition hero,
    @JsonProperty("villain") TablePosition villain,
    @JsonProperty("hero_in_position") boolean heroInPosition
) {
    public static PositionContext of(TablePosition hero, TablePosition villain) {
        Objects.requireNonNull(hero, "hero");
        Objects.requireNonNull(villain, "villain");
        return new PositionContext(hero, villain, hero.postflopOrder() > villain.postflopOrder());
    }

    /** Whether hero acts after villain on {@code street}. */
    public boolean heroActsLast(Street street) {
        if (street == Street.PREFLOP) {
            return hero.preflopOrder() > villain.preflopOrder();
        }
        return heroInPosition;
    }
}
