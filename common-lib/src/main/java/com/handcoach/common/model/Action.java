package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Action(
    @JsonProperty("street") Street street,
    @JsonProperty("actor") Actor actor,
    @JsonProperty("type") ActionType type,
    @JsonProperty("amount") Double amount
) {
    public Action {
        Objects.requireNonNull(street, "street");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(type, "type");
    }

    public static Action of(Street street, Actor actor, ActionType type) {
        return new Action(street, actor, type, null);
    }

    public static Action of(Street street, Actor actor, ActionType type, double amount) {
        return new Action(street, actor, type, amount);
    }

    public boolean isHero() {
        return actor == Actor.HERO;
    }

    public double amountOrZero() {
        return amount == null ? 0.0 : amount;
    }
}
