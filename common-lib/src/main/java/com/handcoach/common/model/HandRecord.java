package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A persisted hand as it arrives from the upload pipeline. Fields are kept as raw text so that
 * validation can report malformed input with a precise message instead of a binding error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HandRecord(
    @JsonProperty("hand_id") String handId,
    @JsonProperty("hero_cards") String heroCards,
    @JsonProperty("board") String board,
    @JsonProperty("positions") Seats positions,
    @JsonProperty("actions") List<RawAction> actions,
    @JsonProperty("stacks") Stacks stacks,
    @JsonProperty("pot_sizes") PotSizes potSizes,
    @JsonProperty("big_blind") Double bigBlind,
    @JsonProperty("last_bet") Double lastBet
) {
    public record Seats(
        @JsonProperty("hero") String hero,
        @JsonProperty("villain") String villain
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RawAction(
        @JsonProperty("street") String street,
        @JsonProperty("actor") String actor,
        @JsonProperty("type") String type,
        @JsonProperty("amount") Double amount
    ) {
        public static RawAction of(String street, String actor, String type, Double amount) {
            return new RawAction(street, actor, type, amount);
        }
    }
}
