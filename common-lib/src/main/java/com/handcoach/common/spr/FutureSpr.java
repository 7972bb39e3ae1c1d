package com.handcoach.common.spr;

import com.fasterxml.jackson.annotation.JsonProperty;

/** SPR on the next street if a bet of the given size is made and called now. */
public record FutureSpr(
    @JsonProperty("after_half_pot_bet") double afterHalfPotBet,
    @JsonProperty("after_pot_bet") double afterPotBet
) {}
