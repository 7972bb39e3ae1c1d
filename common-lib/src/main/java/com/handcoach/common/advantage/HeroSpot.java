package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.hand.Holding;

/**
 * Hero's concrete holding against the villain's range on one street.
 *
 * @param beatsPct estimated share of the villain range hero is ahead of, 0–100
 * @param flipped  hero moved from ahead to behind, or back, since the previous street
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeroSpot(
    @JsonProperty("holding") Holding holding,
    @JsonProperty("description") String description,
    @JsonProperty("beats_pct") double beatsPct,
    @JsonProperty("ahead") boolean ahead,
    @JsonProperty("flipped") boolean flipped,
    @JsonProperty("flip_note") String flipNote
) {}
