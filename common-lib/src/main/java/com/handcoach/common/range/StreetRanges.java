package com.handcoach.common.range;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

/**
 * Both ranges on one street: as they stood when the street began (board dealt, nothing yet
 * done) and after every action on the street was applied. {@code heroHandShareAhead} is the
 * percentage of hero's entering range holding a stronger hand than hero's actual cards.
 */
public record StreetRanges(
    @JsonProperty("street") Street street,
    @JsonProperty("hero") RangeStats hero,
    @JsonProperty("villain") RangeStats villain,
    @JsonProperty("hero_after_action") RangeStats heroAfterAction,
    @JsonProperty("villain_after_action") RangeStats villainAfterAction,
    @JsonProperty("hero_hand_share_ahead") double heroHandShareAhead
) {}
