package com.handcoach.common.spr;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a given SPR commits a player to.
 *
 * @param minHandStrength weakest holding worth stacking off with
 * @param canFoldTopPair  top pair is still a comfortable fold (spr &gt; 8)
 * @param canFoldOverpair an overpair is still a comfortable fold (spr &gt; 13)
 * @param shoveZone       spr below 3: folding a made hand is almost never right
 */
public record CommitmentThresholds(
    @JsonProperty("min_hand_strength") String minHandStrength,
    @JsonProperty("can_fold_top_pair") boolean canFoldTopPair,
    @JsonProperty("can_fold_overpair") boolean canFoldOverpair,
    @JsonProperty("shove_zone") boolean shoveZone
) {
    public static final double SHOVE_ZONE_SPR = 3.0;

    public static CommitmentThresholds forSpr(double spr) {
        String minStrength = switch (SprZone.of(spr)) {
            case COMMITTED -> "Any pair or strong draw";
            case LOW -> "Top pair good kicker";
            case MEDIUM -> "Overpair or two pair";
            case MEDIUM_HIGH -> "Two pair or better";
            case HIGH -> "Sets or better";
        };
        return new CommitmentThresholds(minStrength, spr > 8, spr > 13, spr < SHOVE_ZONE_SPR);
    }
}
