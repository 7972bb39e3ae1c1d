package com.handcoach.common.spr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

/**
 * SPR on one street. For a street that was never reached {@code spr}, {@code zone} and
 * {@code thresholds} are {@code null} and the stack carries over unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SprSnapshot(
    @JsonProperty("street") Street street,
    @JsonProperty("reached") boolean reached,
    @JsonProperty("pot_size") Double potSize,
    @JsonProperty("stack_remaining") double stackRemaining,
    @JsonProperty("spr") Double spr,
    @JsonProperty("zone") SprZone zone,
    @JsonProperty("commitment_thresholds") CommitmentThresholds thresholds
) {
    public static SprSnapshot unreached(Street street, double stackRemaining) {
        return new SprSnapshot(street, false, null, stackRemaining, null, null, null);
    }

    public boolean isShoveZone() {
        return thresholds != null && thresholds.shoveZone();
    }
}
