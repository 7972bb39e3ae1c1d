package com.handcoach.common.classifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Street;
import com.handcoach.common.strategy.Branch;
import com.handcoach.common.strategy.GtoAction;

/** Verdict on one hero decision. {@code leakCategory} is set exactly when the verdict is a mistake. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionClassification(
    @JsonProperty("street") Street street,
    @JsonProperty("branch") Branch branch,
    @JsonProperty("hero_action") ActionType heroAction,
    @JsonProperty("gto_primary") GtoAction gtoPrimary,
    @JsonProperty("gto_alternative") GtoAction gtoAlternative,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("leak_category") LeakCategory leakCategory
) {
    @JsonIgnore
    public boolean isMistake() {
        return verdict == Verdict.MISTAKE;
    }

    /** Short text such as {@code "flop: check (should be bet)"}. */
    public String example() {
        return street.wireName() + ": " + heroAction.wireName()
            + " (should be " + gtoPrimary.action().wireName() + ")";
    }
}
