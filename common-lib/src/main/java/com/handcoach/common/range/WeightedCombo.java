package com.handcoach.common.range;

import com.handcoach.common.hand.HandCombo;

/**
 * One combo of a {@link Range}. {@code bucket} is {@code null} until the range is categorized.
 */
public record WeightedCombo(HandCombo combo, double weight, Bucket bucket) {

    public WeightedCombo withWeight(double newWeight) {
        return new WeightedCombo(combo, newWeight, bucket);
    }

    public WeightedCombo withBucket(Bucket newBucket) {
        return new WeightedCombo(combo, weight, newBucket);
    }
}
