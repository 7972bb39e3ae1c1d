package com.handcoach.common.hand;

/**
 * What a concrete two-card hand has made on a board, strongest first.
 */
public enum Holding {
    STRAIGHT_OR_BETTER("Straight or better"),
    SET("Set"),
    TOP_TWO_PAIR("Top two pair"),
    TWO_PAIR("Two pair"),
    TRIPS("Trips"),
    OVERPAIR("Overpair"),
    TOP_PAIR_TOP_KICKER("Top pair, top kicker"),
    TOP_PAIR_GOOD_KICKER("Top pair, good kicker"),
    TOP_PAIR_WEAK_KICKER("Top pair, weak kicker"),
    SECOND_PAIR("Second pair"),
    UNDERPAIR("Underpair"),
    WEAK_PAIR("Bottom pair"),
    ACE_HIGH("Ace high"),
    HIGH_CARD("High card");

    private final String label;

    Holding(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
