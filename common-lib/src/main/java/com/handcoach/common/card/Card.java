package com.handcoach.common.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single playing card. Serialises as its short form ({@code "Ah"}, {@code "Td"}).
 */
public record Card(Rank rank, Suit suit) implements Comparable<Card> {

    public static final Comparator<Card> BY_STRENGTH =
        Comparator.comparing(Card::rank).thenComparing(Card::suit);

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    @JsonCreator
    public static Card parse(String text) {
        if (text == null) throw new IllegalArgumentException("Card text is null");
        String t = text.trim();
        if (t.startsWith("10") && t.length() == 3) {
            return new Card(Rank.TEN, Suit.fromSymbol(t.charAt(2)));
        }
        if (t.length() != 2) throw new IllegalArgumentException("Malformed card: '" + text + "'");
        return new Card(Rank.fromSymbol(t.charAt(0)), Suit.fromSymbol(t.charAt(1)));
    }

    /** Deck index in [0, 52), suit-major. */
    public int index() {
        return suit.ordinal() * 13 + (rank.value() - 2);
    }

    @Override
    public int compareTo(Card other) {
        return BY_STRENGTH.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return "" + rank.symbol() + suit.letter();
    }
}
