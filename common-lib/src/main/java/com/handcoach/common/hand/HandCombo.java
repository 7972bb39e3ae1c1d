package com.handcoach.common.hand;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.card.Rank;
import com.handcoach.common.card.Suit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable two-card starting hand in canonical order: the stronger card is always {@code high}.
 */
public record HandCombo(Card high, Card low) {

    private static final List<HandCombo> ALL;

    static {
        List<HandCombo> all = new ArrayList<>(1326);
        List<Card> deck = Cards.DECK;
        for (int i = 0; i < deck.size(); i++) {
            for (int j = i + 1; j < deck.size(); j++) {
                all.add(of(deck.get(i), deck.get(j)));
            }
        }
        ALL = Collections.unmodifiableList(all);
    }

    public HandCombo {
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
        if (high.equals(low)) throw new IllegalArgumentException("Combo needs two distinct cards: " + high);
        if (high.compareTo(low) < 0) {
            Card swap = high;
            high = low;
            low = swap;
        }
    }

    public static HandCombo of(Card a, Card b) {
        return new HandCombo(a, b);
    }

    @JsonCreator
    public static HandCombo parse(String text) {
        List<Card> cards = Cards.parseList(text);
        if (cards.size() != 2) throw new IllegalArgumentException("Expected two cards, got '" + text + "'");
        return of(cards.get(0), cards.get(1));
    }

    /** All 1,326 distinct starting hands. */
    public static List<HandCombo> all() {
        return ALL;
    }

    /**
     * Expands a hand class such as {@code "AKs"}, {@code "AKo"}, {@code "AK"} or {@code "QQ"}
     * into its concrete combos (4, 12, 16 and 6 respectively).
     */
    public static List<HandCombo> expand(String handClass) {
        String t = handClass == null ? "" : handClass.trim();
        if (t.length() < 2 || t.length() > 3) throw new IllegalArgumentException("Malformed hand class: " + handClass);
        Rank r1 = Rank.fromSymbol(t.charAt(0));
        Rank r2 = Rank.fromSymbol(t.charAt(1));
        char qualifier = t.length() == 3 ? Character.toLowerCase(t.charAt(2)) : ' ';
        if (qualifier != ' ' && qualifier != 's' && qualifier != 'o') {
            throw new IllegalArgumentException("Malformed hand class: " + handClass);
        }
        List<HandCombo> out = new ArrayList<>();
        Suit[] suits = Suit.values();
        for (int i = 0; i < suits.length; i++) {
            for (int j = 0; j < suits.length; j++) {
                if (r1 == r2 && j <= i) continue;
                boolean suited = suits[i] == suits[j];
                if (r1 != r2 && qualifier == 's' && !suited) continue;
                if (r1 != r2 && qualifier == 'o' && suited) continue;
                if (r1 == r2 && qualifier == 's') continue;
                out.add(of(new Card(r1, suits[i]), new Card(r2, suits[j])));
            }
        }
        return out;
    }

    public boolean isPair() {
        return high.rank() == low.rank();
    }

    public boolean isSuited() {
        return high.suit() == low.suit();
    }

    public int rankSum() {
        return high.rank().value() + low.rank().value();
    }

    /** Gap between the two ranks, 0 for pairs and 1 for connectors. */
    public int gap() {
        return high.rank().value() - low.rank().value();
    }

    public boolean contains(Card card) {
        return high.equals(card) || low.equals(card);
    }

    public boolean hasRank(Rank rank) {
        return high.rank() == rank || low.rank() == rank;
    }

    public boolean sharesCardWith(Collection<Card> cards) {
        return cards.contains(high) || cards.contains(low);
    }

    public List<Card> cards() {
        return List.of(high, low);
    }

    /** Hand class notation: {@code "AKs"}, {@code "AKo"}, {@code "QQ"}. */
    public String notation() {
        String ranks = "" + high.rank().symbol() + low.rank().symbol();
        if (isPair()) return ranks;
        return ranks + (isSuited() ? "s" : "o");
    }

    @JsonValue
    @Override
    public String toString() {
        return high.toString() + low;
    }
}
