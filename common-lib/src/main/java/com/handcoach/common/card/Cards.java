package com.handcoach.common.card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Card list parsing and deck helpers.
 *
 * <p>Accepts the notations seen in uploaded hand histories: {@code "KhTh"}, {@code "Kh Th"},
 * {@code "K♥T♥"}, {@code "[Ks, 9d, 5c]"} and {@code "10h"}.
 */
public final class Cards {

    public static final List<Card> DECK;

    static {
        List<Card> deck = new ArrayList<>(52);
        for (Suit s : Suit.values()) {
            for (Rank r : Rank.values()) {
                deck.add(new Card(r, s));
            }
        }
        DECK = Collections.unmodifiableList(deck);
    }

    private Cards() {}

    public static List<Card> parseList(String text) {
        if (text == null || text.isBlank()) return List.of();
        String compact = text.replaceAll("[\\s,\\[\\]\\-|]", "");
        List<Card> out = new ArrayList<>();
        int i = 0;
        while (i < compact.length()) {
            if (compact.startsWith("10", i)) {
                if (i + 2 >= compact.length()) throw new IllegalArgumentException("Dangling rank in '" + text + "'");
                out.add(new Card(Rank.TEN, Suit.fromSymbol(compact.charAt(i + 2))));
                i += 3;
                continue;
            }
            if (i + 1 >= compact.length()) throw new IllegalArgumentException("Dangling rank in '" + text + "'");
            out.add(new Card(Rank.fromSymbol(compact.charAt(i)), Suit.fromSymbol(compact.charAt(i + 1))));
            i += 2;
        }
        return List.copyOf(out);
    }

    public static boolean hasDuplicates(Collection<Card> cards) {
        return new HashSet<>(cards).size() != cards.size();
    }

    public static List<Card> remaining(Collection<Card> dead) {
        Set<Card> deadSet = new HashSet<>(dead);
        return DECK.stream().filter(c -> !deadSet.contains(c)).collect(Collectors.toList());
    }

    public static String format(Collection<Card> cards) {
        return cards.stream().map(Card::toString).collect(Collectors.joining(" "));
    }
}
