package com.handcoach.common.card;

public enum Suit {
    CLUBS('c', '♣'), DIAMONDS('d', '♦'), HEARTS('h', '♥'), SPADES('s', '♠');

    private final char letter;
    private final char glyph;

    Suit(char letter, char glyph) {
        this.letter = letter;
        this.glyph = glyph;
    }

    public char letter() { return letter; }

    public char glyph() { return glyph; }

    /** Accepts the letter form (case-insensitive) or the unicode glyph, outlined glyphs included. */
    public static Suit fromSymbol(char c) {
        Suit outlined = switch (c) {
            case '♤' -> SPADES;
            case '♡' -> HEARTS;
            case '♢' -> DIAMONDS;
            case '♧' -> CLUBS;
            default -> null;
        };
        if (outlined != null) return outlined;
        char lower = Character.toLowerCase(c);
        for (Suit s : values()) {
            if (s.letter == lower || s.glyph == c) return s;
        }
        throw new IllegalArgumentException("Unknown suit: " + c);
    }
}
