package com.handcoach.common.hand;

import com.handcoach.common.card.Cards;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HandRankerTest {

    private static int score(String cards) {
        return HandRanker.evaluate(Cards.parseList(cards));
    }

    @Test
    @DisplayName("categories are detected from seven cards")
    void categories() {
        assertEquals(HandCategory.STRAIGHT_FLUSH, HandRanker.category(score("9h Th Jh Qh Kh 2c 3d")));
        assertEquals(HandCategory.QUADS, HandRanker.category(score("7h 7d 7c 7s Ah 2c 3d")));
        assertEquals(HandCategory.FULL_HOUSE, HandRanker.category(score("7h 7d 7c Ks Kh 2c 3d")));
        assertEquals(HandCategory.FLUSH, HandRanker.category(score("2h 6h 9h Jh Kh 2c 3d")));
        assertEquals(HandCategory.TWO_PAIR, HandRanker.category(score("Ah Ad Kc Ks 9h 2c 3d")));
        assertEquals(HandCategory.HIGH_CARD, HandRanker.category(score("Ah Jd 9c 7s 5h 3c 2d")));
    }

    @Test
    @DisplayName("A-2-3-4-5 counts as a five-high straight")
    void wheel() {
        int wheel = score("Ah 2d 3c 4s 5h Kc Kd");
        assertEquals(HandCategory.STRAIGHT, HandRanker.category(wheel));
        assertTrue(score("2h 3d 4c 5s 6h Kc Kd") > wheel);
    }

    @Test
    @DisplayName("kickers break ties within a category")
    void kickers() {
        assertTrue(score("Ah Ad Kc 9s 5h") > score("Ah Ad Qc 9s 5h"));
        assertEquals(score("Ah Ad Kc 9s 5h"), score("As Ac Kd 9h 5c"));
    }
}
