package com.handcoach.common.board;

import com.handcoach.common.card.Cards;
import com.handcoach.common.model.Street;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardTextureClassifierTest {

    @Test
    @DisplayName("dry rainbow flop")
    void dryFlop() {
        BoardTexture t = BoardTextureClassifier.classify(Cards.parseList("Kd 7c 2s"));
        List<String> tags = t.streets().get(Street.FLOP).tags();
        assertTrue(tags.contains("rainbow"));
        assertTrue(tags.contains("unpaired"));
        assertTrue(tags.contains("dry"));
        assertFalse(t.flushPossible());
    }

    @Test
    @DisplayName("monotone connected board is wet; the river adds its own street")
    void wetRunout() {
        BoardTexture t = BoardTextureClassifier.classify(Cards.parseList("9h Th Jh 2c 2d"));
        assertTrue(t.streets().get(Street.FLOP).tags().contains("monotone"));
        assertTrue(t.streets().get(Street.FLOP).tags().contains("wet"));
        assertTrue(t.streets().containsKey(Street.RIVER));
        assertTrue(t.paired());
        assertTrue(t.flushPossible());
        assertTrue(t.straightPossible());
    }

    @Test
    @DisplayName("the wheel window counts the ace low")
    void wheelConnected() {
        assertTrue(BoardTextureClassifier.isConnected(Cards.parseList("Ah 2c 4d")));
        assertFalse(BoardTextureClassifier.isConnected(Cards.parseList("Ah 7c 2d")));
    }

    @Test
    @DisplayName("fewer than three cards → not reached")
    void preflop() {
        assertTrue(BoardTextureClassifier.classify(List.of()).streets().isEmpty());
    }
}
