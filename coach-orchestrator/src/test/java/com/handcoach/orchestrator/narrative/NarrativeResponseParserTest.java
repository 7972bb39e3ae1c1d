package com.handcoach.orchestrator.narrative;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.exception.NarrativeServiceException;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Street;
import com.handcoach.common.strategy.Branch;
import com.handcoach.common.strategy.GtoDecisionNode;
import com.handcoach.common.strategy.GtoStrategyTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NarrativeResponseParserTest {

    private static final List<Card> TURN_BOARD = Cards.parseList("Ks 7d 2c Qh");
    private static final List<Street> ALL_STREETS = List.of(Street.PREFLOP, Street.FLOP, Street.TURN, Street.RIVER);

    private final NarrativeResponseParser parser = new NarrativeResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("board texture")
    class Board {

        @Test
        @DisplayName("fenced JSON is read and wins over the template")
        void readsFencedJson() {
            String text = """
                ```json
                {"streets": {"flop": {"tags": ["rainbow", "dry"], "description": "K-high rainbow"}},
                 "paired": false, "flush_possible": false, "straight_possible": true,
                 "summary": "Dry king-high board"}
                ```""";

            BoardTexture texture = parser.parseBoard(text, TURN_BOARD);

            assertEquals(List.of("rainbow", "dry"), texture.streets().get(Street.FLOP).tags());
            assertEquals("K-high rainbow", texture.streets().get(Street.FLOP).description());
            assertTrue(texture.straightPossible());
            assertEquals("Dry king-high board", texture.summary());
        }

        @Test
        @DisplayName("streets and flags the reply leaves out come from the template")
        void fillsGapsFromTemplate() {
            BoardTexture texture = parser.parseBoard("{\"summary\": \"short\"}", TURN_BOARD);

            assertEquals(2, texture.streets().size());
            assertFalse(texture.streets().get(Street.TURN).tags().isEmpty());
            assertEquals("short", texture.summary());
        }

        @Test
        @DisplayName("streets the board never reached are ignored")
        void ignoresUndealtStreets() {
            String text = "{\"streets\": {\"river\": {\"tags\": [\"wet\"], \"description\": \"x\"}}}";

            BoardTexture texture = parser.parseBoard(text, TURN_BOARD);

            assertFalse(texture.streets().containsKey(Street.RIVER));
        }
    }

    @Nested
    @DisplayName("strategy tree")
    class Strategy {

        @Test
        @DisplayName("nodes are read with sizing and reasoning")
        void readsNodes() {
            String text = """
                {"streets": {"flop": {
                   "vs_check": {"primary": {"action": "bet", "frequency": 0.65, "sizing": "33% pot"},
                                "alternative": {"action": "check", "frequency": 0.35},
                                "reasoning": "range advantage"}}},
                 "summary": "c-bet small"}""";

            GtoStrategyTree tree = parser.parseStrategy(text, ALL_STREETS);

            GtoDecisionNode node = tree.node(Street.FLOP, Branch.VS_CHECK).orElseThrow();
            assertEquals(ActionType.BET, node.primary().action());
            assertEquals(0.65, node.primary().frequency(), 1e-9);
            assertEquals("33% pot", node.primary().sizing());
            assertEquals(ActionType.CHECK, node.distinctAlternative());
            assertEquals("range advantage", node.reasoning());
            assertEquals("c-bet small", tree.summary());
        }

        @Test
        @DisplayName("missing frequencies default to 1.0 for primary and 0.0 for alternative")
        void defaultFrequencies() {
            String text = "{\"streets\": {\"river\": {\"vs_bet\": {\"primary\": {\"action\": \"call\"},"
                + " \"alternative\": {\"action\": \"fold\"}}}}}";

            GtoDecisionNode node = parser.parseStrategy(text, ALL_STREETS).node(Street.RIVER, Branch.VS_BET).orElseThrow();

            assertEquals(1.0, node.primary().frequency());
            assertEquals(0.0, node.alternative().frequency());
        }

        @Test
        @DisplayName("unknown streets, branches and actions are skipped")
        void skipsUnknowns() {
            String text = """
                {"streets": {
                   "showdown": {"initial": {"primary": {"action": "bet"}}},
                   "turn": {"facing_donk": {"primary": {"action": "call"}},
                            "initial": {"primary": {"action": "overbet-jam-thing"}},
                            "vs_bet": {"primary": {"action": "call", "frequency": 0.6}}}}}""";

            GtoStrategyTree tree = parser.parseStrategy(text, ALL_STREETS);

            assertEquals(1, tree.streets().size());
            assertEquals(1, tree.streets().get(Street.TURN).size());
            assertTrue(tree.node(Street.TURN, Branch.VS_BET).isPresent());
        }

        @Test
        @DisplayName("streets outside the hand are dropped")
        void dropsStreetsNotPlayed() {
            String text = "{\"streets\": {\"river\": {\"initial\": {\"primary\": {\"action\": \"check\"}}},"
                + " \"flop\": {\"initial\": {\"primary\": {\"action\": \"check\"}}}}}";

            GtoStrategyTree tree = parser.parseStrategy(text, List.of(Street.PREFLOP, Street.FLOP));

            assertTrue(tree.node(Street.FLOP, Branch.INITIAL).isPresent());
            assertFalse(tree.streets().containsKey(Street.RIVER));
        }
    }

    @Nested
    @DisplayName("unusable replies")
    class Unusable {

        @Test
        @DisplayName("empty, non-JSON and nodeless replies raise NarrativeServiceException")
        void raises() {
            assertThrows(NarrativeServiceException.class, () -> parser.parseBoard("  ", TURN_BOARD));
            assertThrows(NarrativeServiceException.class, () -> parser.parseBoard("The board is dry.", TURN_BOARD));
            assertThrows(NarrativeServiceException.class, () -> parser.parseBoard("[1, 2]", TURN_BOARD));
            assertThrows(NarrativeServiceException.class, () -> parser.parseStrategy("{\"streets\": {}}", ALL_STREETS));
        }

        @Test
        @DisplayName("the exception names the failing stage")
        void namesStage() {
            NarrativeServiceException e = assertThrows(NarrativeServiceException.class,
                () -> parser.parseStrategy("not json", ALL_STREETS));
            assertEquals(NarrativeResponseParser.STRATEGY_STAGE, e.getStage());
        }
    }
}
