package com.handcoach.orchestrator.parser;

import com.handcoach.common.card.Card;
import com.handcoach.common.exception.InvalidHandException;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Actor;
import com.handcoach.common.model.HandRecord;
import com.handcoach.common.model.HandRecord.RawAction;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Stacks;
import com.handcoach.common.model.Street;
import com.handcoach.common.model.TablePosition;
import com.handcoach.orchestrator.support.Hands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandRecordParserTest {

    private final HandRecordParser parser = new HandRecordParser();

    private static HandRecord withActions(List<RawAction> actions) {
        HandRecord base = Hands.riverHand();
        return new HandRecord(base.handId(), base.heroCards(), base.board(), base.positions(), actions,
                              base.stacks(), base.potSizes(), base.bigBlind(), base.lastBet());
    }

    @Nested
    @DisplayName("valid records")
    class Valid {

        @Test
        @DisplayName("typed cards, seats and actions come through in order")
        void parsesRiverHand() {
            ParsedHand hand = parser.parse(Hands.riverHand());

            assertEquals("hand-42", hand.handId());
            assertTrue(hand.heroHand().contains(Card.parse("As")));
            assertTrue(hand.heroHand().contains(Card.parse("Kd")));
            assertEquals(5, hand.board().size());
            assertEquals(TablePosition.BTN, hand.positions().hero());
            assertTrue(hand.positions().heroInPosition());
            assertEquals(9, hand.actions().size());
            assertEquals(Actor.HERO, hand.actions().get(0).actor());
            assertEquals(ActionType.RAISE, hand.actions().get(0).type());
            assertEquals(List.of(Street.PREFLOP, Street.FLOP, Street.TURN, Street.RIVER), hand.streetsReached());
        }

        @Test
        @DisplayName("missing id, big blind and last bet get defaults")
        void appliesDefaults() {
            HandRecord base = Hands.riverHand();
            HandRecord record = new HandRecord(null, base.heroCards(), base.board(), base.positions(),
                                               base.actions(), base.stacks(), base.potSizes(), null, null);

            ParsedHand hand = parser.parse(record);

            assertEquals(HandRecordParser.ANONYMOUS_HAND, hand.handId());
            assertEquals(1.0, hand.bigBlind());
            assertEquals(0.0, hand.lastBet());
        }

        @Test
        @DisplayName("seat aliases and action verbs are accepted")
        void acceptsAliases() {
            HandRecord base = Hands.riverHand();
            HandRecord record = new HandRecord(base.handId(), base.heroCards(), base.board(),
                new HandRecord.Seats("button", "big blind"),
                List.of(RawAction.of("pre-flop", "hero", "raises", 2.5),
                        RawAction.of("preflop", "villain", "calls", 1.5)),
                base.stacks(), base.potSizes(), base.bigBlind(), base.lastBet());

            ParsedHand hand = parser.parse(record);

            assertEquals(TablePosition.BTN, hand.positions().hero());
            assertEquals(TablePosition.BB, hand.positions().villain());
            assertEquals(ActionType.CALL, hand.actions().get(1).type());
        }
    }

    @Nested
    @DisplayName("rejected records")
    class Rejected {

        @Test
        @DisplayName("missing hero position")
        void missingHeroPosition() {
            HandRecord base = Hands.riverHand();
            HandRecord record = new HandRecord(base.handId(), base.heroCards(), base.board(),
                new HandRecord.Seats(null, "BB"), base.actions(), base.stacks(), base.potSizes(), 1.0, null);

            InvalidHandException e = assertThrows(InvalidHandException.class, () -> parser.parse(record));
            assertTrue(e.getMessage().contains("Hero position"));
            assertEquals(InvalidHandException.STAGE, e.getStage());
        }

        @Test
        @DisplayName("hero and villain in the same seat")
        void sameSeat() {
            HandRecord base = Hands.riverHand();
            HandRecord record = new HandRecord(base.handId(), base.heroCards(), base.board(),
                new HandRecord.Seats("BB", "BB"), base.actions(), base.stacks(), base.potSizes(), 1.0, null);

            assertThrows(InvalidHandException.class, () -> parser.parse(record));
        }

        @Test
        @DisplayName("hero cards other than two valid cards")
        void badHeroCards() {
            assertThrows(InvalidHandException.class, () -> parser.parse(Hands.withHeroCards(Hands.riverHand(), "As")));
            assertThrows(InvalidHandException.class, () -> parser.parse(Hands.withHeroCards(Hands.riverHand(), "As Kd Qc")));
            assertThrows(InvalidHandException.class, () -> parser.parse(Hands.withHeroCards(Hands.riverHand(), "Zx Kd")));
            assertThrows(InvalidHandException.class, () -> parser.parse(Hands.withHeroCards(Hands.riverHand(), "As As")));
        }

        @Test
        @DisplayName("a card shared by hero and board")
        void duplicateCard() {
            InvalidHandException e = assertThrows(InvalidHandException.class,
                () -> parser.parse(Hands.withHeroCards(Hands.riverHand(), "Ks Kd")));
            assertTrue(e.getMessage().contains("Duplicate"));
        }

        @Test
        @DisplayName("more than five board cards")
        void oversizedBoard() {
            HandRecord base = Hands.riverHand();
            HandRecord record = new HandRecord(base.handId(), base.heroCards(), "Ks 7d 2c Qh 3s 4h",
                base.positions(), base.actions(), base.stacks(), base.potSizes(), 1.0, null);

            assertThrows(InvalidHandException.class, () -> parser.parse(record));
        }

        @Test
        @DisplayName("no actions")
        void noActions() {
            assertThrows(InvalidHandException.class, () -> parser.parse(withActions(List.of())));
        }

        @Test
        @DisplayName("unknown street or action type")
        void unknownStreetOrType() {
            assertThrows(InvalidHandException.class,
                () -> parser.parse(withActions(List.of(RawAction.of("fifth", "hero", "bet", 1.0)))));
            assertThrows(InvalidHandException.class,
                () -> parser.parse(withActions(List.of(RawAction.of("flop", "hero", "limp-shove-ish", 1.0)))));
        }

        @Test
        @DisplayName("negative amount and out-of-order streets")
        void badAmountsAndOrder() {
            assertThrows(InvalidHandException.class,
                () -> parser.parse(withActions(List.of(RawAction.of("flop", "hero", "bet", -3.0)))));
            assertThrows(InvalidHandException.class,
                () -> parser.parse(withActions(List.of(RawAction.of("flop", "hero", "bet", 3.0),
                                                       RawAction.of("preflop", "villain", "call", 1.0)))));
        }

        @Test
        @DisplayName("missing or empty stacks")
        void badStacks() {
            HandRecord base = Hands.riverHand();
            HandRecord noStacks = new HandRecord(base.handId(), base.heroCards(), base.board(), base.positions(),
                base.actions(), null, base.potSizes(), 1.0, null);
            HandRecord zeroStack = new HandRecord(base.handId(), base.heroCards(), base.board(), base.positions(),
                base.actions(), new Stacks(0, 100), base.potSizes(), 1.0, null);

            assertThrows(InvalidHandException.class, () -> parser.parse(noStacks));
            assertThrows(InvalidHandException.class, () -> parser.parse(zeroStack));
        }
    }
}
