package com.handcoach.common.board;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.card.Rank;
import com.handcoach.common.card.Suit;
import com.handcoach.common.model.Street;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic board-texture description built from fixed templates.
 *
 * <p>This is the local stand-in for the narrative service's board description and also feeds
 * the wet/dry split used by the range action filters.
 *
 * <h3>Tags per street</h3>
 * <ul>
 *   <li>{@code paired} / {@code unpaired}</li>
 *   <li>{@code rainbow}, {@code two_tone} or {@code monotone} on the flop; later streets add
 *       {@code flush_possible} once three cards share a suit</li>
 *   <li>{@code connected} when three ranks fit inside a straight window</li>
 *   <li>{@code high} (top card T+), {@code mid} (7–9) or {@code low}</li>
 *   <li>{@code wet} or {@code dry}</li>
 * </ul>
 */
public final class BoardTextureClassifier {

    private BoardTextureClassifier() {}

    public static BoardTexture classify(List<Card> board) {
        if (board == null || board.size() < 3) return BoardTexture.notReached();

        Map<Street, StreetTexture> streets = new EnumMap<>(Street.class);
        for (Street street : List.of(Street.FLOP, Street.TURN, Street.RIVER)) {
            if (board.size() < street.boardSize()) break;
            List<Card> visible = board.subList(0, street.boardSize());
            streets.put(street, describe(street, visible));
        }

        boolean paired = isPaired(board);
        boolean flushPossible = maxSuitCount(board) >= 3;
        boolean straightPossible = isConnected(board);
        String summary = "%s board: %s".formatted(
            Cards.format(board), String.join(", ", streets.get(lastStreet(board)).tags()));
        return new BoardTexture(streets, paired, flushPossible, straightPossible, summary);
    }

    /** Wet boards offer flush or straight draws: two or more of a suit, or connected ranks. */
    public static boolean isWet(List<Card> board) {
        return maxSuitCount(board) >= 2 || isConnected(board);
    }

    public static boolean isPaired(List<Card> board) {
        return board.stream().map(Card::rank).distinct().count() < board.size();
    }

    /** Three or more distinct ranks inside one five-rank window, the ace playing low too. */
    public static boolean isConnected(List<Card> board) {
        int mask = 0;
        for (Card c : board) mask |= 1 << c.rank().value();
        if ((mask & (1 << 14)) != 0) mask |= 1 << 1;
        for (int low = 1; low <= 10; low++) {
            if (Integer.bitCount(mask & (0b11111 << low)) >= 3) return true;
        }
        return false;
    }

    public static int maxSuitCount(List<Card> board) {
        Map<Suit, Integer> counts = new EnumMap<>(Suit.class);
        for (Card c : board) counts.merge(c.suit(), 1, Integer::sum);
        return counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static StreetTexture describe(Street street, List<Card> visible) {
        List<String> tags = new ArrayList<>();
        tags.add(isPaired(visible) ? "paired" : "unpaired");

        int suited = maxSuitCount(visible);
        if (street == Street.FLOP) {
            tags.add(suited == 3 ? "monotone" : suited == 2 ? "two_tone" : "rainbow");
        } else if (suited >= 3) {
            tags.add("flush_possible");
        } else if (suited == 2) {
            tags.add("flush_draw");
        }

        boolean connected = isConnected(visible);
        if (connected) tags.add("connected");

        int top = visible.stream().mapToInt(c -> c.rank().value()).max().orElse(0);
        tags.add(top >= Rank.TEN.value() ? "high" : top >= Rank.SEVEN.value() ? "mid" : "low");
        tags.add(isWet(visible) ? "wet" : "dry");

        String description = "%s %s: %s".formatted(
            street.wireName(), Cards.format(visible), String.join(" ", tags).replace('_', '-'));
        return new StreetTexture(tags, description);
    }

    private static Street lastStreet(List<Card> board) {
        return board.size() >= 5 ? Street.RIVER : board.size() == 4 ? Street.TURN : Street.FLOP;
    }
}
