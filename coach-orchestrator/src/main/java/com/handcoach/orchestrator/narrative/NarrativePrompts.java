package com.handcoach.orchestrator.narrative;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.card.Cards;
import com.handcoach.common.model.Action;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Street;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt text for the two narrative calls. Both ask for a single JSON object so that
 * {@link NarrativeResponseParser} can read the answer without free-text heuristics.
 */
public final class NarrativePrompts {

    static final String BOARD_SYSTEM_PROMPT = """
        You are a poker board texture analyzer. Describe the community cards objectively and \
        never recommend a strategy.

        Return ONLY a JSON object with this exact structure:
        {
          "streets": {
            "flop":  {"tags": ["two_tone", "connected", "high", "wet"], "description": "..."},
            "turn":  {"tags": [...], "description": "..."},
            "river": {"tags": [...], "description": "..."}
          },
          "paired": true/false,
          "flush_possible": true/false,
          "straight_possible": true/false,
          "summary": "one sentence"
        }

        Omit streets that were not dealt. Tags are lowercase words such as paired, unpaired, \
        rainbow, two_tone, monotone, connected, high, mid, low, wet, dry.
        """;

    static final String STRATEGY_SYSTEM_PROMPT = """
        You are a GTO poker strategy expert. The hand log describes what happened; your job is \
        to define what SHOULD happen at each decision point. Do not justify hero's actual line.

        For every street listed and every branch (initial, vs_check, vs_bet, vs_raise) give a \
        primary action (played 50%+ of the time) and, only for a genuinely mixed strategy, an \
        alternative (10-49%). Actions are fold, check, call, bet or raise.

        Return ONLY a JSON object:
        {
          "streets": {
            "flop": {
              "initial":  {"primary": {"action": "bet", "frequency": 0.6, "sizing": "33% pot"},
                           "alternative": {"action": "check", "frequency": 0.4},
                           "reasoning": "..."},
              "vs_check": {...}, "vs_bet": {...}, "vs_raise": {...}
            }
          },
          "summary": "one sentence"
        }

        Bet for value when equity beats the calling range; call a bet when equity exceeds the \
        pot odds needed. Use the supplied equity and pot odds in the reasoning.
        """;

    private NarrativePrompts() {}

    static String boardPrompt(BoardNarrativeRequest request) {
        StringBuilder sb = new StringBuilder("Analyze this poker board:\n\n");
        for (Street street : request.streets()) {
            if (street == Street.PREFLOP) continue;
            int from = street == Street.FLOP ? 0 : street.boardSize() - 1;
            sb.append(capitalize(street.wireName())).append(": ")
              .append(Cards.format(request.board().subList(from, street.boardSize())))
              .append('\n');
        }
        sb.append("\nProvide the complete board texture analysis.");
        return sb.toString();
    }

    static String strategyPrompt(StrategyRequest request, ObjectMapper objectMapper)
            throws JsonProcessingException {
        ParsedHand hand = request.hand();
        StringBuilder sb = new StringBuilder();
        sb.append("SITUATION:\n")
          .append("Hero: ").append(hand.positions().hero()).append(" with ").append(hand.heroHand()).append('\n')
          .append("Villain: ").append(hand.positions().villain()).append('\n')
          .append("Effective stack: ").append(String.format(Locale.ROOT, "%.1f", hand.effectiveStackBb())).append("bb\n")
          .append("Board: ").append(Cards.format(hand.board())).append("\n\n");

        sb.append("HAND LOG (CONTEXT ONLY):\n");
        Street current = null;
        for (Action action : hand.actions()) {
            if (action.street() != current) {
                current = action.street();
                sb.append("  ").append(current.wireName().toUpperCase(Locale.ROOT)).append(":\n");
            }
            sb.append("    ").append(action.actor().wireName()).append(": ").append(action.type().wireName());
            if (action.amount() != null && action.amount() > 0) {
                sb.append(' ').append(String.format(Locale.ROOT, "%.2f", action.amount()));
            }
            sb.append('\n');
        }
        sb.append("[END OF LOG]\n\n");

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("board_texture", request.boardTexture());
        analysis.put("ranges", request.ranges());
        analysis.put("spr", request.spr());
        analysis.put("equity", request.equity());
        analysis.put("advantage", request.advantage());
        sb.append("ANALYSIS:\n").append(objectMapper.writeValueAsString(analysis)).append("\n\n");

        sb.append("Generate the decision tree for these streets: ");
        sb.append(String.join(", ", hand.streetsReached().stream().map(Street::wireName).toArray(String[]::new)));
        return sb.toString();
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
