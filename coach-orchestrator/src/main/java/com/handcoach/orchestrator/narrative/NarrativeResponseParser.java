package com.handcoach.orchestrator.narrative;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.board.BoardTextureClassifier;
import com.handcoach.common.board.StreetTexture;
import com.handcoach.common.card.Card;
import com.handcoach.common.exception.NarrativeServiceException;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Street;
import com.handcoach.common.strategy.Branch;
import com.handcoach.common.strategy.GtoAction;
import com.handcoach.common.strategy.GtoDecisionNode;
import com.handcoach.common.strategy.GtoStrategyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON answers of the narrative service.
 *
 * <p>Lenient on content, strict on shape: missing board fields are filled from the template
 * classifier and unknown streets, branches or actions are skipped, but a reply that is empty,
 * not JSON, or yields nothing usable raises {@link NarrativeServiceException}.
 */
@Component
public class NarrativeResponseParser {

    private static final Logger log = LoggerFactory.getLogger(NarrativeResponseParser.class);

    public static final String BOARD_STAGE = "BoardNarrative";
    public static final String STRATEGY_STAGE = "StrategyNarrative";

    private final ObjectMapper objectMapper;

    public NarrativeResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BoardTexture parseBoard(String responseText, List<Card> board) {
        JsonNode json = readJson(BOARD_STAGE, responseText);
        BoardTexture template = BoardTextureClassifier.classify(board);

        Map<Street, StreetTexture> streets = new EnumMap<>(Street.class);
        JsonNode streetsNode = json.path("streets");
        for (Map.Entry<Street, StreetTexture> entry : template.streets().entrySet()) {
            JsonNode node = streetsNode.path(entry.getKey().wireName());
            streets.put(entry.getKey(), node.isObject() ? streetTexture(node, entry.getValue()) : entry.getValue());
        }

        return new BoardTexture(
            streets,
            json.path("paired").asBoolean(template.paired()),
            json.path("flush_possible").asBoolean(template.flushPossible()),
            json.path("straight_possible").asBoolean(template.straightPossible()),
            json.path("summary").asText(template.summary()));
    }

    public GtoStrategyTree parseStrategy(String responseText, Collection<Street> streets) {
        JsonNode json = readJson(STRATEGY_STAGE, responseText);

        Map<Street, Map<Branch, GtoDecisionNode>> tree = new EnumMap<>(Street.class);
        Iterator<Map.Entry<String, JsonNode>> fields = json.path("streets").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Street street = Street.from(field.getKey());
            if (street == null || !streets.contains(street)) {
                log.debug("[NarrativeParser] Skipping street={}", field.getKey());
                continue;
            }
            Map<Branch, GtoDecisionNode> nodes = new EnumMap<>(Branch.class);
            Iterator<Map.Entry<String, JsonNode>> branches = field.getValue().fields();
            while (branches.hasNext()) {
                Map.Entry<String, JsonNode> b = branches.next();
                Branch branch = Branch.from(b.getKey());
                GtoDecisionNode node = branch == null ? null : decisionNode(b.getValue());
                if (node == null) {
                    log.debug("[NarrativeParser] Skipping node street={} branch={}", field.getKey(), b.getKey());
                    continue;
                }
                nodes.put(branch, node);
            }
            if (!nodes.isEmpty()) tree.put(street, nodes);
        }

        if (tree.isEmpty()) {
            throw new NarrativeServiceException(STRATEGY_STAGE, "Strategy response has no usable decision nodes");
        }
        return new GtoStrategyTree(tree, json.path("summary").asText("Strategy from narrative service"));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    JsonNode readJson(String stage, String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new NarrativeServiceException(stage, "Empty response");
        }
        String cleaned = responseText
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        try {
            JsonNode json = objectMapper.readTree(cleaned);
            if (json == null || !json.isObject()) {
                throw new NarrativeServiceException(stage, "Response is not a JSON object");
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new NarrativeServiceException(stage, "Unparsable response: " + e.getOriginalMessage(), e);
        }
    }

    private static StreetTexture streetTexture(JsonNode node, StreetTexture fallback) {
        List<String> tags = new ArrayList<>();
        node.path("tags").forEach(t -> {
            if (t.isTextual() && !t.asText().isBlank()) tags.add(t.asText().trim());
        });
        return new StreetTexture(
            tags.isEmpty() ? fallback.tags() : tags,
            node.path("description").asText(fallback.description()));
    }

    private static GtoDecisionNode decisionNode(JsonNode node) {
        GtoAction primary = action(node.path("primary"), 1.0);
        if (primary == null) return null;
        GtoAction alternative = action(node.path("alternative"), 0.0);
        return GtoDecisionNode.of(primary, alternative, node.path("reasoning").asText(null));
    }

    private static GtoAction action(JsonNode node, double defaultFrequency) {
        if (!node.isObject()) return null;
        ActionType type = ActionType.from(node.path("action").asText(null));
        if (type == null) return null;
        String sizing = node.hasNonNull("sizing") ? node.path("sizing").asText() : null;
        return GtoAction.of(type, node.path("frequency").asDouble(defaultFrequency), sizing);
    }
}
