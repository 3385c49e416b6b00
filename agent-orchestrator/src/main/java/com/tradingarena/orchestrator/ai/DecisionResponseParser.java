package com.tradingarena.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Turns completion text into a {@link Decision}. Never throws: anything unusable becomes
 * a HOLD with confidence 0 and the parse-failure flag set.
 *
 * <p>Accepted shapes, tried in order: the bare JSON object, the object inside a code fence,
 * and the span from the first {@code '{'} to the last {@code '}'} of surrounding prose.
 */
@Component
public class DecisionResponseParser {

    private static final Logger log = LoggerFactory.getLogger(DecisionResponseParser.class);

    private static final int DEFAULT_CONFIDENCE = 50;

    private final ObjectMapper objectMapper;

    public DecisionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Decision parse(String agentName, String cycleId, String text, Instant now) {
        JsonNode json = locateObject(text);
        if (json == null) {
            return failure(agentName, cycleId, "no JSON object in response", text, now);
        }

        String rawAction = json.hasNonNull("decision") ? json.path("decision").asText()
                         : json.path("action").asText(null);
        TradeAction action = TradeAction.parse(rawAction);
        if (action == null) {
            return failure(agentName, cycleId, "unknown action '" + rawAction + "'", text, now);
        }

        String symbol = json.hasNonNull("symbol") ? json.path("symbol").asText().trim() : null;
        if (symbol != null && (symbol.isEmpty() || "null".equalsIgnoreCase(symbol))) {
            symbol = null;
        }
        BigDecimal quantity = quantity(json.path("quantity"));
        String reasoning = json.path("reasoning").asText("");
        int confidence = confidence(json.path("confidence"));

        if (action == TradeAction.HOLD) {
            return Decision.hold(agentName, cycleId, symbol, reasoning, confidence, now);
        }
        if (symbol == null) {
            return failure(agentName, cycleId, action + " without a symbol", text, now);
        }
        if (quantity == null || quantity.signum() <= 0) {
            return failure(agentName, cycleId, action + " without a positive quantity", text, now);
        }
        return Decision.trade(agentName, cycleId, action, symbol, quantity, reasoning, confidence, now);
    }

    private JsonNode locateObject(String text) {
        if (text == null || text.isBlank()) return null;
        String trimmed = text.trim();

        JsonNode direct = readObject(trimmed);
        if (direct != null) return direct;

        String unfenced = trimmed.replaceAll("```(?:json|JSON)?", "").trim();
        JsonNode fenced = readObject(unfenced);
        if (fenced != null) return fenced;

        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return readObject(trimmed.substring(start, end + 1));
        }
        return null;
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            return null;
        }
    }

    private static BigDecimal quantity(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) return node.decimalValue();
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int confidence(JsonNode node) {
        if (!node.isNumber() && !node.isTextual()) return DEFAULT_CONFIDENCE;
        double value;
        try {
            value = node.isNumber() ? node.asDouble() : Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return DEFAULT_CONFIDENCE;
        }
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }

    private Decision failure(String agentName, String cycleId, String detail, String text, Instant now) {
        log.warn("INFERENCE_PARSE_FAILURE agent={} cycleId={} detail={} response={}",
                 agentName, cycleId, detail, abbreviate(text));
        return Decision.parseFailure(agentName, cycleId, detail, now);
    }

    private static String abbreviate(String text) {
        if (text == null) return "null";
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
