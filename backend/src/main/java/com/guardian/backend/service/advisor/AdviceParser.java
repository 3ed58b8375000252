package com.guardian.backend.service.advisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardian.backend.exception.AdvisorException;
import com.guardian.backend.model.PositionAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads advisor payloads of the form
 * {@code {"action": "reduce", "confidence": 0.8, "reasoning": "...", "key_points": ["..."]}}.
 * Missing or unknown actions become HOLD; missing or unreadable confidence falls back to the default.
 */
public class AdviceParser {

    private final ObjectMapper objectMapper;
    private final double defaultConfidence;

    public AdviceParser(ObjectMapper objectMapper, double defaultConfidence) {
        this.objectMapper = objectMapper;
        this.defaultConfidence = defaultConfidence;
    }

    public Advice parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new AdvisorException("Empty advisor response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new AdvisorException("Malformed advisor response", e);
        }
        if (root == null || !root.isObject()) {
            throw new AdvisorException("Advisor response is not a JSON object");
        }
        return new Advice(
                parseAction(root.path("action").asText(null)),
                parseConfidence(root.get("confidence")),
                root.path("reasoning").asText(""),
                parseKeyPoints(root.has("key_points") ? root.get("key_points") : root.get("keyPoints")));
    }

    PositionAction parseAction(String raw) {
        if (raw == null || raw.isBlank()) {
            return PositionAction.HOLD;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "EXIT" -> PositionAction.EXIT;
            case "REDUCE" -> PositionAction.REDUCE;
            case "ADD" -> PositionAction.ADD;
            default -> PositionAction.HOLD;
        };
    }

    private double parseConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return defaultConfidence;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return defaultConfidence;
            }
        }
        return Double.isNaN(value) ? defaultConfidence : value;
    }

    private List<String> parseKeyPoints(JsonNode node) {
        List<String> points = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return points;
        }
        for (JsonNode item : node) {
            String text = item.asText("").trim();
            if (!text.isEmpty()) {
                points.add(text);
            }
        }
        return points;
    }
}
