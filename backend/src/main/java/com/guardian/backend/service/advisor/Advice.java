package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;

import java.util.List;

/**
 * Structured answer of a {@link PositionAdvisor}. Confidence is clamped to [0, 1] and at most
 * {@link #MAX_KEY_POINTS} key points are kept.
 */
public record Advice(
        PositionAction action,
        double confidence,
        String reasoning,
        List<String> keyPoints
) {
    public static final int MAX_KEY_POINTS = 5;

    public Advice {
        if (action == null || action == PositionAction.REALLOCATE) {
            action = PositionAction.HOLD;
        }
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        reasoning = reasoning == null ? "" : reasoning;
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints.subList(0, Math.min(MAX_KEY_POINTS, keyPoints.size())));
    }

    static Advice unavailable(String reason) {
        return new Advice(PositionAction.HOLD, 0.0, reason, List.of());
    }
}
