package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;

import java.util.List;

public record DebateArgument(
        DebateStance stance,
        PositionAction action,
        double confidence,
        String reasoning,
        List<String> keyPoints,
        String error
) {

    public static DebateArgument of(DebateStance stance, Advice advice) {
        return new DebateArgument(stance, advice.action(), advice.confidence(), advice.reasoning(), advice.keyPoints(), null);
    }

    /**
     * A stance that could not be heard counts as HOLD with no weight.
     */
    public static DebateArgument failed(DebateStance stance, String error) {
        return new DebateArgument(stance, PositionAction.HOLD, 0.0, "No argument: " + error, List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
