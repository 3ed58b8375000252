package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;

import java.time.LocalDateTime;
import java.util.List;

public record DebateResult(
        String symbol,
        List<DebateArgument> arguments,
        PositionAction finalAction,
        String finalReasoning,
        double riskScore,
        String summary,
        LocalDateTime timestamp
) {}
