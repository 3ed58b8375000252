package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

import java.time.LocalDateTime;
import java.util.List;

public record PortfolioAdvice(
        Long accountId,
        double portfolioRiskScore,
        RiskLevel portfolioRiskLevel,
        List<Recommendation> positionsToExit,
        List<Recommendation> positionsToReduce,
        List<Recommendation> positionsToAdd,
        List<Recommendation> positionsToHold,
        List<Recommendation> allRecommendations,
        LocalDateTime timestamp
) {

    public record Recommendation(
            String symbol,
            PositionAction action,
            String reasoning,
            double riskScore,
            String debateSummary,
            List<DebateArgument> arguments,
            String error
    ) {}
}
