package com.guardian.backend.service.risk;

import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

/**
 * Result of assessing one position in one evaluation cycle. Never mutated; the next cycle produces a new one.
 */
public record PositionRiskAssessment(
        String symbol,
        double quantity,
        double entryPrice,
        double currentPrice,
        double marketValue,
        double unrealizedPnl,
        double unrealizedPnlPct,
        int daysHeld,
        RiskLevel riskLevel,
        double concentration,
        PositionAction recommendedAction,
        String actionReason,
        double targetAllocation,
        double stopLossPrice,
        double takeProfitPrice,
        double confidenceScore
) {
}
