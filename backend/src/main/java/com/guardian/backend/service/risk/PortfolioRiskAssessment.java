package com.guardian.backend.service.risk;

import com.guardian.backend.model.RiskLevel;

import java.util.List;

/**
 * Portfolio-level view for one account in one evaluation cycle.
 * {@code totalValue == cashAvailable + investedValue} and {@code rebalanceNeeded} is true
 * exactly when some position's recommendation is not HOLD.
 */
public record PortfolioRiskAssessment(
        Long accountId,
        double totalValue,
        double cashAvailable,
        double investedValue,
        double totalUnrealizedPnl,
        RiskLevel overallRiskLevel,
        int diversificationScore,
        boolean concentrationWarning,
        double maxPositionConcentration,
        double capitalAtRisk,
        boolean rebalanceNeeded,
        List<PositionRiskAssessment> positions,
        List<SuggestedAction> suggestedActions
) {
    public PortfolioRiskAssessment {
        positions = List.copyOf(positions);
        suggestedActions = List.copyOf(suggestedActions);
    }
}
