package com.guardian.backend.service.advisor;

import com.guardian.backend.model.RiskLevel;
import com.guardian.backend.service.risk.PositionRiskAssessment;

/**
 * What an advisor is told about a position.
 */
public record PositionContext(
        String symbol,
        double entryPrice,
        double currentPrice,
        double quantity,
        double marketValue,
        double unrealizedPnl,
        double unrealizedPnlPct,
        int daysHeld,
        double concentration,
        RiskLevel riskLevel
) {

    public static PositionContext from(PositionRiskAssessment assessment) {
        return new PositionContext(
                assessment.symbol(),
                assessment.entryPrice(),
                assessment.currentPrice(),
                assessment.quantity(),
                assessment.marketValue(),
                assessment.unrealizedPnl(),
                assessment.unrealizedPnlPct(),
                assessment.daysHeld(),
                assessment.concentration(),
                assessment.riskLevel());
    }
}
