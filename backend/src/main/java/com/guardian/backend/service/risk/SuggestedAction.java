package com.guardian.backend.service.risk;

import com.guardian.backend.model.RiskLevel;

/**
 * One ranked entry of the portfolio's to-do list. {@code symbol} is null for cash deployment.
 */
public record SuggestedAction(
        int priority,
        String symbol,
        String action,
        String reason,
        double currentValue,
        double pnlPct,
        RiskLevel riskLevel
) {
    public static final String DEPLOY_CASH = "deploy_cash";
}
