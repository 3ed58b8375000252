package com.guardian.backend.service.risk;

import com.guardian.backend.exception.InvalidInputException;
import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

import java.util.Locale;

/**
 * Classifies a single position and recommends what to do with it.
 * Stateless: the same inputs always give an equal assessment.
 */
public class PositionRiskAssessor {

    static final double CRITICAL_LOSS_PCT = -20.0;
    static final double HIGH_LOSS_PCT = -10.0;
    static final double HIGH_CONCENTRATION_PCT = 40.0;
    static final double MODERATE_CONCENTRATION_PCT = 25.0;
    static final double EXTENDED_GAIN_PCT = 30.0;

    private final RiskThresholds thresholds;

    public PositionRiskAssessor(RiskThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public PositionRiskAssessment assess(HoldingSnapshot holding, double totalPortfolioValue) {
        validate(holding, totalPortfolioValue);

        double quantity = holding.quantity();
        double entryPrice = holding.entryPrice();
        double currentPrice = holding.effectivePrice();

        double marketValue = quantity * currentPrice;
        double costBasis = quantity * entryPrice;
        double unrealizedPnl = marketValue - costBasis;
        double unrealizedPnlPct = costBasis > 0 ? unrealizedPnl / costBasis * 100 : 0.0;
        double concentration = totalPortfolioValue > 0 ? marketValue / totalPortfolioValue * 100 : 0.0;

        RiskLevel riskLevel = riskLevel(unrealizedPnlPct, concentration);
        Recommendation recommendation = recommend(unrealizedPnlPct, concentration, riskLevel);

        return new PositionRiskAssessment(
                holding.symbol(),
                quantity,
                entryPrice,
                currentPrice,
                marketValue,
                unrealizedPnl,
                unrealizedPnlPct,
                holding.daysHeld(),
                riskLevel,
                concentration,
                recommendation.action(),
                recommendation.reason(),
                Math.min(concentration, thresholds.maxConcentrationPct()),
                entryPrice * (1 + thresholds.stopLossThresholdPct() / 100),
                entryPrice * (1 + thresholds.takeProfitThresholdPct() / 100),
                thresholds.defaultConfidence()
        );
    }

    RiskLevel riskLevel(double pnlPct, double concentration) {
        if (pnlPct < CRITICAL_LOSS_PCT) {
            return RiskLevel.CRITICAL;
        }
        if (pnlPct < HIGH_LOSS_PCT) {
            return RiskLevel.HIGH;
        }
        if (concentration > HIGH_CONCENTRATION_PCT) {
            return RiskLevel.HIGH;
        }
        if (concentration > MODERATE_CONCENTRATION_PCT) {
            return RiskLevel.MODERATE;
        }
        if (pnlPct > EXTENDED_GAIN_PCT) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.LOW;
    }

    Recommendation recommend(double pnlPct, double concentration, RiskLevel riskLevel) {
        if (pnlPct < thresholds.stopLossThresholdPct()) {
            return new Recommendation(PositionAction.EXIT, format(
                    "Stop loss triggered: %.1f%% loss exceeds %.1f%% threshold", pnlPct, thresholds.stopLossThresholdPct()));
        }
        if (pnlPct > thresholds.takeProfitThresholdPct()) {
            return new Recommendation(PositionAction.REDUCE, format(
                    "Take profit opportunity: %.1f%% gain exceeds %.1f%% threshold", pnlPct, thresholds.takeProfitThresholdPct()));
        }
        if (concentration > thresholds.maxConcentrationPct()) {
            return new Recommendation(PositionAction.REDUCE, format(
                    "Position over-concentrated at %.1f%% of portfolio (max %.1f%%)", concentration, thresholds.maxConcentrationPct()));
        }
        if (riskLevel == RiskLevel.CRITICAL) {
            return new Recommendation(PositionAction.EXIT, "Critical risk level - recommend full exit");
        }
        if (riskLevel == RiskLevel.HIGH) {
            return new Recommendation(PositionAction.REDUCE, "High risk level - consider reducing exposure");
        }
        return new Recommendation(PositionAction.HOLD, "Position within acceptable risk parameters");
    }

    private void validate(HoldingSnapshot holding, double totalPortfolioValue) {
        if (holding == null) {
            throw new InvalidInputException("Position is required");
        }
        if (holding.symbol() == null || holding.symbol().isBlank()) {
            throw new InvalidInputException("Position symbol is required");
        }
        if (isNegativeOrNaN(holding.quantity())) {
            throw new InvalidInputException("Quantity must be >= 0 for " + holding.symbol() + ": " + holding.quantity());
        }
        if (isNegativeOrNaN(holding.entryPrice())) {
            throw new InvalidInputException("Entry price must be >= 0 for " + holding.symbol() + ": " + holding.entryPrice());
        }
        if (holding.currentPrice() != null && isNegativeOrNaN(holding.currentPrice())) {
            throw new InvalidInputException("Current price must be >= 0 for " + holding.symbol() + ": " + holding.currentPrice());
        }
        if (isNegativeOrNaN(totalPortfolioValue)) {
            throw new InvalidInputException("Total portfolio value must be >= 0: " + totalPortfolioValue);
        }
    }

    private static boolean isNegativeOrNaN(double value) {
        return Double.isNaN(value) || value < 0;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.US, template, args);
    }

    record Recommendation(PositionAction action, String reason) {}
}
