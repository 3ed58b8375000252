package com.guardian.backend.service.risk;

import com.guardian.backend.exception.InvalidInputException;
import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates position assessments into portfolio metrics and a ranked action list.
 * Pure: reads nothing but its arguments.
 */
public class PortfolioCompositionAnalyzer {

    private static final int MAX_OPPORTUNITIES = 3;
    private static final double HIGH_SHARE = 0.3;
    private static final double MODERATE_SHARE = 0.5;

    private final RiskThresholds thresholds;
    private final PositionRiskAssessor assessor;

    public PortfolioCompositionAnalyzer(RiskThresholds thresholds, PositionRiskAssessor assessor) {
        this.thresholds = thresholds;
        this.assessor = assessor;
    }

    public PortfolioRiskAssessment assess(Long accountId, double cashAvailable, List<HoldingSnapshot> holdings) {
        if (Double.isNaN(cashAvailable) || cashAvailable < 0) {
            throw new InvalidInputException("Cash available must be >= 0: " + cashAvailable);
        }
        List<HoldingSnapshot> held = holdings.stream()
                .filter(holding -> holding.quantity() != 0)
                .toList();
        double invested = 0.0;
        for (HoldingSnapshot holding : held) {
            invested += holding.marketValue();
        }
        double totalValue = invested + cashAvailable;

        List<PositionRiskAssessment> positions = new ArrayList<>();
        for (HoldingSnapshot holding : held) {
            positions.add(assessor.assess(holding, totalValue));
        }
        double totalPnl = positions.stream().mapToDouble(PositionRiskAssessment::unrealizedPnl).sum();

        if (positions.isEmpty()) {
            return new PortfolioRiskAssessment(accountId, totalValue, cashAvailable, invested, totalPnl,
                    RiskLevel.LOW, 100, false, 0.0, 0.0, false, positions, List.of());
        }

        double maxConcentration = positions.stream()
                .mapToDouble(PositionRiskAssessment::concentration)
                .max()
                .orElse(0.0);
        boolean concentrationWarning = maxConcentration > thresholds.maxConcentrationPct();
        int diversification = diversificationScore(positions.size()) - (concentrationWarning ? 20 : 0);
        boolean rebalanceNeeded = positions.stream()
                .anyMatch(position -> position.recommendedAction() != PositionAction.HOLD);
        double capitalAtRisk = positions.stream()
                .filter(position -> position.unrealizedPnl() < 0)
                .mapToDouble(position -> Math.abs(position.unrealizedPnl()))
                .sum();

        return new PortfolioRiskAssessment(
                accountId,
                totalValue,
                cashAvailable,
                invested,
                totalPnl,
                overallRiskLevel(positions),
                diversification,
                concentrationWarning,
                maxConcentration,
                capitalAtRisk,
                rebalanceNeeded,
                positions,
                suggestions(positions, cashAvailable, totalValue)
        );
    }

    public List<ReallocationSuggestion> reallocationSuggestions(PortfolioRiskAssessment assessment,
                                                                List<Opportunity> opportunities) {
        List<Opportunity> candidates = opportunities == null ? List.of() : opportunities;
        List<ReallocationSuggestion> suggestions = new ArrayList<>();
        String riskImpact = "Reduces portfolio risk from " + assessment.overallRiskLevel().name().toLowerCase(Locale.ROOT);

        double freedCapital = 0.0;
        for (PositionRiskAssessment position : assessment.positions()) {
            PositionAction action = position.recommendedAction();
            if (action != PositionAction.EXIT && action != PositionAction.REDUCE) {
                continue;
            }
            double amount;
            if (action == PositionAction.EXIT) {
                amount = position.marketValue();
            } else {
                double targetValue = assessment.totalValue() * (position.targetAllocation() / 100);
                amount = Math.max(0.0, position.marketValue() - targetValue);
            }
            freedCapital += amount;
            suggestions.add(new ReallocationSuggestion(
                    position.symbol(),
                    null,
                    amount,
                    position.actionReason(),
                    action == PositionAction.EXIT ? 1 : 2,
                    "Reduce risk exposure",
                    riskImpact
            ));
        }

        if (!candidates.isEmpty() && freedCapital > 0) {
            int slots = Math.min(MAX_OPPORTUNITIES, candidates.size());
            double share = freedCapital / slots;
            for (int i = 0; i < slots; i++) {
                Opportunity opportunity = candidates.get(i);
                suggestions.add(new ReallocationSuggestion(
                        ReallocationSuggestion.FREED_CAPITAL,
                        opportunity.symbol(),
                        share,
                        "New opportunity: " + orDefault(opportunity.reason(), "AI identified opportunity"),
                        3 + i,
                        orDefault(opportunity.expectedReturn(), "Potential upside"),
                        orDefault(opportunity.riskLevel(), "moderate")
                ));
            }
        }
        return suggestions;
    }

    int diversificationScore(int positionCount) {
        if (positionCount >= 10) {
            return 90;
        }
        if (positionCount >= 5) {
            return 70;
        }
        if (positionCount >= 3) {
            return 50;
        }
        return 30;
    }

    RiskLevel overallRiskLevel(List<PositionRiskAssessment> positions) {
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        for (PositionRiskAssessment position : positions) {
            counts.merge(position.riskLevel(), 1, Integer::sum);
        }
        int total = positions.size();
        if (counts.getOrDefault(RiskLevel.CRITICAL, 0) > 0) {
            return RiskLevel.CRITICAL;
        }
        if (counts.getOrDefault(RiskLevel.HIGH, 0) > total * HIGH_SHARE) {
            return RiskLevel.HIGH;
        }
        if (counts.getOrDefault(RiskLevel.MODERATE, 0) > total * MODERATE_SHARE) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.LOW;
    }

    private List<SuggestedAction> suggestions(List<PositionRiskAssessment> positions, double cash, double totalValue) {
        List<PositionRiskAssessment> ranked = new ArrayList<>(positions);
        ranked.sort(Comparator
                .comparingInt((PositionRiskAssessment position) -> position.recommendedAction().priority())
                .thenComparing(position -> -Math.abs(position.unrealizedPnlPct())));

        List<SuggestedAction> suggestions = new ArrayList<>();
        for (PositionRiskAssessment position : ranked) {
            if (position.recommendedAction() == PositionAction.HOLD) {
                continue;
            }
            suggestions.add(new SuggestedAction(
                    suggestions.size() + 1,
                    position.symbol(),
                    position.recommendedAction().code(),
                    position.actionReason(),
                    position.marketValue(),
                    position.unrealizedPnlPct(),
                    position.riskLevel()
            ));
        }
        cashSuggestion(cash, totalValue, suggestions.size() + 1).ifPresent(suggestions::add);
        return suggestions;
    }

    private Optional<SuggestedAction> cashSuggestion(double cash, double totalValue, int priority) {
        double cashPct = totalValue > 0 ? cash / totalValue * 100 : 0.0;
        if (cashPct <= thresholds.idleCashPct()) {
            return Optional.empty();
        }
        return Optional.of(new SuggestedAction(
                priority,
                null,
                SuggestedAction.DEPLOY_CASH,
                String.format(Locale.US, "Cash position at %.1f%% - consider deploying to opportunities", cashPct),
                cash,
                0.0,
                RiskLevel.LOW
        ));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
