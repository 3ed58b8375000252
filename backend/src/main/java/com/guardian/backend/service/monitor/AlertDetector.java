package com.guardian.backend.service.monitor;

import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.AlertUrgency;
import com.guardian.backend.model.RiskLevel;
import com.guardian.backend.service.risk.PortfolioRiskAssessment;
import com.guardian.backend.service.risk.PositionRiskAssessment;
import com.guardian.backend.service.risk.RiskThresholds;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a portfolio assessment into the alerts the rebalancer reacts to.
 */
public class AlertDetector {

    static final double IMMEDIATE_LOSS_PCT = -20.0;
    static final double HIGH_GAIN_PCT = 30.0;
    static final double HIGH_CONCENTRATION_PCT = 40.0;

    private final RiskThresholds thresholds;

    public AlertDetector(RiskThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<Alert> detect(PortfolioRiskAssessment assessment, LocalDateTime now) {
        List<Alert> alerts = new ArrayList<>();
        for (PositionRiskAssessment position : assessment.positions()) {
            double pnlPct = position.unrealizedPnlPct();
            String symbol = position.symbol();

            if (pnlPct < thresholds.stopLossThresholdPct()) {
                alerts.add(new Alert(
                        AlertType.STOP_LOSS_HIT,
                        pnlPct < IMMEDIATE_LOSS_PCT ? AlertUrgency.IMMEDIATE : AlertUrgency.HIGH,
                        symbol,
                        "Stop loss hit: " + symbol,
                        format("%s is down %.1f%% (stop at %.1f%%)", symbol, pnlPct, thresholds.stopLossThresholdPct()),
                        priceData(position),
                        now));
            }
            if (pnlPct > thresholds.takeProfitThresholdPct()) {
                alerts.add(new Alert(
                        AlertType.TAKE_PROFIT,
                        pnlPct > HIGH_GAIN_PCT ? AlertUrgency.HIGH : AlertUrgency.MEDIUM,
                        symbol,
                        "Take profit: " + symbol,
                        format("%s is up %.1f%% (target %.1f%%)", symbol, pnlPct, thresholds.takeProfitThresholdPct()),
                        priceData(position),
                        now));
            }
            if (position.concentration() > thresholds.maxConcentrationPct()) {
                alerts.add(new Alert(
                        AlertType.CONCENTRATION,
                        position.concentration() > HIGH_CONCENTRATION_PCT ? AlertUrgency.HIGH : AlertUrgency.MEDIUM,
                        symbol,
                        "Concentration: " + symbol,
                        format("%s is %.1f%% of the portfolio (max %.1f%%)",
                                symbol, position.concentration(), thresholds.maxConcentrationPct()),
                        priceData(position),
                        now));
            }
            if (position.riskLevel() == RiskLevel.CRITICAL) {
                alerts.add(new Alert(
                        AlertType.RISK_THRESHOLD,
                        AlertUrgency.IMMEDIATE,
                        symbol,
                        "Critical risk: " + symbol,
                        format("%s reached critical risk at %.1f%% P&L", symbol, pnlPct),
                        priceData(position),
                        now));
            }
        }

        double idlePct = assessment.totalValue() > 0 ? assessment.cashAvailable() / assessment.totalValue() * 100 : 0.0;
        if (idlePct > thresholds.idleCashPct()) {
            alerts.add(new Alert(
                    AlertType.IDLE_CAPITAL,
                    AlertUrgency.LOW,
                    null,
                    "Idle capital",
                    format("%.1f%% of the portfolio is in cash", idlePct),
                    Map.of(Alert.IDLE_PCT, idlePct),
                    now));
        }
        return alerts;
    }

    private Map<String, Double> priceData(PositionRiskAssessment position) {
        return Map.of(
                Alert.PNL_PCT, position.unrealizedPnlPct(),
                Alert.CURRENT_PRICE, position.currentPrice(),
                Alert.CONCENTRATION_PCT, position.concentration());
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.US, template, args);
    }
}
