package com.guardian.backend.service.risk;

/**
 * Immutable thresholds shared by the assessor, the composition analysis and the alert detector.
 * All values are percentages except {@code defaultConfidence}.
 */
public record RiskThresholds(
        double stopLossThresholdPct,
        double takeProfitThresholdPct,
        double maxConcentrationPct,
        double defaultConfidence,
        double idleCashPct
) {

    public static RiskThresholds defaults() {
        return new RiskThresholds(-10.0, 20.0, 25.0, 0.7, 30.0);
    }
}
