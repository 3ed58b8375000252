package com.guardian.backend.service.rebalance;

import com.guardian.backend.model.AlertUrgency;
import lombok.Builder;

/**
 * Immutable rebalancer settings, fixed for the lifetime of a rebalancer instance.
 * Percentages are expressed as 0-100 (loss thresholds are negative).
 */
@Builder(toBuilder = true)
public record RebalanceConfig(
        boolean enabled,
        boolean dryRun,
        int maxDailyTrades,
        double maxSingleTradePct,
        double minTradeValue,
        int cooldownMinutes,
        double autoExitLossPct,
        double autoReduceGainPct,
        double autoReduceConcentrationPct,
        double targetPositionPct,
        double maxPositionPct,
        boolean actOnImmediate,
        boolean actOnHigh,
        boolean actOnMedium,
        boolean actOnLow
) {

    public static RebalanceConfig defaults() {
        return RebalanceConfig.builder()
                .enabled(true)
                .dryRun(true)
                .maxDailyTrades(10)
                .maxSingleTradePct(25.0)
                .minTradeValue(100.0)
                .cooldownMinutes(15)
                .autoExitLossPct(-15.0)
                .autoReduceGainPct(30.0)
                .autoReduceConcentrationPct(30.0)
                .targetPositionPct(5.0)
                .maxPositionPct(10.0)
                .actOnImmediate(true)
                .actOnHigh(true)
                .actOnMedium(false)
                .actOnLow(false)
                .build();
    }

    public boolean shouldActOn(AlertUrgency urgency) {
        if (urgency == null) {
            return false;
        }
        return switch (urgency) {
            case IMMEDIATE -> actOnImmediate;
            case HIGH -> actOnHigh;
            case MEDIUM -> actOnMedium;
            case LOW -> actOnLow;
        };
    }
}
