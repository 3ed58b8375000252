package com.guardian.backend.service.monitor;

import com.guardian.backend.model.RiskLevel;
import com.guardian.backend.service.risk.PositionRiskAssessment;

import java.time.LocalDateTime;
import java.util.List;

public record PortfolioSnapshot(
        Long accountId,
        LocalDateTime timestamp,
        double totalValue,
        double cashAvailable,
        double investedValue,
        double totalUnrealizedPnl,
        int positionCount,
        RiskLevel riskLevel,
        List<PositionRiskAssessment> positions,
        List<Alert> alerts
) {
    public PortfolioSnapshot {
        positions = List.copyOf(positions);
        alerts = List.copyOf(alerts);
    }
}
