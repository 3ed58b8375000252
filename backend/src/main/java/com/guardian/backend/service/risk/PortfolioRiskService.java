package com.guardian.backend.service.risk;

import com.guardian.backend.exception.NotFoundException;
import com.guardian.backend.model.Account;
import com.guardian.backend.model.Position;
import com.guardian.backend.service.MetricsService;
import com.guardian.backend.service.portfolio.PositionStore;
import com.guardian.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Loads an account's holdings and runs them through the risk engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioRiskService {

    private final PositionStore positionStore;
    private final PortfolioCompositionAnalyzer compositionAnalyzer;
    private final MetricsService metricsService;
    private final Clock clock;

    public PortfolioRiskAssessment assessPortfolio(Long accountId) {
        Account account = positionStore.findAccount(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        List<HoldingSnapshot> holdings = positionStore.findPositions(accountId).stream()
                .map(this::toSnapshot)
                .toList();
        PortfolioRiskAssessment assessment = compositionAnalyzer.assess(
                accountId, MoneyUtils.toDouble(account.getCashBalance()), holdings);
        metricsService.recordAssessment();
        log.debug("Assessed account {}: {} positions, total={}, risk={}, rebalanceNeeded={}",
                accountId, assessment.positions().size(), assessment.totalValue(),
                assessment.overallRiskLevel(), assessment.rebalanceNeeded());
        return assessment;
    }

    public List<ReallocationSuggestion> getReallocationSuggestions(Long accountId, List<Opportunity> opportunities) {
        return compositionAnalyzer.reallocationSuggestions(assessPortfolio(accountId), opportunities);
    }

    public PositionRiskAssessment getPositionRecommendation(Long accountId, String symbol) {
        return assessPortfolio(accountId).positions().stream()
                .filter(position -> position.symbol().equalsIgnoreCase(symbol))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("No position found for symbol: " + symbol));
    }

    private HoldingSnapshot toSnapshot(Position position) {
        return new HoldingSnapshot(
                position.getSymbol(),
                MoneyUtils.toDouble(position.getQuantity()),
                MoneyUtils.toDouble(position.getAverageEntryPrice()),
                position.getCurrentPrice() != null ? position.getCurrentPrice().doubleValue() : null,
                daysHeld(position.getOpenedAt())
        );
    }

    private int daysHeld(LocalDateTime openedAt) {
        if (openedAt == null) {
            return 0;
        }
        long days = Duration.between(openedAt, LocalDateTime.now(clock)).toDays();
        return (int) Math.max(0, days);
    }
}
