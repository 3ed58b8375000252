package com.guardian.backend.service.risk;

import com.guardian.backend.exception.NotFoundException;
import com.guardian.backend.model.Account;
import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.Position;
import com.guardian.backend.service.MetricsService;
import com.guardian.backend.service.portfolio.PositionStore;
import com.guardian.backend.support.MutableClock;
import com.guardian.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PortfolioRiskServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 4, 10, 0);

    private final PositionStore positionStore = mock(PositionStore.class);
    private final MetricsService metricsService = mock(MetricsService.class);
    private final RiskThresholds thresholds = RiskThresholds.defaults();
    private PortfolioRiskService service;

    @BeforeEach
    void setUp() {
        service = new PortfolioRiskService(positionStore,
                new PortfolioCompositionAnalyzer(thresholds, new PositionRiskAssessor(thresholds)),
                metricsService, new MutableClock(NOW));
        when(positionStore.findAccount(1L)).thenReturn(Optional.of(Account.builder()
                .id(1L)
                .name("Core")
                .cashBalance(MoneyUtils.bd(2_000))
                .build()));
        when(positionStore.findPositions(1L)).thenReturn(List.of(
                position("AAPL", 10, 100.0, 75.0, NOW.minusDays(45)),
                position("MSFT", 20, 100.0, null, NOW.minusHours(5))));
    }

    @Test
    void assessesStoredHoldings() {
        PortfolioRiskAssessment assessment = service.assessPortfolio(1L);

        assertThat(assessment.cashAvailable()).isEqualTo(2_000.0);
        assertThat(assessment.totalValue()).isEqualTo(4_750.0);
        PositionRiskAssessment aapl = find(assessment, "AAPL");
        assertThat(aapl.daysHeld()).isEqualTo(45);
        assertThat(aapl.recommendedAction()).isEqualTo(PositionAction.EXIT);
        PositionRiskAssessment msft = find(assessment, "MSFT");
        assertThat(msft.currentPrice()).isEqualTo(100.0);
        assertThat(msft.daysHeld()).isZero();
        verify(metricsService).recordAssessment();
    }

    @Test
    void positionLookupIgnoresCase() {
        assertThat(service.getPositionRecommendation(1L, "msft").symbol()).isEqualTo("MSFT");
        assertThatThrownBy(() -> service.getPositionRecommendation(1L, "TSLA"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No position found for symbol: TSLA");
    }

    @Test
    void unknownAccountIsNotFound() {
        when(positionStore.findAccount(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.assessPortfolio(9L))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Account not found: 9");
    }

    private static PositionRiskAssessment find(PortfolioRiskAssessment assessment, String symbol) {
        return assessment.positions().stream()
                .filter(position -> position.symbol().equals(symbol))
                .findFirst()
                .orElseThrow();
    }

    private static Position position(String symbol, double qty, double entry, Double current, LocalDateTime openedAt) {
        return Position.builder()
                .accountId(1L)
                .symbol(symbol)
                .quantity(MoneyUtils.bd(qty))
                .averageEntryPrice(MoneyUtils.bd(entry))
                .currentPrice(current == null ? null : MoneyUtils.bd(current))
                .openedAt(openedAt)
                .build();
    }
}
