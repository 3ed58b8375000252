package com.guardian.backend.service.risk;

import com.guardian.backend.exception.InvalidInputException;
import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PositionRiskAssessorTest {

    private final PositionRiskAssessor assessor = new PositionRiskAssessor(RiskThresholds.defaults());

    @Test
    void deepLossIsCriticalAndExits() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("AAPL", 10, 150.0, 100.0, 30), 10_000);

        assertThat(result.unrealizedPnlPct()).isCloseTo(-33.33, within(0.01));
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(result.recommendedAction()).isEqualTo(PositionAction.EXIT);
        assertThat(result.actionReason()).contains("Stop loss triggered");
    }

    @Test
    void largeGainIsModerateAndTakesProfit() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("MSFT", 10, 100.0, 135.0, 90), 13_500);

        assertThat(result.unrealizedPnlPct()).isCloseTo(35.0, within(1e-9));
        assertThat(result.concentration()).isCloseTo(10.0, within(1e-9));
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.MODERATE);
        assertThat(result.recommendedAction()).isEqualTo(PositionAction.REDUCE);
        assertThat(result.actionReason()).contains("Take profit");
    }

    @Test
    void overConcentratedPositionIsReduced() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("NVDA", 50, 100.0, 100.0, 5), 10_000);

        assertThat(result.concentration()).isCloseTo(50.0, within(1e-9));
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.recommendedAction()).isEqualTo(PositionAction.REDUCE);
        assertThat(result.actionReason()).contains("over-concentrated");
        assertThat(result.targetAllocation()).isEqualTo(25.0);
    }

    @Test
    void healthyPositionIsHeld() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("KO", 10, 60.0, 62.0, 200), 10_000);

        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.recommendedAction()).isEqualTo(PositionAction.HOLD);
        assertThat(result.stopLossPrice()).isCloseTo(54.0, within(1e-9));
        assertThat(result.takeProfitPrice()).isCloseTo(72.0, within(1e-9));
        assertThat(result.confidenceScore()).isEqualTo(0.7);
    }

    @Test
    void zeroCostBasisGivesZeroPnlPct() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("GIFT", 5, 0.0, 10.0, 1), 1_000);

        assertThat(result.unrealizedPnlPct()).isZero();
        assertThat(result.unrealizedPnl()).isEqualTo(50.0);
    }

    @Test
    void zeroPortfolioValueGivesZeroConcentration() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("AAPL", 10, 100.0, 100.0, 1), 0);

        assertThat(result.concentration()).isZero();
        assertThat(result.targetAllocation()).isZero();
    }

    @Test
    void unknownCurrentPriceFallsBackToEntry() {
        PositionRiskAssessment result = assessor.assess(new HoldingSnapshot("AAPL", 10, 100.0, null, 1), 2_000);

        assertThat(result.currentPrice()).isEqualTo(100.0);
        assertThat(result.marketValue()).isEqualTo(1_000.0);
        assertThat(result.unrealizedPnl()).isZero();
    }

    @Test
    void riskNeverDecreasesAsGainsShrinkIntoLosses() {
        for (double concentration : new double[]{0, 10, 30, 45}) {
            RiskLevel previous = RiskLevel.LOW;
            for (double pnl = 60; pnl >= -60; pnl -= 0.5) {
                RiskLevel level = assessor.riskLevel(pnl, concentration);
                if (pnl < 30) {
                    assertThat(level.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
                }
                previous = level;
            }
        }
    }

    @Test
    void assessmentIsRepeatable() {
        HoldingSnapshot holding = new HoldingSnapshot("AAPL", 12.5, 101.3, 87.9, 44);

        assertThat(assessor.assess(holding, 7_321.55)).isEqualTo(assessor.assess(holding, 7_321.55));
    }

    @Test
    void rejectsNegativeFigures() {
        assertThatThrownBy(() -> assessor.assess(new HoldingSnapshot("AAPL", -1, 100.0, 100.0, 0), 1_000))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Quantity");
        assertThatThrownBy(() -> assessor.assess(new HoldingSnapshot("AAPL", 1, -100.0, 100.0, 0), 1_000))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> assessor.assess(new HoldingSnapshot("AAPL", 1, 100.0, -5.0, 0), 1_000))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> assessor.assess(new HoldingSnapshot("AAPL", 1, 100.0, 100.0, 0), -1))
                .isInstanceOf(InvalidInputException.class);
    }
}
