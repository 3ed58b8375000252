package com.guardian.backend.config;

import com.guardian.backend.service.monitor.AlertDetector;
import com.guardian.backend.service.risk.PortfolioCompositionAnalyzer;
import com.guardian.backend.service.risk.PositionRiskAssessor;
import com.guardian.backend.service.risk.RiskThresholds;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RiskEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RiskThresholds riskThresholds(RiskProperties riskProperties) {
        return riskProperties.toThresholds();
    }

    @Bean
    public PositionRiskAssessor positionRiskAssessor(RiskThresholds thresholds) {
        return new PositionRiskAssessor(thresholds);
    }

    @Bean
    public PortfolioCompositionAnalyzer portfolioCompositionAnalyzer(RiskThresholds thresholds,
                                                                     PositionRiskAssessor assessor) {
        return new PortfolioCompositionAnalyzer(thresholds, assessor);
    }

    @Bean
    public AlertDetector alertDetector(RiskThresholds thresholds) {
        return new AlertDetector(thresholds);
    }
}
