package com.guardian.backend.config;

import com.guardian.backend.service.rebalance.RebalanceConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Negative;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "rebalance")
@Data
@Validated
public class RebalanceProperties {

    private boolean enabled = true;

    private boolean dryRun = true;

    @Min(0)
    private int maxDailyTrades = 10;

    @Positive
    @DecimalMax("100.0")
    private double maxSingleTradePct = 25.0;

    @PositiveOrZero
    private double minTradeValue = 100.0;

    @Min(0)
    private int cooldownMinutes = 15;

    @Negative
    private double autoExitLossPct = -15.0;

    @Positive
    private double autoReduceGainPct = 30.0;

    @Positive
    private double autoReduceConcentrationPct = 30.0;

    @Positive
    private double targetPositionPct = 5.0;

    @Positive
    private double maxPositionPct = 10.0;

    private Urgency actOn = new Urgency();

    @Min(1)
    private int notificationQueueCapacity = 256;

    @Data
    public static class Urgency {
        private boolean immediate = true;
        private boolean high = true;
        private boolean medium = false;
        private boolean low = false;
    }

    public RebalanceConfig toConfig() {
        return RebalanceConfig.builder()
                .enabled(enabled)
                .dryRun(dryRun)
                .maxDailyTrades(maxDailyTrades)
                .maxSingleTradePct(maxSingleTradePct)
                .minTradeValue(minTradeValue)
                .cooldownMinutes(cooldownMinutes)
                .autoExitLossPct(autoExitLossPct)
                .autoReduceGainPct(autoReduceGainPct)
                .autoReduceConcentrationPct(autoReduceConcentrationPct)
                .targetPositionPct(targetPositionPct)
                .maxPositionPct(maxPositionPct)
                .actOnImmediate(actOn.isImmediate())
                .actOnHigh(actOn.isHigh())
                .actOnMedium(actOn.isMedium())
                .actOnLow(actOn.isLow())
                .build();
    }
}
