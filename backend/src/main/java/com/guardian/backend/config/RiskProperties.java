package com.guardian.backend.config;

import com.guardian.backend.service.risk.RiskThresholds;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Negative;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Negative
    private double stopLossThresholdPct = -10.0;

    @Positive
    private double takeProfitThresholdPct = 20.0;

    @Positive
    private double maxConcentrationPct = 25.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultConfidence = 0.7;

    @Positive
    private double idleCashPct = 30.0;

    public RiskThresholds toThresholds() {
        return new RiskThresholds(stopLossThresholdPct, takeProfitThresholdPct, maxConcentrationPct,
                defaultConfidence, idleCashPct);
    }
}
