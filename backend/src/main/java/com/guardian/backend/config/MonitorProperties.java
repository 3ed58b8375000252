package com.guardian.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "monitor")
@Data
@Validated
public class MonitorProperties {

    private boolean schedulerEnabled = true;

    @Min(1)
    private long intervalSeconds = 60;

    /**
     * Accounts whose rebalancing system is started when the application is ready.
     */
    private List<Long> autoStartAccounts = new ArrayList<>();
}
