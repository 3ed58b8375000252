package com.guardian.backend.service;

import com.guardian.backend.model.AlertType;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordAssessment() {
        meterRegistry.counter("risk_assessments_total").increment();
    }

    public void recordAlert(AlertType type) {
        meterRegistry.counter("rebalance_alerts_total", "type", type.name()).increment();
    }

    public void recordTrade(boolean success, boolean dryRun) {
        meterRegistry.counter("rebalance_trades_total",
                "result", success ? "success" : "failure",
                "mode", dryRun ? "dry_run" : "live").increment();
    }

    public void recordThrottled(String reason) {
        meterRegistry.counter("rebalance_throttled_total", "reason", reason).increment();
    }

    public void recordNotificationDropped(String channel) {
        meterRegistry.counter("notifications_dropped_total", "channel", channel).increment();
    }
}
