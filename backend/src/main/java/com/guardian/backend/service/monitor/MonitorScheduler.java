package com.guardian.backend.service.monitor;

import com.guardian.backend.service.rebalance.RebalancingSystem;
import com.guardian.backend.service.rebalance.RebalancingSystemRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitor.scheduler-enabled", havingValue = "true")
public class MonitorScheduler {

    private final RebalancingSystemRegistry registry;

    @Scheduled(fixedDelayString = "${monitor.interval-seconds}000")
    public void runCycle() {
        registry.runningSystems().forEach(RebalancingSystem::refresh);
    }
}
