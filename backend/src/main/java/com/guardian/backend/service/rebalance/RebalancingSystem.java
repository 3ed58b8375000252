package com.guardian.backend.service.rebalance;

import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.monitor.PortfolioMonitor;
import com.guardian.backend.service.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * Monitor plus rebalancer for one account. The alert channel is subscribed before the rebalancer,
 * so operators are notified of an alert before any trade it causes.
 */
@Slf4j
public class RebalancingSystem {

    static final int RECENT_TRADES = 5;

    private final PortfolioMonitor monitor;
    private final AutoRebalancer rebalancer;

    public RebalancingSystem(PortfolioMonitor monitor, AutoRebalancer rebalancer,
                             NotificationChannel<Alert> alertChannel) {
        this.monitor = monitor;
        this.rebalancer = rebalancer;
        monitor.subscribe(alertChannel::publish);
    }

    public Long getAccountId() {
        return monitor.getAccountId();
    }

    public synchronized void start() {
        log.info("Starting rebalancing system for account {} mode={}", getAccountId(),
                rebalancer.getConfig().dryRun() ? "DRY RUN" : "LIVE");
        monitor.start();
        rebalancer.start(monitor);
        refresh();
    }

    public synchronized void stop() {
        if (!monitor.isRunning() && !rebalancer.isRunning()) {
            return;
        }
        rebalancer.stop();
        monitor.stop();
        log.info("Rebalancing system stopped for account {}", getAccountId());
    }

    public boolean isRunning() {
        return monitor.isRunning();
    }

    /**
     * One monitor cycle. A failing cycle is logged and leaves the previous snapshot in place.
     */
    public void refresh() {
        if (!monitor.isRunning()) {
            return;
        }
        try {
            monitor.refresh();
        } catch (RuntimeException e) {
            log.warn("Monitor cycle failed for account {}: {}", getAccountId(), e.getMessage(), e);
        }
    }

    public SystemStatus getStatus() {
        return new SystemStatus(
                getAccountId(),
                monitor.isRunning(),
                rebalancer.isRunning(),
                rebalancer.getConfig().dryRun(),
                monitor.getCurrentSnapshot(),
                rebalancer.getDailyStats(),
                rebalancer.getTradeHistory(RECENT_TRADES));
    }

    public RebalanceResult triggerRebalance() {
        return rebalancer.manualRebalance();
    }

    public AutoRebalancer getRebalancer() {
        return rebalancer;
    }
}
