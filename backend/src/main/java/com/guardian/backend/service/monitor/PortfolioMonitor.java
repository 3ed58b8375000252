package com.guardian.backend.service.monitor;

import com.guardian.backend.service.risk.PortfolioRiskAssessment;
import com.guardian.backend.service.risk.PortfolioRiskService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-evaluates one account on every {@link #refresh()} and pushes conditions that were not
 * active in the previous cycle to its subscribers.
 */
@Slf4j
public class PortfolioMonitor implements AlertSource {

    private final Long accountId;
    private final PortfolioRiskService portfolioRiskService;
    private final AlertDetector alertDetector;
    private final Clock clock;

    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final Set<String> activeConditions = new HashSet<>();
    private volatile PortfolioSnapshot currentSnapshot;

    public PortfolioMonitor(Long accountId, PortfolioRiskService portfolioRiskService,
                            AlertDetector alertDetector, Clock clock) {
        this.accountId = accountId;
        this.portfolioRiskService = portfolioRiskService;
        this.alertDetector = alertDetector;
        this.clock = clock;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Portfolio monitor started for account {}", accountId);
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Portfolio monitor stopped for account {}", accountId);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Long getAccountId() {
        return accountId;
    }

    @Override
    public PortfolioSnapshot getCurrentSnapshot() {
        return currentSnapshot;
    }

    @Override
    public void subscribe(AlertListener listener) {
        listeners.add(listener);
    }

    /**
     * Runs one evaluation cycle. Listeners are invoked on the calling thread, after the snapshot is published.
     */
    public PortfolioSnapshot refresh() {
        List<Alert> fresh;
        PortfolioSnapshot snapshot;
        synchronized (activeConditions) {
            LocalDateTime now = LocalDateTime.now(clock);
            PortfolioRiskAssessment assessment = portfolioRiskService.assessPortfolio(accountId);
            List<Alert> alerts = alertDetector.detect(assessment, now);
            snapshot = new PortfolioSnapshot(
                    accountId,
                    now,
                    assessment.totalValue(),
                    assessment.cashAvailable(),
                    assessment.investedValue(),
                    assessment.totalUnrealizedPnl(),
                    assessment.positions().size(),
                    assessment.overallRiskLevel(),
                    assessment.positions(),
                    alerts);
            currentSnapshot = snapshot;

            Set<String> previous = new HashSet<>(activeConditions);
            activeConditions.clear();
            alerts.forEach(alert -> activeConditions.add(alert.conditionKey()));
            fresh = alerts.stream()
                    .filter(alert -> !previous.contains(alert.conditionKey()))
                    .toList();
        }
        log.debug("Monitor cycle account={} positions={} risk={} alerts={} new={}",
                accountId, snapshot.positionCount(), snapshot.riskLevel(), snapshot.alerts().size(), fresh.size());
        fresh.forEach(this::dispatch);
        return snapshot;
    }

    private void dispatch(Alert alert) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                log.warn("Alert listener failed for account {} alert {}: {}",
                        accountId, alert.conditionKey(), e.getMessage(), e);
            }
        }
    }
}
