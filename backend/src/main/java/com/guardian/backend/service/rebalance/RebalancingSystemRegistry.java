package com.guardian.backend.service.rebalance;

import com.guardian.backend.config.MonitorProperties;
import com.guardian.backend.config.RebalanceProperties;
import com.guardian.backend.exception.NotFoundException;
import com.guardian.backend.service.MetricsService;
import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.monitor.AlertDetector;
import com.guardian.backend.service.monitor.PortfolioMonitor;
import com.guardian.backend.service.notification.BroadcastService;
import com.guardian.backend.service.notification.NotificationChannel;
import com.guardian.backend.service.notification.NotificationFormatter;
import com.guardian.backend.service.portfolio.PositionStore;
import com.guardian.backend.service.risk.PortfolioRiskService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

@Slf4j
@Service
@RequiredArgsConstructor
public class RebalancingSystemRegistry {

    private final PositionStore positionStore;
    private final PortfolioRiskService portfolioRiskService;
    private final AlertDetector alertDetector;
    private final RebalanceProperties rebalanceProperties;
    private final MonitorProperties monitorProperties;
    private final MetricsService metricsService;
    private final BroadcastService broadcastService;
    private final Clock clock;
    @Qualifier("notificationExecutor")
    private final Executor notificationExecutor;

    private final Map<Long, RebalancingSystem> systems = new ConcurrentHashMap<>();

    public RebalancingSystem getOrCreate(Long accountId) {
        requireAccount(accountId);
        return systems.computeIfAbsent(accountId, this::create);
    }

    public Optional<RebalancingSystem> find(Long accountId) {
        return Optional.ofNullable(systems.get(accountId));
    }

    /**
     * Status of the account's system, or an idle status when none was ever created. Never creates one.
     */
    public SystemStatus getStatus(Long accountId) {
        return find(accountId)
                .map(RebalancingSystem::getStatus)
                .orElseGet(() -> new SystemStatus(requireAccount(accountId), false, false,
                        rebalanceProperties.toConfig().dryRun(), null, idleStats(), List.of()));
    }

    public DailyStats getDailyStats(Long accountId) {
        return find(accountId)
                .map(system -> system.getRebalancer().getDailyStats())
                .orElseGet(() -> {
                    requireAccount(accountId);
                    return idleStats();
                });
    }

    public List<TradeExecution> getTradeHistory(Long accountId, int limit) {
        return find(accountId)
                .map(system -> system.getRebalancer().getTradeHistory(limit))
                .orElseGet(() -> {
                    requireAccount(accountId);
                    return List.of();
                });
    }

    public List<RebalancingSystem> runningSystems() {
        return systems.values().stream().filter(RebalancingSystem::isRunning).toList();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startConfiguredAccounts() {
        for (Long accountId : monitorProperties.getAutoStartAccounts()) {
            try {
                getOrCreate(accountId).start();
            } catch (NotFoundException e) {
                log.warn("Skipping auto-start for account {}: {}", accountId, e.getMessage());
            }
        }
    }

    @PreDestroy
    public void stopAll() {
        systems.values().forEach(RebalancingSystem::stop);
    }

    private Long requireAccount(Long accountId) {
        positionStore.findAccount(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        return accountId;
    }

    private DailyStats idleStats() {
        RebalanceConfig config = rebalanceProperties.toConfig();
        return new DailyStats(0, config.maxDailyTrades(), 0.0, 0, 0, config.dryRun());
    }

    private RebalancingSystem create(Long accountId) {
        RebalanceConfig config = rebalanceProperties.toConfig();
        int capacity = rebalanceProperties.getNotificationQueueCapacity();

        NotificationChannel<Alert> alerts = new NotificationChannel<>(
                "alerts-" + accountId, capacity, notificationExecutor, metricsService);
        alerts.addListener(alert -> log.info("Account {}: {}", accountId, NotificationFormatter.formatAlert(alert)));
        alerts.addListener(alert -> broadcastService.broadcastAlert(accountId, alert));

        NotificationChannel<TradeExecution> trades = new NotificationChannel<>(
                "trades-" + accountId, capacity, notificationExecutor, metricsService);
        trades.addListener(trade -> log.info("Account {}: {}", accountId,
                NotificationFormatter.formatTrade(trade, config.dryRun())));
        trades.addListener(trade -> broadcastService.broadcastTrade(accountId, trade));

        NotificationChannel<RebalanceResult> results = new NotificationChannel<>(
                "rebalances-" + accountId, capacity, notificationExecutor, metricsService);
        results.addListener(result -> log.info("Account {}: {}", accountId, result.summary()));

        AutoRebalancer rebalancer = new AutoRebalancer(accountId, config, positionStore, clock, metricsService,
                trades::publish, results::publish);
        PortfolioMonitor monitor = new PortfolioMonitor(accountId, portfolioRiskService, alertDetector, clock);
        log.info("Created rebalancing system for account {}", accountId);
        return new RebalancingSystem(monitor, rebalancer, alerts);
    }
}
