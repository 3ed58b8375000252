package com.guardian.backend.service.rebalance;

import com.guardian.backend.exception.BadRequestException;
import com.guardian.backend.exception.ThrottledException;
import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.Position;
import com.guardian.backend.model.RebalanceAction;
import com.guardian.backend.service.MetricsService;
import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.monitor.AlertSource;
import com.guardian.backend.service.monitor.PortfolioSnapshot;
import com.guardian.backend.service.portfolio.PositionStore;
import com.guardian.backend.service.portfolio.PositionStore.TradeInstruction;
import com.guardian.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Turns monitor alerts for one account into throttled sell trades.
 * <p>
 * Handling of a single alert (throttle check, sizing, execution and bookkeeping) runs under one lock,
 * so the daily cap and per-symbol cooldowns hold when alerts arrive concurrently. Failures never escape
 * {@link #handleAlert(Alert)}: they are logged or recorded in the trade history.
 */
@Slf4j
public class AutoRebalancer {

    static final double STOP_LOSS_REDUCE_PCT = 50.0;
    static final double TAKE_PROFIT_REDUCE_PCT = 50.0;

    private final Long accountId;
    private final RebalanceConfig config;
    private final PositionStore positionStore;
    private final Clock clock;
    private final MetricsService metricsService;
    private final Consumer<TradeExecution> onTrade;
    private final Consumer<RebalanceResult> onRebalance;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile AlertSource alertSource;

    // guarded by lock
    private final List<TradeExecution> tradeHistory = new ArrayList<>();
    private final Map<String, LocalDateTime> lastTradeTime = new HashMap<>();
    private int dailyTradeCount;
    private LocalDate lastResetDate;

    public AutoRebalancer(Long accountId,
                          RebalanceConfig config,
                          PositionStore positionStore,
                          Clock clock,
                          MetricsService metricsService,
                          Consumer<TradeExecution> onTrade,
                          Consumer<RebalanceResult> onRebalance) {
        this.accountId = accountId;
        this.config = config;
        this.positionStore = positionStore;
        this.clock = clock;
        this.metricsService = metricsService;
        this.onTrade = onTrade;
        this.onRebalance = onRebalance;
        this.lastResetDate = LocalDate.now(clock);
    }

    /**
     * Attaches to an alert source and starts accepting alerts. Subscribes only on the first attach
     * to a given source, so restarting does not deliver alerts twice.
     */
    public void start(AlertSource source) {
        if (alertSource != source) {
            source.subscribe(this::handleAlert);
            alertSource = source;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Auto-rebalancer started for account {} mode={}", accountId, config.dryRun() ? "DRY RUN" : "LIVE");
        }
    }

    /**
     * Stops accepting new alerts. Alerts already being handled run to completion.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Auto-rebalancer stopped for account {}", accountId);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Long getAccountId() {
        return accountId;
    }

    public RebalanceConfig getConfig() {
        return config;
    }

    public void handleAlert(Alert alert) {
        process(alert);
    }

    /**
     * Re-evaluates every alert of the current snapshot on the calling thread.
     */
    public RebalanceResult manualRebalance() {
        AlertSource source = alertSource;
        if (source == null) {
            throw new BadRequestException("Rebalancer for account " + accountId + " is not connected to a monitor");
        }
        PortfolioSnapshot before = source.getCurrentSnapshot();
        List<Alert> alerts = before == null ? List.of() : before.alerts();
        List<TradeExecution> executed = new ArrayList<>();
        for (Alert alert : alerts) {
            process(alert).ifPresent(executed::add);
        }
        RebalanceResult result = new RebalanceResult(
                LocalDateTime.now(clock),
                executed,
                alerts.size(),
                before,
                source.getCurrentSnapshot(),
                config.dryRun());
        log.info("Account {}: {}", accountId, result.summary());
        notify(onRebalance, result, "rebalance");
        return result;
    }

    public DailyStats getDailyStats() {
        lock.lock();
        try {
            resetDailyLimitsIfNeeded();
            LocalDate today = LocalDate.now(clock);
            List<TradeExecution> todays = tradeHistory.stream()
                    .filter(trade -> trade.timestamp().toLocalDate().equals(today))
                    .toList();
            int success = (int) todays.stream().filter(TradeExecution::success).count();
            double volume = todays.stream()
                    .filter(TradeExecution::success)
                    .mapToDouble(TradeExecution::totalValue)
                    .sum();
            return new DailyStats(
                    todays.size(),
                    config.maxDailyTrades() - dailyTradeCount,
                    volume,
                    success,
                    todays.size() - success,
                    config.dryRun());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent executions, oldest first.
     */
    public List<TradeExecution> getTradeHistory(int limit) {
        lock.lock();
        try {
            int from = Math.max(0, tradeHistory.size() - Math.max(0, limit));
            return List.copyOf(tradeHistory.subList(from, tradeHistory.size()));
        } finally {
            lock.unlock();
        }
    }

    private Optional<TradeExecution> process(Alert alert) {
        if (!running.get() || !config.enabled()) {
            log.debug("Account {}: ignoring alert {} (rebalancer inactive)", accountId, alert.conditionKey());
            return Optional.empty();
        }
        if (alert.alertType() == null || !config.shouldActOn(alert.urgency())) {
            log.debug("Account {}: skipping alert (urgency {}): {}", accountId, alert.urgency(), alert.title());
            return Optional.empty();
        }
        metricsService.recordAlert(alert.alertType());
        Optional<TradeCandidate> candidate = toCandidate(alert);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return execute(candidate.get());
        } finally {
            lock.unlock();
        }
    }

    private Optional<TradeCandidate> toCandidate(Alert alert) {
        if (alert.alertType() == AlertType.IDLE_CAPITAL) {
            log.info("Account {}: idle capital detected at {}% - consider deploying",
                    accountId, format("%.1f", alert.value(Alert.IDLE_PCT)));
            return Optional.empty();
        }
        if (!alert.hasSymbol()) {
            log.debug("Account {}: {} alert without symbol ignored", accountId, alert.alertType());
            return Optional.empty();
        }
        String symbol = alert.symbol();
        double pnlPct = alert.value(Alert.PNL_PCT);
        Double price = alert.find(Alert.CURRENT_PRICE);

        return switch (alert.alertType()) {
            case STOP_LOSS_HIT -> Optional.of(pnlPct < config.autoExitLossPct()
                    ? TradeCandidate.sellAll(symbol, format("Stop-loss triggered at %.1f%% loss", pnlPct),
                            alert.alertType(), price)
                    : TradeCandidate.sell(symbol, STOP_LOSS_REDUCE_PCT,
                            format("Reducing exposure due to %.1f%% loss", pnlPct), alert.alertType(), price));
            case TAKE_PROFIT -> pnlPct > config.autoReduceGainPct()
                    ? Optional.of(TradeCandidate.sell(symbol,
                            Math.min(TAKE_PROFIT_REDUCE_PCT, config.maxSingleTradePct()),
                            format("Taking profits at %.1f%% gain", pnlPct), alert.alertType(), price))
                    : Optional.empty();
            case CONCENTRATION -> concentrationCandidate(alert, symbol, price);
            case RISK_THRESHOLD -> Optional.of(TradeCandidate.sellAll(symbol,
                    "Critical risk threshold exceeded", alert.alertType(), price));
            default -> Optional.empty();
        };
    }

    private Optional<TradeCandidate> concentrationCandidate(Alert alert, String symbol, Double price) {
        double concentration = alert.value(Alert.CONCENTRATION_PCT);
        if (concentration <= config.autoReduceConcentrationPct()) {
            return Optional.empty();
        }
        double target = config.targetPositionPct();
        // may leave the position above target when the single-trade cap binds
        double reducePct = Math.min((concentration - target) / concentration * 100, config.maxSingleTradePct());
        return Optional.of(TradeCandidate.sell(symbol, reducePct,
                format("Reducing concentration from %.1f%% to ~%.1f%%", concentration, target),
                alert.alertType(), price));
    }

    private Optional<TradeExecution> execute(TradeCandidate candidate) {
        String symbol = candidate.symbol();
        try {
            ensureCanTrade(symbol);
        } catch (ThrottledException e) {
            log.warn("Account {}: cannot trade {}: {}", accountId, symbol, e.getMessage());
            metricsService.recordThrottled(e.getReason());
            return Optional.empty();
        }

        Optional<Position> found = positionStore.findPosition(accountId, symbol);
        if (found.isEmpty()) {
            log.warn("Account {}: no position found for {}", accountId, symbol);
            return Optional.empty();
        }
        Position position = found.get();
        double held = MoneyUtils.toDouble(position.getQuantity());
        double quantity = candidate.action() == RebalanceAction.SELL_ALL
                ? held
                : Math.min(held * candidate.reducePct() / 100.0, held * config.maxSingleTradePct() / 100.0);
        double price = resolvePrice(candidate.alertPrice(), position);
        double tradeValue = quantity * price;

        if (candidate.action() != RebalanceAction.SELL_ALL && tradeValue < config.minTradeValue()) {
            log.info("Account {}: trade too small for {}: ${}", accountId, symbol, format("%.2f", tradeValue));
            return Optional.empty();
        }

        TradeExecution execution = new TradeExecution(
                LocalDateTime.now(clock),
                symbol,
                candidate.action(),
                quantity,
                price,
                tradeValue,
                candidate.reason(),
                candidate.alertType(),
                true,
                null);

        if (config.dryRun()) {
            log.info("Account {}: [DRY RUN] would {} {} {} @ ${} = ${} ({})", accountId, candidate.action(),
                    format("%.2f", quantity), symbol, format("%.2f", price), format("%,.2f", tradeValue),
                    candidate.reason());
        } else {
            try {
                positionStore.applyTrade(new TradeInstruction(
                        accountId, symbol, candidate.action(), quantity, price, candidate.alertType()));
                log.info("Account {}: EXECUTED {} {} {} @ ${} = ${}", accountId, candidate.action(),
                        format("%.2f", quantity), symbol, format("%.2f", price), format("%,.2f", tradeValue));
            } catch (RuntimeException e) {
                log.error("Account {}: trade failed for {}: {}", accountId, symbol, e.getMessage(), e);
                execution = execution.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
        }

        record(execution);
        notify(onTrade, execution, "trade");
        return Optional.of(execution);
    }

    private void record(TradeExecution execution) {
        tradeHistory.add(execution);
        dailyTradeCount++;
        lastTradeTime.put(key(execution.symbol()), execution.timestamp());
        metricsService.recordTrade(execution.success(), config.dryRun());
    }

    private void ensureCanTrade(String symbol) {
        resetDailyLimitsIfNeeded();
        if (dailyTradeCount >= config.maxDailyTrades()) {
            throw new ThrottledException(symbol, ThrottledException.DAILY_LIMIT, "Daily trade limit reached");
        }
        LocalDateTime lastTrade = lastTradeTime.get(key(symbol));
        if (lastTrade != null) {
            Duration elapsed = Duration.between(lastTrade, LocalDateTime.now(clock));
            Duration cooldown = Duration.ofMinutes(config.cooldownMinutes());
            if (elapsed.compareTo(cooldown) < 0) {
                long minutesLeft = Math.round(cooldown.minus(elapsed).toSeconds() / 60.0);
                throw new ThrottledException(symbol, ThrottledException.COOLDOWN,
                        "Cooldown active (" + minutesLeft + " min left)");
            }
        }
    }

    private void resetDailyLimitsIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.isAfter(lastResetDate)) {
            log.debug("Account {}: daily trade count reset ({} trades on {})", accountId, dailyTradeCount, lastResetDate);
            dailyTradeCount = 0;
            lastResetDate = today;
        }
    }

    // a quoted price of 0 is real; only a missing quote falls back
    private double resolvePrice(Double alertPrice, Position position) {
        if (alertPrice != null) {
            return alertPrice;
        }
        if (position.getCurrentPrice() != null) {
            return MoneyUtils.toDouble(position.getCurrentPrice());
        }
        return MoneyUtils.toDouble(position.getAverageEntryPrice());
    }

    private <T> void notify(Consumer<T> callback, T event, String kind) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            log.warn("Account {}: {} callback failed: {}", accountId, kind, e.getMessage(), e);
        }
    }

    private static String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.US, template, args);
    }
}
