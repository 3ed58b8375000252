package com.guardian.backend.service.rebalance;

import com.guardian.backend.service.monitor.PortfolioSnapshot;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

public record RebalanceResult(
        LocalDateTime timestamp,
        List<TradeExecution> tradesExecuted,
        int alertsProcessed,
        PortfolioSnapshot portfolioBefore,
        PortfolioSnapshot portfolioAfter,
        boolean dryRun
) {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public RebalanceResult {
        tradesExecuted = List.copyOf(tradesExecuted);
    }

    /**
     * One-line summary counting successful trades only.
     */
    public String summary() {
        List<TradeExecution> executed = tradesExecuted.stream().filter(TradeExecution::success).toList();
        double totalValue = executed.stream().mapToDouble(TradeExecution::totalValue).sum();
        return String.format(Locale.US, "Rebalance %sat %s: %d trades, $%,.2f total",
                dryRun ? "(DRY RUN) " : "", timestamp.format(TIME), executed.size(), totalValue);
    }
}
