package com.guardian.backend.service.rebalance;

import com.guardian.backend.service.monitor.PortfolioSnapshot;

import java.util.List;

public record SystemStatus(
        Long accountId,
        boolean monitoring,
        boolean rebalancing,
        boolean dryRun,
        PortfolioSnapshot portfolio,
        DailyStats dailyTrades,
        List<TradeExecution> recentTrades
) {}
