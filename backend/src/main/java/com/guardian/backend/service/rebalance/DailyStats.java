package com.guardian.backend.service.rebalance;

public record DailyStats(
        int tradesToday,
        int tradesRemaining,
        double totalVolume,
        int successCount,
        int failureCount,
        boolean dryRun
) {}
