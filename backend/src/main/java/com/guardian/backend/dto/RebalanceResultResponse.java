package com.guardian.backend.dto;

import com.guardian.backend.service.monitor.PortfolioSnapshot;
import com.guardian.backend.service.rebalance.RebalanceResult;
import com.guardian.backend.service.rebalance.TradeExecution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceResultResponse {

    private LocalDateTime timestamp;
    private List<TradeExecution> tradesExecuted;
    private int alertsProcessed;
    private PortfolioSnapshot portfolioBefore;
    private PortfolioSnapshot portfolioAfter;
    private boolean dryRun;
    private String summary;

    public static RebalanceResultResponse from(RebalanceResult result) {
        return RebalanceResultResponse.builder()
                .timestamp(result.timestamp())
                .tradesExecuted(result.tradesExecuted())
                .alertsProcessed(result.alertsProcessed())
                .portfolioBefore(result.portfolioBefore())
                .portfolioAfter(result.portfolioAfter())
                .dryRun(result.dryRun())
                .summary(result.summary())
                .build();
    }
}
