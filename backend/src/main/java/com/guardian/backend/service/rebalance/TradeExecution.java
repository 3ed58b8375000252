package com.guardian.backend.service.rebalance;

import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.RebalanceAction;

import java.time.LocalDateTime;

/**
 * One execution attempt, simulated or live. Failed attempts are kept with {@code success = false}.
 */
public record TradeExecution(
        LocalDateTime timestamp,
        String symbol,
        RebalanceAction action,
        double quantity,
        double price,
        double totalValue,
        String reason,
        AlertType alertType,
        boolean success,
        String error
) {

    TradeExecution failed(String failure) {
        return new TradeExecution(timestamp, symbol, action, quantity, price, totalValue, reason, alertType, false, failure);
    }
}
