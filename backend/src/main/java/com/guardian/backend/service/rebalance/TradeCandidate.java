package com.guardian.backend.service.rebalance;

import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.RebalanceAction;

/**
 * What an alert handler wants done, before throttling and sizing.
 * {@code reducePct} only applies to {@link RebalanceAction#SELL}. {@code alertPrice} is {@code null} when the
 * alert carried no price.
 */
record TradeCandidate(
        String symbol,
        RebalanceAction action,
        double reducePct,
        String reason,
        AlertType alertType,
        Double alertPrice
) {

    static TradeCandidate sellAll(String symbol, String reason, AlertType alertType, Double alertPrice) {
        return new TradeCandidate(symbol, RebalanceAction.SELL_ALL, 100.0, reason, alertType, alertPrice);
    }

    static TradeCandidate sell(String symbol, double reducePct, String reason, AlertType alertType, Double alertPrice) {
        return new TradeCandidate(symbol, RebalanceAction.SELL, reducePct, reason, alertType, alertPrice);
    }
}
