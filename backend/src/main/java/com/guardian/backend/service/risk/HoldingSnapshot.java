package com.guardian.backend.service.risk;

/**
 * Read-only view of a held position as the risk engine sees it.
 *
 * @param currentPrice last known price, {@code null} when unknown (entry price is used instead)
 */
public record HoldingSnapshot(
        String symbol,
        double quantity,
        double entryPrice,
        Double currentPrice,
        int daysHeld
) {

    public double effectivePrice() {
        return currentPrice != null ? currentPrice : entryPrice;
    }

    public double marketValue() {
        return quantity * effectivePrice();
    }
}
