package com.guardian.backend.service.notification;

import com.guardian.backend.model.AlertUrgency;
import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.rebalance.TradeExecution;

import java.util.Locale;

/**
 * Human-readable messages for chat and log delivery.
 */
public final class NotificationFormatter {

    private NotificationFormatter() {
    }

    public static String formatAlert(Alert alert) {
        return String.format(Locale.US, "%s Alert: %s%n%s", urgencyMarker(alert.urgency()), alert.title(), alert.message());
    }

    public static String formatTrade(TradeExecution trade, boolean dryRun) {
        return String.format(Locale.US,
                "%s Trade Executed%s%n%s %.2f %s%nPrice: $%.2f%nValue: $%,.2f%nReason: %s",
                trade.success() ? "[OK]" : "[FAILED]",
                dryRun ? " (Simulated)" : "",
                trade.action(),
                trade.quantity(),
                trade.symbol(),
                trade.price(),
                trade.totalValue(),
                trade.reason());
    }

    static String urgencyMarker(AlertUrgency urgency) {
        if (urgency == null) {
            return "[?]";
        }
        return "[" + urgency.name() + "]";
    }
}
