package com.guardian.backend.service.monitor;

import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.AlertUrgency;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * A threshold crossing detected by the monitor. {@code data} holds the figures that triggered it,
 * keyed by {@link #PNL_PCT}, {@link #CURRENT_PRICE}, {@link #CONCENTRATION_PCT} or {@link #IDLE_PCT}.
 */
public record Alert(
        AlertType alertType,
        AlertUrgency urgency,
        String symbol,
        String title,
        String message,
        Map<String, Double> data,
        LocalDateTime timestamp
) {
    public static final String PNL_PCT = "pnl_pct";
    public static final String CURRENT_PRICE = "current_price";
    public static final String CONCENTRATION_PCT = "concentration_pct";
    public static final String IDLE_PCT = "idle_pct";

    public Alert {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public double value(String key) {
        Double value = find(key);
        return value == null ? 0.0 : value;
    }

    /**
     * The figure under {@code key}, or {@code null} when the alert does not carry it.
     */
    public Double find(String key) {
        Double value = data.get(key);
        return value == null || value.isNaN() ? null : value;
    }

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }

    /**
     * Identity of the underlying condition, stable across monitor cycles.
     */
    public String conditionKey() {
        return alertType + ":" + (hasSymbol() ? symbol.toUpperCase(Locale.ROOT) : "*");
    }
}
