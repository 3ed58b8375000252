package com.guardian.backend.exception;

/**
 * Raised when the daily trade cap or a per-symbol cooldown blocks a trade.
 */
public class ThrottledException extends RuntimeException {
    public static final String DAILY_LIMIT = "daily_limit";
    public static final String COOLDOWN = "cooldown";

    private final String symbol;
    private final String reason;

    public ThrottledException(String symbol, String reason, String message) {
        super(message);
        this.symbol = symbol;
        this.reason = reason;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getReason() {
        return reason;
    }
}
