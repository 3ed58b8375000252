package com.guardian.backend.service.risk;

/**
 * Move {@code amount} of capital out of {@code fromSymbol} and, when known, into {@code toSymbol}.
 * Priority 1 is the most urgent.
 */
public record ReallocationSuggestion(
        String fromSymbol,
        String toSymbol,
        double amount,
        String reason,
        int priority,
        String expectedBenefit,
        String riskImpact
) {
    public static final String FREED_CAPITAL = "freed_capital";
}
