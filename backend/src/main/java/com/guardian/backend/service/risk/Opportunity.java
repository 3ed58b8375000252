package com.guardian.backend.service.risk;

/**
 * Candidate destination for freed capital, supplied by the caller.
 */
public record Opportunity(
        String symbol,
        String reason,
        String expectedReturn,
        String riskLevel
) {
}
