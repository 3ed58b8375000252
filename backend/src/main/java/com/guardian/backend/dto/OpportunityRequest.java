package com.guardian.backend.dto;

import com.guardian.backend.service.risk.Opportunity;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpportunityRequest {

    @NotBlank
    private String symbol;

    private String reason;

    private String expectedReturn;

    private String riskLevel;

    public Opportunity toOpportunity() {
        return new Opportunity(symbol.trim().toUpperCase(Locale.ROOT), reason, expectedReturn, riskLevel);
    }
}
