package com.guardian.backend.controller;

import com.guardian.backend.service.advisor.DebateResult;
import com.guardian.backend.service.advisor.PortfolioAdvice;
import com.guardian.backend.service.advisor.RiskDebateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/advisor")
@RequiredArgsConstructor
@Tag(name = "Advisor")
public class AdvisorController {

    private final RiskDebateService riskDebateService;

    @GetMapping("/{accountId}/positions/{symbol}/debate")
    @Operation(summary = "Run the three-way risk debate for one position")
    public ResponseEntity<DebateResult> debate(@PathVariable Long accountId, @PathVariable String symbol) {
        return ResponseEntity.ok(riskDebateService.debate(accountId, symbol));
    }

    @GetMapping("/{accountId}/recommendations")
    @Operation(summary = "Debate every position and aggregate the portfolio risk score")
    public ResponseEntity<PortfolioAdvice> recommendations(@PathVariable Long accountId) {
        return ResponseEntity.ok(riskDebateService.portfolioRecommendations(accountId));
    }
}
