package com.guardian.backend.controller;

import com.guardian.backend.dto.OpportunityRequest;
import com.guardian.backend.dto.ReallocationRequest;
import com.guardian.backend.service.risk.Opportunity;
import com.guardian.backend.service.risk.PortfolioRiskAssessment;
import com.guardian.backend.service.risk.PortfolioRiskService;
import com.guardian.backend.service.risk.PositionRiskAssessment;
import com.guardian.backend.service.risk.ReallocationSuggestion;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
@Tag(name = "Portfolio Risk")
public class PortfolioRiskController {

    private final PortfolioRiskService portfolioRiskService;

    @GetMapping("/{accountId}/risk")
    @Operation(summary = "Assess portfolio risk")
    public ResponseEntity<PortfolioRiskAssessment> assess(@PathVariable Long accountId) {
        return ResponseEntity.ok(portfolioRiskService.assessPortfolio(accountId));
    }

    @GetMapping("/{accountId}/positions/{symbol}/risk")
    @Operation(summary = "Assess a single position")
    public ResponseEntity<PositionRiskAssessment> assessPosition(@PathVariable Long accountId,
                                                                 @PathVariable String symbol) {
        return ResponseEntity.ok(portfolioRiskService.getPositionRecommendation(accountId, symbol));
    }

    @PostMapping("/{accountId}/reallocation")
    @Operation(summary = "Suggest where to move capital freed by reductions and exits")
    public ResponseEntity<List<ReallocationSuggestion>> reallocation(@PathVariable Long accountId,
                                                                     @Valid @RequestBody(required = false) ReallocationRequest request) {
        List<Opportunity> opportunities = request == null ? List.of() : request.getOpportunities().stream()
                .map(OpportunityRequest::toOpportunity)
                .toList();
        log.info("Reallocation requested for account {} with {} opportunities", accountId, opportunities.size());
        return ResponseEntity.ok(portfolioRiskService.getReallocationSuggestions(accountId, opportunities));
    }
}
