package com.guardian.backend.controller;

import com.guardian.backend.dto.RebalanceResultResponse;
import com.guardian.backend.service.rebalance.DailyStats;
import com.guardian.backend.service.rebalance.RebalancingSystem;
import com.guardian.backend.service.rebalance.RebalancingSystemRegistry;
import com.guardian.backend.service.rebalance.SystemStatus;
import com.guardian.backend.service.rebalance.TradeExecution;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/rebalancer")
@RequiredArgsConstructor
@Tag(name = "Rebalancer")
public class RebalancerController {

    private final RebalancingSystemRegistry registry;

    @GetMapping("/{accountId}/status")
    @Operation(summary = "Monitoring and rebalancing status")
    public ResponseEntity<SystemStatus> status(@PathVariable Long accountId) {
        return ResponseEntity.ok(registry.getStatus(accountId));
    }

    @PostMapping("/{accountId}/start")
    @Operation(summary = "Start monitoring and auto-rebalancing")
    public ResponseEntity<SystemStatus> start(@PathVariable Long accountId) {
        RebalancingSystem system = registry.getOrCreate(accountId);
        system.start();
        return ResponseEntity.ok(system.getStatus());
    }

    @PostMapping("/{accountId}/stop")
    @Operation(summary = "Stop monitoring and auto-rebalancing")
    public ResponseEntity<SystemStatus> stop(@PathVariable Long accountId) {
        registry.find(accountId).ifPresent(RebalancingSystem::stop);
        return ResponseEntity.ok(registry.getStatus(accountId));
    }

    @PostMapping("/{accountId}/rebalance")
    @Operation(summary = "Re-evaluate the current alerts now")
    public ResponseEntity<RebalanceResultResponse> rebalance(@PathVariable Long accountId) {
        log.info("Manual rebalance requested for account {}", accountId);
        return ResponseEntity.ok(RebalanceResultResponse.from(registry.getOrCreate(accountId).triggerRebalance()));
    }

    @GetMapping("/{accountId}/stats")
    @Operation(summary = "Today's trading statistics")
    public ResponseEntity<DailyStats> stats(@PathVariable Long accountId) {
        return ResponseEntity.ok(registry.getDailyStats(accountId));
    }

    @GetMapping("/{accountId}/trades")
    @Operation(summary = "Recent trade executions, oldest first")
    public ResponseEntity<List<TradeExecution>> trades(@PathVariable Long accountId,
                                                       @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(registry.getTradeHistory(accountId, limit));
    }
}
