package com.guardian.backend.controller;

import com.guardian.backend.model.Account;
import com.guardian.backend.model.Position;
import com.guardian.backend.repository.AccountRepository;
import com.guardian.backend.repository.PositionRepository;
import com.guardian.backend.repository.TradeOrderRepository;
import com.guardian.backend.service.rebalance.RebalancingSystemRegistry;
import com.guardian.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RebalancerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private PositionRepository positionRepository;

    @Autowired
    private TradeOrderRepository tradeOrderRepository;

    @Autowired
    private RebalancingSystemRegistry registry;

    private Long accountId;

    @BeforeEach
    void setup() {
        tradeOrderRepository.deleteAll();
        positionRepository.deleteAll();
        accountRepository.deleteAll();

        accountId = accountRepository.save(Account.builder()
                .name("Rebalance")
                .cashBalance(MoneyUtils.bd(2_000))
                .build()).getId();
        positionRepository.save(position("AAPL", 75.0));
        for (String symbol : new String[]{"MSFT", "GOOG", "AMZN", "META"}) {
            positionRepository.save(position(symbol, 100.0));
        }
    }

    @Test
    void startRunsFirstCycleAndSimulatesStopLossExit() throws Exception {
        mockMvc.perform(get("/api/rebalancer/{id}/status", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoring").value(false))
                .andExpect(jsonPath("$.recentTrades", hasSize(0)));

        mockMvc.perform(post("/api/rebalancer/{id}/start", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoring").value(true))
                .andExpect(jsonPath("$.rebalancing").value(true))
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.portfolio.riskLevel").exists())
                .andExpect(jsonPath("$.recentTrades", hasSize(1)))
                .andExpect(jsonPath("$.recentTrades[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$.recentTrades[0].action").value("SELL_ALL"))
                .andExpect(jsonPath("$.recentTrades[0].quantity").value(10.0))
                .andExpect(jsonPath("$.dailyTrades.tradesRemaining").value(9));

        mockMvc.perform(get("/api/rebalancer/{id}/stats", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tradesToday").value(1))
                .andExpect(jsonPath("$.totalVolume").value(750.0));

        mockMvc.perform(get("/api/rebalancer/{id}/trades", accountId).param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        assertThat(positionRepository.findFirstByAccountIdAndSymbolIgnoreCase(accountId, "AAPL")).isPresent();
        assertThat(tradeOrderRepository.findByAccountIdOrderByCreatedAtDesc(accountId)).isEmpty();
    }

    @Test
    void manualRebalanceRespectsCooldown() throws Exception {
        mockMvc.perform(post("/api/rebalancer/{id}/start", accountId)).andExpect(status().isOk());

        mockMvc.perform(post("/api/rebalancer/{id}/rebalance", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.alertsProcessed").value(2))
                .andExpect(jsonPath("$.tradesExecuted", hasSize(0)))
                .andExpect(jsonPath("$.summary", startsWith("Rebalance (DRY RUN) at ")));
    }

    @Test
    void stopIsIdempotent() throws Exception {
        mockMvc.perform(post("/api/rebalancer/{id}/start", accountId)).andExpect(status().isOk());

        mockMvc.perform(post("/api/rebalancer/{id}/stop", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoring").value(false))
                .andExpect(jsonPath("$.rebalancing").value(false));
        mockMvc.perform(post("/api/rebalancer/{id}/stop", accountId))
                .andExpect(status().isOk());
    }

    @Test
    void readsOnAnIdleAccountDoNotCreateASystem() throws Exception {
        mockMvc.perform(get("/api/rebalancer/{id}/status", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountId").value(accountId))
                .andExpect(jsonPath("$.monitoring").value(false))
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.dailyTrades.tradesRemaining").value(10));
        mockMvc.perform(get("/api/rebalancer/{id}/stats", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tradesToday").value(0))
                .andExpect(jsonPath("$.tradesRemaining").value(10));
        mockMvc.perform(get("/api/rebalancer/{id}/trades", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(post("/api/rebalancer/{id}/stop", accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rebalancing").value(false));

        assertThat(registry.find(accountId)).isEmpty();
    }

    @Test
    void rejectsBadRequests() throws Exception {
        mockMvc.perform(get("/api/rebalancer/{id}/trades", accountId).param("limit", "0"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/rebalancer/{id}/status", accountId + 1000))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Account not found: " + (accountId + 1000)));
        mockMvc.perform(get("/api/rebalancer/{id}/stats", accountId + 1000))
                .andExpect(status().isNotFound());
    }

    private Position position(String symbol, double current) {
        return Position.builder()
                .accountId(accountId)
                .symbol(symbol)
                .quantity(MoneyUtils.bd(10))
                .averageEntryPrice(MoneyUtils.bd(100))
                .currentPrice(MoneyUtils.bd(current))
                .openedAt(LocalDateTime.now().minusDays(20))
                .build();
    }
}
