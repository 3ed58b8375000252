package com.guardian.backend.service.notification;

import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.AlertUrgency;
import com.guardian.backend.model.RebalanceAction;
import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.rebalance.TradeExecution;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFormatterTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 4, 10, 0);

    @Test
    void alertStartsWithUrgency() {
        Alert alert = new Alert(AlertType.STOP_LOSS_HIT, AlertUrgency.IMMEDIATE, "AAPL",
                "Stop-loss hit: AAPL", "AAPL is down 25.0%", Map.of(), NOW);

        assertThat(NotificationFormatter.formatAlert(alert).lines())
                .containsExactly("[IMMEDIATE] Alert: Stop-loss hit: AAPL", "AAPL is down 25.0%");
    }

    @Test
    void simulatedTradeIsMarked() {
        TradeExecution trade = new TradeExecution(NOW, "AAPL", RebalanceAction.SELL_ALL, 10, 75.0, 750.0,
                "Stop-loss triggered at -25.0% loss", AlertType.STOP_LOSS_HIT, true, null);

        assertThat(NotificationFormatter.formatTrade(trade, true).lines()).containsExactly(
                "[OK] Trade Executed (Simulated)",
                "SELL_ALL 10.00 AAPL",
                "Price: $75.00",
                "Value: $750.00",
                "Reason: Stop-loss triggered at -25.0% loss");
    }

    @Test
    void failedLiveTradeIsFlagged() {
        TradeExecution trade = new TradeExecution(NOW, "MSFT", RebalanceAction.SELL, 2.5, 400.0, 1_000.0,
                "Taking profits at 35.0% gain", AlertType.TAKE_PROFIT, false, "database unavailable");

        assertThat(NotificationFormatter.formatTrade(trade, false))
                .startsWith("[FAILED] Trade Executed" + System.lineSeparator())
                .contains("Value: $1,000.00");
    }
}
