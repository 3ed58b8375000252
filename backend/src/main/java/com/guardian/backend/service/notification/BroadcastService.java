package com.guardian.backend.service.notification;

import com.guardian.backend.service.monitor.Alert;
import com.guardian.backend.service.rebalance.TradeExecution;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BroadcastService {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Pushes executed or simulated trades to dashboards watching the account
     */
    public void broadcastTrade(Long accountId, TradeExecution trade) {
        messagingTemplate.convertAndSend("/topic/rebalancer/" + accountId + "/trades", trade);
    }

    /**
     * Pushes newly detected alerts
     */
    public void broadcastAlert(Long accountId, Alert alert) {
        messagingTemplate.convertAndSend("/topic/rebalancer/" + accountId + "/alerts", alert);
    }
}
