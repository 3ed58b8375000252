package com.guardian.backend.service.portfolio;

import com.guardian.backend.model.Account;
import com.guardian.backend.model.AlertType;
import com.guardian.backend.model.Position;
import com.guardian.backend.model.RebalanceAction;
import com.guardian.backend.model.TradeOrder;

import java.util.List;
import java.util.Optional;

/**
 * Holdings and cash of an account, plus the single write path used by live rebalancing.
 */
public interface PositionStore {

    Optional<Account> findAccount(Long accountId);

    List<Position> findPositions(Long accountId);

    Optional<Position> findPosition(Long accountId, String symbol);

    /**
     * Applies a filled trade atomically: either the order, the position change and the cash change
     * are all stored, or none of them is.
     */
    TradeOrder applyTrade(TradeInstruction instruction);

    record TradeInstruction(
            Long accountId,
            String symbol,
            RebalanceAction action,
            double quantity,
            double price,
            AlertType sourceAlert
    ) {}
}
