package com.guardian.backend.service.portfolio;

import com.guardian.backend.exception.NotFoundException;
import com.guardian.backend.exception.TradeExecutionException;
import com.guardian.backend.model.Account;
import com.guardian.backend.model.Position;
import com.guardian.backend.model.TradeOrder;
import com.guardian.backend.repository.AccountRepository;
import com.guardian.backend.repository.PositionRepository;
import com.guardian.backend.repository.TradeOrderRepository;
import com.guardian.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaPositionStore implements PositionStore {

    private static final String STATUS_FILLED = "FILLED";

    private final AccountRepository accountRepository;
    private final PositionRepository positionRepository;
    private final TradeOrderRepository tradeOrderRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findAccount(Long accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return accountRepository.findById(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> findPositions(Long accountId) {
        return positionRepository.findByAccountIdOrderByIdAsc(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> findPosition(Long accountId, String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        return positionRepository.findFirstByAccountIdAndSymbolIgnoreCase(accountId, symbol.trim());
    }

    @Override
    @Transactional
    public TradeOrder applyTrade(TradeInstruction instruction) {
        if (instruction.action() == null || !instruction.action().isSell()) {
            throw new TradeExecutionException("Unsupported rebalance action: " + instruction.action());
        }
        Account account = accountRepository.findById(instruction.accountId())
                .orElseThrow(() -> new NotFoundException("Account not found: " + instruction.accountId()));
        Position position = positionRepository
                .findFirstByAccountIdAndSymbolIgnoreCase(instruction.accountId(), instruction.symbol())
                .orElseThrow(() -> new NotFoundException("No position found for symbol: " + instruction.symbol()));

        BigDecimal quantity = MoneyUtils.bd(instruction.quantity());
        if (quantity.signum() <= 0) {
            throw new TradeExecutionException("Trade quantity must be positive for " + instruction.symbol());
        }
        if (quantity.compareTo(MoneyUtils.scale(position.getQuantity())) > 0) {
            throw new TradeExecutionException("Cannot sell " + quantity + " " + instruction.symbol()
                    + ", only " + position.getQuantity() + " held");
        }
        BigDecimal price = MoneyUtils.bd(instruction.price());
        LocalDateTime now = LocalDateTime.now(clock);

        TradeOrder order = tradeOrderRepository.save(TradeOrder.builder()
                .accountId(instruction.accountId())
                .symbol(position.getSymbol())
                .side("SELL")
                .quantity(quantity)
                .price(price)
                .status(STATUS_FILLED)
                .sourceAlert(instruction.sourceAlert())
                .createdAt(now)
                .filledAt(now)
                .build());

        BigDecimal remaining = MoneyUtils.subtract(position.getQuantity(), quantity);
        if (remaining.signum() <= 0) {
            positionRepository.delete(position);
        } else {
            position.setQuantity(remaining);
            positionRepository.save(position);
        }

        account.setCashBalance(MoneyUtils.add(account.getCashBalance(), MoneyUtils.multiply(price, quantity)));
        accountRepository.save(account);

        log.info("Applied SELL {} {} @ {} for account {} (remaining {})",
                quantity, position.getSymbol(), price, instruction.accountId(), remaining.max(MoneyUtils.ZERO));
        return order;
    }
}
