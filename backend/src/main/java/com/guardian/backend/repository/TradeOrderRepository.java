package com.guardian.backend.repository;

import com.guardian.backend.model.TradeOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradeOrderRepository extends JpaRepository<TradeOrder, Long> {
    List<TradeOrder> findByAccountIdOrderByCreatedAtDesc(Long accountId);
}
