package com.guardian.backend.repository;

import com.guardian.backend.model.Position;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {
    List<Position> findByAccountIdOrderByIdAsc(Long accountId);
    Optional<Position> findFirstByAccountIdAndSymbolIgnoreCase(Long accountId, String symbol);
}
