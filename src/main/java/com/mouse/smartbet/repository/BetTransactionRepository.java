package com.mouse.smartbet.repository;

import com.mouse.smartbet.entity.BetTransaction;
import com.mouse.smartbet.enums.BetStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BetTransactionRepository extends JpaRepository<BetTransaction, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BetTransaction t WHERE t.id = :id")
    Optional<BetTransaction> findByIdForUpdate(@Param("id") Long id);

    // Owning account, without loading the transaction
    @Query("SELECT t.account.id FROM BetTransaction t WHERE t.id = :id")
    Optional<Long> findAccountIdById(@Param("id") Long id);

    // History per account, newest first
    List<BetTransaction> findByAccount_IdOrderByCreatedAtDesc(Long accountId);

    List<BetTransaction> findByAccount_IdAndStatus(Long accountId, BetStatus status);

    long countByAccount_IdAndStatus(Long accountId, BetStatus status);
}
