package com.mouse.smartbet.repository;

import com.mouse.smartbet.entity.BankrollAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BankrollAccountRepository extends JpaRepository<BankrollAccount, Long> {

    /**
     * Find account by owner
     */
    Optional<BankrollAccount> findByOwnerId(String ownerId);

    /**
     * Check if an account exists for owner
     */
    boolean existsByOwnerId(String ownerId);

    /**
     * Load the account with a row lock held until the surrounding transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM BankrollAccount a WHERE a.id = :id")
    Optional<BankrollAccount> findByIdForUpdate(@Param("id") Long id);
}
