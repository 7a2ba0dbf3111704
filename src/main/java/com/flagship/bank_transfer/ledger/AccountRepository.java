package com.flagship.bank_transfer.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, String> {

    /**
     * Loads an account with a row-level write lock (SELECT ... FOR UPDATE),
     * held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.username = :username")
    Optional<AccountEntity> findByUsernameForUpdate(@Param("username") String username);

    @Query("SELECT a.balance FROM AccountEntity a WHERE a.username = :username")
    Optional<BigDecimal> findBalance(@Param("username") String username);

    @Query("SELECT COALESCE(SUM(a.balance), 0) FROM AccountEntity a")
    BigDecimal totalBalance();
}
