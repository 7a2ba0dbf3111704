package com.flagship.bank_transfer.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TransferRepository extends JpaRepository<TransferEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransferEntity t WHERE t.transferId = :transferId")
    Optional<TransferEntity> findByIdForUpdate(@Param("transferId") String transferId);

    /**
     * Finds a transfer by the idempotency key its sender supplied.
     */
    Optional<TransferEntity> findByFromUserAndIdempotencyKey(String fromUser, String idempotencyKey);

    /**
     * Every transfer the user sent or received, newest first.
     */
    @Query("""
        SELECT t FROM TransferEntity t
        WHERE t.fromUser = :username OR t.toUser = :username
        ORDER BY t.createdAt DESC, t.transferId DESC
        """)
    List<TransferEntity> findByParticipant(@Param("username") String username);
}
