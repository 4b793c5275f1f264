package com.memehub.engagement.repository;

import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.entity.PointTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only point ledger. Callers only ever save new rows.
 */
@Repository
public interface PointTransactionRepository extends JpaRepository<PointTransaction, Long> {

    Optional<PointTransaction> findByIdempotencyKey(String idempotencyKey);

    @Query("SELECT COALESCE(SUM(t.amount), 0L) FROM PointTransaction t WHERE t.userId = :userId")
    long sumAmountByUserId(@Param("userId") Long userId);

    List<PointTransaction> findByUserIdOrderByCreatedAtDescTransactionIdDesc(Long userId);

    // Timestamps of one kind of entry, newest first (used for the login streak)
    @Query("SELECT t.createdAt FROM PointTransaction t WHERE t.userId = :userId AND t.reason = :reason " +
           "ORDER BY t.createdAt DESC")
    List<LocalDateTime> findCreatedAtByUserIdAndReason(@Param("userId") Long userId,
                                                      @Param("reason") PointReason reason);
}
