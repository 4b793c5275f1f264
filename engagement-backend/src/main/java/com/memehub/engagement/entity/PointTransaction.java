package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * PointTransaction Entity: one immutable row of the point ledger.
 * idempotency_key is unique, so a replayed source event can never be
 * credited twice. Rows are inserted and never updated or deleted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "point_transaction",
        uniqueConstraints = @UniqueConstraint(name = "uk_point_transaction_key", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_point_transaction_user", columnList = "user_id, created_at"))
public class PointTransaction {

    public static final int IDEMPOTENCY_KEY_LENGTH = 150;
    public static final int NOTE_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "transaction_id")
    private Long transactionId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** amount: signed, reversals are negative */
    @Column(name = "amount", nullable = false)
    private Integer amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 30)
    private PointReason reason;

    @Column(name = "idempotency_key", nullable = false, length = IDEMPOTENCY_KEY_LENGTH)
    private String idempotencyKey;

    /** note: audit text, e.g. who granted a bonus and why */
    @Column(name = "note", length = NOTE_LENGTH)
    private String note;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
