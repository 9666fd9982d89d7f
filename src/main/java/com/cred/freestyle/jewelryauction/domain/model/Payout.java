package com.cred.freestyle.jewelryauction.domain.model;

import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Amount owed to the seller of a sold lot: hammer price minus seller commission.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "payouts", indexes = {
    @Index(name = "idx_payout_session_item", columnList = "session_item_id", unique = true),
    @Index(name = "idx_payout_seller_status", columnList = "seller_id, status"),
    @Index(name = "idx_payout_session", columnList = "session_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payout {

    @Id
    @Column(name = "payout_id", nullable = false, length = 36)
    private String payoutId;

    @Column(name = "session_item_id", nullable = false, unique = true, length = 36)
    private String sessionItemId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "seller_id", nullable = false, length = 36)
    private String sellerId;

    @Column(name = "hammer_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal hammerPrice;

    @Column(name = "seller_commission", nullable = false, precision = 14, scale = 2)
    private BigDecimal sellerCommission;

    /**
     * Net proceeds: hammer price minus seller commission.
     */
    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "fee_schedule_id", length = 36)
    private String feeScheduleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "gateway_transaction_id", length = 100)
    private String gatewayTransactionId;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (payoutId == null) {
            payoutId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = PayoutStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void startProcessing() {
        requireStatus(PayoutStatus.PENDING);
        this.status = PayoutStatus.PROCESSING;
    }

    public void complete(String transactionId) {
        requireStatus(PayoutStatus.PROCESSING);
        this.status = PayoutStatus.COMPLETED;
        this.gatewayTransactionId = transactionId;
        this.processedAt = Instant.now();
    }

    public void returnToPending() {
        requireStatus(PayoutStatus.PROCESSING);
        this.status = PayoutStatus.PENDING;
    }

    public void fail(String reason) {
        requireStatus(PayoutStatus.PROCESSING);
        this.status = PayoutStatus.FAILED;
        this.failureReason = reason;
        this.processedAt = Instant.now();
    }

    private void requireStatus(PayoutStatus expected) {
        if (status != expected) {
            throw new InvalidStateTransitionException("Payout", payoutId, status, expected);
        }
    }

    public enum PayoutStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELED
    }
}
