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
 * Refund of a completed payment. At most one refund per payment.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "refunds", indexes = {
    @Index(name = "idx_refund_payment", columnList = "payment_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Refund {

    @Id
    @Column(name = "refund_id", nullable = false, length = 36)
    private String refundId;

    @Column(name = "payment_id", nullable = false, unique = true, length = 36)
    private String paymentId;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RefundStatus status;

    @Column(name = "requested_by", nullable = false, length = 36)
    private String requestedBy;

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

    @PrePersist
    protected void onCreate() {
        if (refundId == null) {
            refundId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = RefundStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void complete(String transactionId) {
        requirePending();
        this.status = RefundStatus.REFUNDED;
        this.gatewayTransactionId = transactionId;
        this.processedAt = Instant.now();
    }

    public void fail(String reason) {
        requirePending();
        this.status = RefundStatus.FAILED;
        this.failureReason = reason;
        this.processedAt = Instant.now();
    }

    private void requirePending() {
        if (status != RefundStatus.PENDING) {
            throw new InvalidStateTransitionException("Refund", refundId, status, RefundStatus.PENDING);
        }
    }

    public enum RefundStatus {
        PENDING,
        REFUNDED,
        FAILED
    }
}
