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
 * Amount owed by the buyer of a sold lot: hammer price plus buyer premium.
 * One payment per lot; the unique {@code session_item_id} column makes settlement idempotent.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_session_item", columnList = "session_item_id", unique = true),
    @Index(name = "idx_payment_buyer_status", columnList = "buyer_id, status"),
    @Index(name = "idx_payment_session", columnList = "session_id"),
    @Index(name = "idx_payment_transaction", columnList = "gateway_transaction_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @Column(name = "payment_id", nullable = false, length = 36)
    private String paymentId;

    @Column(name = "session_item_id", nullable = false, unique = true, length = 36)
    private String sessionItemId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "buyer_id", nullable = false, length = 36)
    private String buyerId;

    @Column(name = "hammer_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal hammerPrice;

    @Column(name = "buyer_premium", nullable = false, precision = 14, scale = 2)
    private BigDecimal buyerPremium;

    /**
     * Total due: hammer price plus buyer premium.
     */
    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "fee_schedule_id", length = 36)
    private String feeScheduleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", length = 30)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

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
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = PaymentStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Hand the payment to the gateway.
     *
     * @param paymentMethod Instrument chosen by the buyer
     */
    public void startProcessing(PaymentMethod paymentMethod) {
        requireStatus(PaymentStatus.PENDING);
        this.method = paymentMethod;
        this.status = PaymentStatus.PROCESSING;
    }

    /**
     * Record a successful gateway charge.
     *
     * @param transactionId Gateway transaction ID
     */
    public void complete(String transactionId) {
        requireStatus(PaymentStatus.PROCESSING);
        this.status = PaymentStatus.COMPLETED;
        this.gatewayTransactionId = transactionId;
        this.failureReason = null;
        this.processedAt = Instant.now();
    }

    /**
     * Record a failed gateway charge. Failures are terminal and never retried automatically.
     *
     * @param reason Failure reason reported by the gateway
     */
    public void fail(String reason) {
        requireStatus(PaymentStatus.PROCESSING);
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
        this.processedAt = Instant.now();
    }

    /**
     * Put the payment back when the dispatch could not be handed to the broker.
     */
    public void returnToPending() {
        requireStatus(PaymentStatus.PROCESSING);
        this.status = PaymentStatus.PENDING;
    }

    public void markRefunded() {
        requireStatus(PaymentStatus.COMPLETED);
        this.status = PaymentStatus.REFUNDED;
    }

    private void requireStatus(PaymentStatus expected) {
        if (status != expected) {
            throw new InvalidStateTransitionException("Payment", paymentId, status, expected);
        }
    }

    public enum PaymentStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        REFUNDED,
        CANCELED
    }
}
