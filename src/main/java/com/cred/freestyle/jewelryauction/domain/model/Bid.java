package com.cred.freestyle.jewelryauction.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A bid placed on a lot.
 *
 * At most one bid per lot is WINNING. The {@code winning_lot_id} column holds the lot id
 * while the bid is WINNING and NULL otherwise; its unique constraint makes the database
 * reject a second concurrent winner (NULLs never collide).
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "bids",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_bid_winning_lot", columnNames = {"winning_lot_id"}),
        @UniqueConstraint(name = "uk_bid_idempotency", columnNames = {"session_item_id", "bidder_id", "idempotency_key"})
    },
    indexes = {
        @Index(name = "idx_bid_item_amount", columnList = "session_item_id, amount"),
        @Index(name = "idx_bid_bidder", columnList = "bidder_id, created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bid {

    @Id
    @Column(name = "bid_id", nullable = false, length = 36)
    private String bidId;

    @Column(name = "session_item_id", nullable = false, length = 36)
    private String sessionItemId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "bidder_id", nullable = false, length = 36)
    private String bidderId;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BidStatus status;

    @Column(name = "winning_lot_id", length = 36)
    private String winningLotId;

    @Column(name = "idempotency_key", length = 100)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (bidId == null) {
            bidId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = BidStatus.VALID;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Make this bid the lot's winning bid.
     */
    public void markWinning() {
        this.status = BidStatus.WINNING;
        this.winningLotId = sessionItemId;
    }

    /**
     * Demote this bid after a higher bid was accepted.
     */
    public void markOutbid() {
        this.status = BidStatus.OUTBID;
        this.winningLotId = null;
    }

    /**
     * Bid status.
     */
    public enum BidStatus {
        VALID,
        INVALID,
        OUTBID,
        WINNING
    }
}
