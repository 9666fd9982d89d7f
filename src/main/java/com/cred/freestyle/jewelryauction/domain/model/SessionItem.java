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
 * A lot: one jewelry item placed in an auction session with its own pricing and bid sequence.
 *
 * Lot numbers are unique within a session and contiguous from 1. The current highest bid,
 * winner and bid count are denormalized here so that bid admission only needs this row,
 * locked for write, as the serialization point.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "session_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_session_item_lot", columnNames = {"session_id", "lot_number"}),
        @UniqueConstraint(name = "uk_session_item_jewelry", columnNames = {"session_id", "jewelry_item_id"})
    },
    indexes = {
        @Index(name = "idx_session_item_session_status", columnList = "session_id, status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionItem {

    @Id
    @Column(name = "session_item_id", nullable = false, length = 36)
    private String sessionItemId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "jewelry_item_id", nullable = false, length = 36)
    private String jewelryItemId;

    @Column(name = "sell_request_id", nullable = false, length = 36)
    private String sellRequestId;

    /**
     * Seller of the underlying jewelry; payee of the payout.
     */
    @Column(name = "seller_id", nullable = false, length = 36)
    private String sellerId;

    @Column(name = "lot_number", nullable = false)
    private Integer lotNumber;

    /**
     * Minimum hammer price for a sale. Null means no reserve.
     */
    @Column(name = "reserve_price", precision = 14, scale = 2)
    private BigDecimal reservePrice;

    @Column(name = "start_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal startPrice;

    @Column(name = "step_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal stepPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionItemStatus status;

    @Column(name = "current_highest_bid", precision = 14, scale = 2)
    private BigDecimal currentHighestBid;

    @Column(name = "current_winner_id", length = 36)
    private String currentWinnerId;

    @Column(name = "winning_bid_id", length = 36)
    private String winningBidId;

    @Column(name = "bid_count", nullable = false)
    @Builder.Default
    private Integer bidCount = 0;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (sessionItemId == null) {
            sessionItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = SessionItemStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Price the next bid is measured against: the highest accepted bid, or the start price.
     *
     * @return Current floor
     */
    public BigDecimal currentFloor() {
        return currentHighestBid != null ? currentHighestBid : startPrice;
    }

    /**
     * Record a newly accepted winning bid.
     *
     * @param bid The new WINNING bid
     */
    public void recordWinningBid(Bid bid) {
        this.currentHighestBid = bid.getAmount();
        this.currentWinnerId = bid.getBidderId();
        this.winningBidId = bid.getBidId();
        this.bidCount = bidCount + 1;
    }

    /**
     * Check whether the given hammer price meets the reserve.
     *
     * @param amount Winning amount
     * @return true when there is no reserve or the amount reaches it
     */
    public boolean meetsReserve(BigDecimal amount) {
        return reservePrice == null || amount.compareTo(reservePrice) >= 0;
    }

    /**
     * Lot status.
     */
    public enum SessionItemStatus {
        PENDING,
        ACTIVE,
        SOLD,
        UNSOLD,
        WITHDRAWN;

        public boolean isOpen() {
            return this == PENDING || this == ACTIVE;
        }
    }
}
