package com.cred.freestyle.jewelryauction.domain.model;

import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * A timed auction session grouping several lots.
 *
 * State machine: DRAFT → SCHEDULED → OPEN ⇄ PAUSED → CLOSED → SETTLED,
 * with CANCELED reachable from any state before CLOSED. Only OPEN sessions accept bids.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "auction_sessions", indexes = {
    @Index(name = "idx_session_code", columnList = "code", unique = true),
    @Index(name = "idx_session_status", columnList = "status"),
    @Index(name = "idx_session_start_at", columnList = "start_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionSession {

    @Id
    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "code", nullable = false, unique = true, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "assigned_staff_id", length = 36)
    private String assignedStaffId;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    // Rule set

    @Enumerated(EnumType.STRING)
    @Column(name = "bid_increment_policy", nullable = false, length = 20)
    @Builder.Default
    private BidIncrementPolicy bidIncrementPolicy = BidIncrementPolicy.FIXED;

    @Column(name = "registration_required", nullable = false)
    @Builder.Default
    private Boolean registrationRequired = true;

    @Column(name = "anti_sniping_enabled", nullable = false)
    @Builder.Default
    private Boolean antiSnipingEnabled = true;

    @Column(name = "anti_sniping_trigger_seconds", nullable = false)
    @Builder.Default
    private Integer antiSnipingTriggerSeconds = 60;

    @Column(name = "anti_sniping_extension_seconds", nullable = false)
    @Builder.Default
    private Integer antiSnipingExtensionSeconds = 300;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (sessionId == null) {
            sessionId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = SessionStatus.DRAFT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Move the session to a new status if the state machine allows it.
     *
     * @param next Target status
     * @param at Transition time, stamped on the matching timestamp column
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public void transitionTo(SessionStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateTransitionException("AuctionSession", sessionId, status,
                    "one of " + next.allowedPredecessors());
        }
        this.status = next;
        switch (next) {
            case OPEN:
                if (openedAt == null) {
                    openedAt = at;
                }
                break;
            case CLOSED:
                closedAt = at;
                break;
            case SETTLED:
                settledAt = at;
                break;
            case CANCELED:
                canceledAt = at;
                break;
            default:
                break;
        }
    }

    /**
     * Check whether the session is open and its end time has not passed.
     *
     * @param now Current time
     * @return true if bids may be accepted
     */
    public boolean isAcceptingBids(Instant now) {
        return status == SessionStatus.OPEN && now.isBefore(endAt);
    }

    /**
     * Check whether lots may still be added, removed or repriced.
     *
     * @return true while DRAFT or SCHEDULED
     */
    public boolean isEditable() {
        return status == SessionStatus.DRAFT || status == SessionStatus.SCHEDULED;
    }

    /**
     * Session lifecycle status.
     */
    public enum SessionStatus {
        DRAFT,
        SCHEDULED,
        OPEN,
        PAUSED,
        CLOSED,
        SETTLED,
        CANCELED;

        public boolean canTransitionTo(SessionStatus next) {
            return next.allowedPredecessors().contains(this);
        }

        public Set<SessionStatus> allowedPredecessors() {
            switch (this) {
                case SCHEDULED:
                    return EnumSet.of(DRAFT);
                case OPEN:
                    return EnumSet.of(SCHEDULED, PAUSED);
                case PAUSED:
                    return EnumSet.of(OPEN);
                case CLOSED:
                    return EnumSet.of(OPEN, PAUSED);
                case SETTLED:
                    return EnumSet.of(CLOSED);
                case CANCELED:
                    return EnumSet.of(DRAFT, SCHEDULED, OPEN, PAUSED);
                default:
                    return EnumSet.noneOf(SessionStatus.class);
            }
        }

        public boolean isBeforeClose() {
            return this == DRAFT || this == SCHEDULED || this == OPEN || this == PAUSED;
        }
    }

    /**
     * How the minimum increment over the current price is computed.
     */
    public enum BidIncrementPolicy {
        /**
         * The lot's step price.
         */
        FIXED,

        /**
         * A price ladder, never below the lot's step price.
         */
        TIERED;

        /**
         * Increment required over the current price.
         *
         * @param currentPrice Current highest bid, or the start price when there is none
         * @param stepPrice Lot step price
         * @return Minimum increment
         */
        public BigDecimal increment(BigDecimal currentPrice, BigDecimal stepPrice) {
            if (this == FIXED) {
                return stepPrice;
            }
            BigDecimal ladder;
            if (currentPrice.compareTo(new BigDecimal("100")) < 0) {
                ladder = new BigDecimal("5");
            } else if (currentPrice.compareTo(new BigDecimal("500")) < 0) {
                ladder = new BigDecimal("10");
            } else if (currentPrice.compareTo(new BigDecimal("1000")) < 0) {
                ladder = new BigDecimal("25");
            } else if (currentPrice.compareTo(new BigDecimal("5000")) < 0) {
                ladder = new BigDecimal("50");
            } else if (currentPrice.compareTo(new BigDecimal("10000")) < 0) {
                ladder = new BigDecimal("100");
            } else {
                ladder = new BigDecimal("250");
            }
            return ladder.max(stepPrice);
        }
    }
}
