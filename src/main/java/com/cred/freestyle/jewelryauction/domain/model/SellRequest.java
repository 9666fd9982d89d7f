package com.cred.freestyle.jewelryauction.domain.model;

import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A seller's request to consign a jewelry item.
 *
 * The request moves strictly forward along
 * SUBMITTED → PRELIM_APPRAISED → RECEIVED → FINAL_APPRAISED → MANAGER_APPROVED
 * → SELLER_ACCEPTED → ASSIGNED_TO_SESSION, or to REJECTED from any non-terminal status.
 * Every stage stamps its own timestamp and the next stage requires it.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "sell_requests", indexes = {
    @Index(name = "idx_sell_request_seller_status", columnList = "seller_id, status"),
    @Index(name = "idx_sell_request_jewelry", columnList = "jewelry_item_id"),
    @Index(name = "idx_sell_request_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SellRequest {

    @Id
    @Column(name = "sell_request_id", nullable = false, length = 36)
    private String sellRequestId;

    @Column(name = "seller_id", nullable = false, length = 36)
    private String sellerId;

    @Column(name = "jewelry_item_id", nullable = false, length = 36)
    private String jewelryItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private SellRequestStatus status;

    @Column(name = "seller_notes", length = 2000)
    private String sellerNotes;

    @Column(name = "staff_notes", length = 2000)
    private String staffNotes;

    @Column(name = "manager_notes", length = 2000)
    private String managerNotes;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "rejected_by", length = 36)
    private String rejectedBy;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "preliminary_appraised_at")
    private Instant preliminaryAppraisedAt;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "appraised_at")
    private Instant appraisedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (sellRequestId == null) {
            sellRequestId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = SellRequestStatus.SUBMITTED;
        }
        if (submittedAt == null) {
            submittedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Advance the request one step along the happy path.
     * Nothing is modified when the check fails.
     *
     * @param expected Status the request must currently be in
     * @param next Successor status
     * @param at Timestamp to stamp for the new stage
     * @throws InvalidStateTransitionException if the current status differs from {@code expected},
     *         {@code next} is not the successor of {@code expected}, or the predecessor stage was never stamped
     */
    public void advance(SellRequestStatus expected, SellRequestStatus next, Instant at) {
        if (status != expected) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status, expected);
        }
        if (expected.successor() != next) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status,
                    "a predecessor of " + next);
        }
        if (stageTimestamp(expected) == null) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status,
                    expected + " with its stage timestamp recorded");
        }

        this.status = next;
        stamp(next, at);
    }

    /**
     * Mark the request as placed in an auction session.
     * Seller acceptance is optional: both MANAGER_APPROVED and SELLER_ACCEPTED qualify.
     *
     * @param at Assignment time
     * @throws InvalidStateTransitionException if the request is not approved
     */
    public void assignToSession(Instant at) {
        if (status != SellRequestStatus.MANAGER_APPROVED && status != SellRequestStatus.SELLER_ACCEPTED) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status,
                    "MANAGER_APPROVED or SELLER_ACCEPTED");
        }
        if (approvedAt == null) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status,
                    status + " with its approval timestamp recorded");
        }
        this.status = SellRequestStatus.ASSIGNED_TO_SESSION;
        this.assignedAt = at;
    }

    /**
     * Reject the request. Allowed from any non-terminal status.
     *
     * @param reason Rejection reason
     * @param rejectedByUserId Who rejected the request
     * @param at Rejection time
     * @throws InvalidStateTransitionException if the request is REJECTED or ASSIGNED_TO_SESSION
     */
    public void reject(String reason, String rejectedByUserId, Instant at) {
        if (status.isTerminal()) {
            throw new InvalidStateTransitionException("SellRequest", sellRequestId, status, "a non-terminal status");
        }
        this.status = SellRequestStatus.REJECTED;
        this.rejectionReason = reason;
        this.rejectedBy = rejectedByUserId;
        this.rejectedAt = at;
    }

    /**
     * Check whether the request is still in progress.
     *
     * @return true unless REJECTED or ASSIGNED_TO_SESSION
     */
    public boolean isOpen() {
        return !status.isTerminal();
    }

    private Instant stageTimestamp(SellRequestStatus stage) {
        switch (stage) {
            case SUBMITTED:
                return submittedAt;
            case PRELIM_APPRAISED:
                return preliminaryAppraisedAt;
            case RECEIVED:
                return receivedAt;
            case FINAL_APPRAISED:
                return appraisedAt;
            case MANAGER_APPROVED:
                return approvedAt;
            case SELLER_ACCEPTED:
                return acceptedAt;
            case ASSIGNED_TO_SESSION:
                return assignedAt;
            default:
                return rejectedAt;
        }
    }

    private void stamp(SellRequestStatus stage, Instant at) {
        switch (stage) {
            case PRELIM_APPRAISED:
                preliminaryAppraisedAt = at;
                break;
            case RECEIVED:
                receivedAt = at;
                break;
            case FINAL_APPRAISED:
                appraisedAt = at;
                break;
            case MANAGER_APPROVED:
                approvedAt = at;
                break;
            case SELLER_ACCEPTED:
                acceptedAt = at;
                break;
            case ASSIGNED_TO_SESSION:
                assignedAt = at;
                break;
            default:
                throw new IllegalArgumentException("Stage " + stage + " is not reached by advance()");
        }
    }

    /**
     * Sell request status. Declaration order is the happy-path order.
     */
    public enum SellRequestStatus {
        SUBMITTED,
        PRELIM_APPRAISED,
        RECEIVED,
        FINAL_APPRAISED,
        MANAGER_APPROVED,
        SELLER_ACCEPTED,
        ASSIGNED_TO_SESSION,
        REJECTED;

        /**
         * @return the next happy-path status, or null for terminal statuses
         */
        public SellRequestStatus successor() {
            switch (this) {
                case SUBMITTED:
                    return PRELIM_APPRAISED;
                case PRELIM_APPRAISED:
                    return RECEIVED;
                case RECEIVED:
                    return FINAL_APPRAISED;
                case FINAL_APPRAISED:
                    return MANAGER_APPROVED;
                case MANAGER_APPROVED:
                    return SELLER_ACCEPTED;
                case SELLER_ACCEPTED:
                    return ASSIGNED_TO_SESSION;
                default:
                    return null;
            }
        }

        public boolean isTerminal() {
            return this == ASSIGNED_TO_SESSION || this == REJECTED;
        }
    }
}
