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
 * A user's registration to bid in a session. Bidding requires an APPROVED enrollment.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "enrollments",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_enrollment_user_session", columnNames = {"user_id", "session_id"})
    },
    indexes = {
        @Index(name = "idx_enrollment_session_status", columnList = "session_id, status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Enrollment {

    @Id
    @Column(name = "enrollment_id", nullable = false, length = 36)
    private String enrollmentId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EnrollmentStatus status;

    @Column(name = "reviewed_by", length = 36)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (enrollmentId == null) {
            enrollmentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = EnrollmentStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void approve(String reviewerId) {
        review(EnrollmentStatus.APPROVED, reviewerId);
    }

    public void reject(String reviewerId) {
        review(EnrollmentStatus.REJECTED, reviewerId);
    }

    public void cancel() {
        if (status != EnrollmentStatus.PENDING && status != EnrollmentStatus.APPROVED) {
            throw new InvalidStateTransitionException("Enrollment", enrollmentId, status, "PENDING or APPROVED");
        }
        this.status = EnrollmentStatus.CANCELED;
    }

    public boolean isApproved() {
        return status == EnrollmentStatus.APPROVED;
    }

    private void review(EnrollmentStatus outcome, String reviewerId) {
        if (status != EnrollmentStatus.PENDING) {
            throw new InvalidStateTransitionException("Enrollment", enrollmentId, status, EnrollmentStatus.PENDING);
        }
        this.status = outcome;
        this.reviewedBy = reviewerId;
        this.reviewedAt = Instant.now();
    }

    public enum EnrollmentStatus {
        PENDING,
        APPROVED,
        REJECTED,
        CANCELED
    }
}
