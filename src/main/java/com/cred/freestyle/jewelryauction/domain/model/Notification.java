package com.cred.freestyle.jewelryauction.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbox entry for one user, derived from an auction event.
 * At most one notification per (recipient, type, reference), so a redelivered event
 * does not notify twice.
 *
 * @author Jewelry Auction Team
 */
@Entity
@Table(name = "notifications",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_notification_event",
                columnNames = {"recipient_id", "type", "reference_id"})
    },
    indexes = {
        @Index(name = "idx_notification_recipient_status", columnList = "recipient_id, status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @Column(name = "notification_id", nullable = false, length = 36)
    private String notificationId;

    @Column(name = "recipient_id", nullable = false, length = 36)
    private String recipientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private NotificationPriority priority;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Column(name = "reference_id", nullable = false, length = 36)
    private String referenceId;

    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private NotificationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;

    @PrePersist
    protected void onCreate() {
        if (notificationId == null) {
            notificationId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        if (status == null) {
            status = NotificationStatus.UNREAD;
        }
    }

    /**
     * Mark as read. Reading twice keeps the first read time.
     */
    public void markRead(Instant now) {
        if (status == NotificationStatus.UNREAD) {
            status = NotificationStatus.READ;
            readAt = now;
        }
    }

    public enum NotificationType {
        OUTBID,
        LOT_WON,
        LOT_SOLD,
        LOT_UNSOLD,
        LOT_WITHDRAWN,
        PAYMENT_DUE,
        PAYOUT_SCHEDULED
    }

    public enum NotificationPriority {
        LOW,
        MEDIUM,
        HIGH,
        URGENT
    }

    public enum NotificationStatus {
        UNREAD,
        READ
    }
}
