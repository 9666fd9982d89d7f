package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Notification;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationStatus;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository interface for Notification entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, String> {

    Page<Notification> findByRecipientId(String recipientId, Pageable pageable);

    Page<Notification> findByRecipientIdAndStatus(String recipientId, NotificationStatus status, Pageable pageable);

    long countByRecipientIdAndStatus(String recipientId, NotificationStatus status);

    boolean existsByRecipientIdAndTypeAndReferenceId(String recipientId, NotificationType type, String referenceId);

    /**
     * Mark every unread notification of a user as read.
     *
     * @return Number of notifications updated
     */
    @Modifying
    @Query("UPDATE Notification n SET n.status = :read, n.readAt = :readAt " +
           "WHERE n.recipientId = :recipientId AND n.status = :unread")
    int markAllRead(@Param("recipientId") String recipientId,
                    @Param("unread") NotificationStatus unread,
                    @Param("read") NotificationStatus read,
                    @Param("readAt") Instant readAt);
}
