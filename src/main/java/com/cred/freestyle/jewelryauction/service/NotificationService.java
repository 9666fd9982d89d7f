package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Notification;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationPriority;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationStatus;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationType;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.BidPlacedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.SettlementEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.repository.NotificationRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Turns auction events into per-user inbox notifications and serves the inbox.
 *
 * Event handlers run outside a transaction: each notification is stored on its own, and a
 * duplicate-key failure means the same event was already delivered.
 *
 * @author Jewelry Auction Team
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final SessionItemRepository sessionItemRepository;
    private final CloudWatchMetricsService metricsService;
    private final Pagination pagination;

    public NotificationService(
            NotificationRepository notificationRepository,
            SessionItemRepository sessionItemRepository,
            CloudWatchMetricsService metricsService,
            Pagination pagination
    ) {
        this.notificationRepository = notificationRepository;
        this.sessionItemRepository = sessionItemRepository;
        this.metricsService = metricsService;
        this.pagination = pagination;
    }

    // ========================================
    // Event handlers
    // ========================================

    /**
     * Tell the previous leader of a lot that they were outbid.
     *
     * @return Number of notifications delivered
     */
    public int onBidPlaced(BidPlacedEvent event) {
        String previous = event.getPreviousWinnerId();
        if (previous == null || previous.equals(event.getBidderId())) {
            return 0;
        }
        return deliver(Notification.builder()
                .recipientId(previous)
                .type(NotificationType.OUTBID)
                .priority(NotificationPriority.HIGH)
                .title("You have been outbid")
                .message("A bid of " + event.getAmount() + " now leads a lot you were winning. Bidding closes at "
                        + event.getSessionEndAt() + ".")
                .referenceId(event.getBidId())
                .sessionId(event.getSessionId())
                .build());
    }

    /**
     * Tell the winner and the consignor how a lot ended.
     *
     * @return Number of notifications delivered
     */
    public int onLotClosed(LotClosedEvent event) {
        int delivered = 0;
        String outcome = event.getOutcome();
        String lot = "Lot " + event.getLotNumber();

        if ("SOLD".equals(outcome) && event.getWinnerId() != null) {
            delivered += deliver(Notification.builder()
                    .recipientId(event.getWinnerId())
                    .type(NotificationType.LOT_WON)
                    .priority(NotificationPriority.HIGH)
                    .title("You won " + lot)
                    .message(lot + " was knocked down to you at " + event.getHammerPrice() + ".")
                    .referenceId(event.getSessionItemId())
                    .sessionId(event.getSessionId())
                    .build());
        }

        Optional<String> sellerId = sessionItemRepository.findById(event.getSessionItemId())
                .map(SessionItem::getSellerId);
        if (sellerId.isEmpty()) {
            logger.warn("Lot {} not found, consignor not notified of {}", event.getSessionItemId(), outcome);
            return delivered;
        }

        Notification.NotificationBuilder toSeller = Notification.builder()
                .recipientId(sellerId.get())
                .referenceId(event.getSessionItemId())
                .sessionId(event.getSessionId());
        if ("SOLD".equals(outcome)) {
            toSeller.type(NotificationType.LOT_SOLD)
                    .priority(NotificationPriority.MEDIUM)
                    .title(lot + " sold")
                    .message("Your consignment sold for " + event.getHammerPrice() + ". Your payout follows settlement.");
        } else if ("UNSOLD".equals(outcome)) {
            toSeller.type(NotificationType.LOT_UNSOLD)
                    .priority(NotificationPriority.MEDIUM)
                    .title(lot + " did not sell")
                    .message("Your consignment did not reach its reserve and will be returned.");
        } else if ("WITHDRAWN".equals(outcome)) {
            toSeller.type(NotificationType.LOT_WITHDRAWN)
                    .priority(NotificationPriority.LOW)
                    .title(lot + " withdrawn")
                    .message("Your consignment was withdrawn from the session.");
        } else {
            logger.warn("Unknown lot outcome {} for lot {}", outcome, event.getSessionItemId());
            return delivered;
        }
        return delivered + deliver(toSeller.build());
    }

    /**
     * Tell the buyer what is due and the consignor what will be paid out.
     *
     * @return Number of notifications delivered
     */
    public int onSettlementCreated(SettlementEvent event) {
        int delivered = deliver(Notification.builder()
                .recipientId(event.getBuyerId())
                .type(NotificationType.PAYMENT_DUE)
                .priority(NotificationPriority.URGENT)
                .title("Payment due")
                .message("Please pay " + event.getBuyerAmount() + " (hammer price " + event.getHammerPrice()
                        + " plus buyer's premium).")
                .referenceId(event.getPaymentId())
                .build());
        delivered += deliver(Notification.builder()
                .recipientId(event.getSellerId())
                .type(NotificationType.PAYOUT_SCHEDULED)
                .priority(NotificationPriority.MEDIUM)
                .title("Payout scheduled")
                .message("You will receive " + event.getSellerAmount() + " (hammer price " + event.getHammerPrice()
                        + " less commission).")
                .referenceId(event.getPayoutId())
                .build());
        return delivered;
    }

    private int deliver(Notification notification) {
        if (notificationRepository.existsByRecipientIdAndTypeAndReferenceId(
                notification.getRecipientId(), notification.getType(), notification.getReferenceId())) {
            logger.debug("{} for {} already delivered to {}", notification.getType(),
                    notification.getReferenceId(), notification.getRecipientId());
            return 0;
        }
        try {
            notificationRepository.saveAndFlush(notification);
        } catch (DataIntegrityViolationException e) {
            logger.info("{} for {} delivered concurrently to {}, skipping", notification.getType(),
                    notification.getReferenceId(), notification.getRecipientId());
            return 0;
        }
        metricsService.recordNotificationDelivered(notification.getType().name());
        logger.debug("Delivered {} to {}", notification.getType(), notification.getRecipientId());
        return 1;
    }

    // ========================================
    // Inbox
    // ========================================

    @Transactional(readOnly = true)
    public Page<Notification> list(AuthenticatedUser actor, NotificationStatus status, Integer page, Integer size) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "View notifications");
        if (status == null) {
            return notificationRepository.findByRecipientId(actor.getUserId(), pagination.newestFirst(page, size));
        }
        return notificationRepository.findByRecipientIdAndStatus(
                actor.getUserId(), status, pagination.newestFirst(page, size));
    }

    @Transactional(readOnly = true)
    public long unreadCount(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "View notifications");
        return notificationRepository.countByRecipientIdAndStatus(actor.getUserId(), NotificationStatus.UNREAD);
    }

    /**
     * Mark one of the caller's notifications as read.
     *
     * @throws ResourceNotFoundException if the notification does not exist
     */
    @Transactional
    public Notification markRead(String notificationId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Update notification");
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
        AuthorizationGate.requireOwner(actor, notification.getRecipientId(), "Update notification");
        notification.markRead(Instant.now());
        return notificationRepository.save(notification);
    }

    @Transactional
    public int markAllRead(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Update notification");
        int updated = notificationRepository.markAllRead(
                actor.getUserId(), NotificationStatus.UNREAD, NotificationStatus.READ, Instant.now());
        logger.info("Marked {} notifications read for {}", updated, actor.getUserId());
        return updated;
    }
}
