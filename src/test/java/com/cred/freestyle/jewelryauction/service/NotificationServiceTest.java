package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Notification;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationPriority;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationStatus;
import com.cred.freestyle.jewelryauction.domain.model.Notification.NotificationType;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.BidPlacedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.SettlementEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.repository.NotificationRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService Unit Tests")
class NotificationServiceTest {

    private static final String SESSION_ID = "session-001";
    private static final String LOT_ID = "lot-001";

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private SessionItemRepository sessionItemRepository;

    @Mock
    private CloudWatchMetricsService metricsService;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(
                notificationRepository, sessionItemRepository, metricsService, new Pagination(20, 100));
    }

    private List<Notification> savedNotifications(int expected) {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository, times(expected)).saveAndFlush(captor.capture());
        return captor.getAllValues();
    }

    private void lotBelongsToSeller() {
        when(sessionItemRepository.findById(LOT_ID)).thenReturn(Optional.of(SessionItem.builder()
                .sessionItemId(LOT_ID)
                .sessionId(SESSION_ID)
                .sellerId(TestDataBuilder.SELLER_ID)
                .build()));
    }

    // ========================================
    // Outbid
    // ========================================

    @Test
    @DisplayName("Previous leader is told they were outbid")
    void onBidPlaced_NotifiesPreviousLeader() {
        // Given
        BidPlacedEvent event = new BidPlacedEvent("bid-2", LOT_ID, SESSION_ID, TestDataBuilder.OTHER_BIDDER_ID,
                new BigDecimal("1250.00"), TestDataBuilder.BIDDER_ID, Instant.parse("2026-11-01T18:00:00Z"));

        // When
        int delivered = notificationService.onBidPlaced(event);

        // Then
        assertThat(delivered).isEqualTo(1);
        Notification saved = savedNotifications(1).get(0);
        assertThat(saved.getRecipientId()).isEqualTo(TestDataBuilder.BIDDER_ID);
        assertThat(saved.getType()).isEqualTo(NotificationType.OUTBID);
        assertThat(saved.getPriority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(saved.getReferenceId()).isEqualTo("bid-2");
        assertThat(saved.getMessage()).contains("1250.00");
        verify(metricsService).recordNotificationDelivered("OUTBID");
    }

    @Test
    @DisplayName("First bid on a lot and raising one's own bid notify nobody")
    void onBidPlaced_NoPreviousLeader() {
        BidPlacedEvent first = new BidPlacedEvent("bid-1", LOT_ID, SESSION_ID, TestDataBuilder.BIDDER_ID,
                new BigDecimal("1000.00"), null, Instant.now());
        BidPlacedEvent raise = new BidPlacedEvent("bid-2", LOT_ID, SESSION_ID, TestDataBuilder.BIDDER_ID,
                new BigDecimal("1100.00"), TestDataBuilder.BIDDER_ID, Instant.now());

        assertThat(notificationService.onBidPlaced(first)).isZero();
        assertThat(notificationService.onBidPlaced(raise)).isZero();
        verifyNoInteractions(notificationRepository);
    }

    // ========================================
    // Lot outcomes
    // ========================================

    @Test
    @DisplayName("Sold lot notifies the winner and the consignor")
    void onLotClosed_Sold() {
        // Given
        lotBelongsToSeller();
        LotClosedEvent event = new LotClosedEvent(LOT_ID, SESSION_ID, 3, "SOLD",
                TestDataBuilder.BIDDER_ID, new BigDecimal("4200.00"));

        // When
        int delivered = notificationService.onLotClosed(event);

        // Then
        assertThat(delivered).isEqualTo(2);
        List<Notification> saved = savedNotifications(2);
        assertThat(saved).extracting(Notification::getRecipientId, Notification::getType)
                .containsExactly(
                        tuple(TestDataBuilder.BIDDER_ID, NotificationType.LOT_WON),
                        tuple(TestDataBuilder.SELLER_ID, NotificationType.LOT_SOLD));
        assertThat(saved.get(0).getTitle()).isEqualTo("You won Lot 3");
        assertThat(saved).allSatisfy(n -> assertThat(n.getReferenceId()).isEqualTo(LOT_ID));
    }

    @Test
    @DisplayName("Unsold lot notifies only the consignor")
    void onLotClosed_Unsold() {
        lotBelongsToSeller();
        LotClosedEvent event = new LotClosedEvent(LOT_ID, SESSION_ID, 4, "UNSOLD", null, null);

        assertThat(notificationService.onLotClosed(event)).isEqualTo(1);
        Notification saved = savedNotifications(1).get(0);
        assertThat(saved.getRecipientId()).isEqualTo(TestDataBuilder.SELLER_ID);
        assertThat(saved.getType()).isEqualTo(NotificationType.LOT_UNSOLD);
    }

    @Test
    @DisplayName("Withdrawn lot notifies the consignor at low priority")
    void onLotClosed_Withdrawn() {
        lotBelongsToSeller();
        LotClosedEvent event = new LotClosedEvent(LOT_ID, SESSION_ID, 5, "WITHDRAWN", null, null);

        assertThat(notificationService.onLotClosed(event)).isEqualTo(1);
        Notification saved = savedNotifications(1).get(0);
        assertThat(saved.getType()).isEqualTo(NotificationType.LOT_WITHDRAWN);
        assertThat(saved.getPriority()).isEqualTo(NotificationPriority.LOW);
    }

    @Test
    @DisplayName("Unknown lot still notifies the winner")
    void onLotClosed_LotMissing() {
        when(sessionItemRepository.findById(LOT_ID)).thenReturn(Optional.empty());
        LotClosedEvent event = new LotClosedEvent(LOT_ID, SESSION_ID, 3, "SOLD",
                TestDataBuilder.BIDDER_ID, new BigDecimal("4200.00"));

        assertThat(notificationService.onLotClosed(event)).isEqualTo(1);
        assertThat(savedNotifications(1).get(0).getType()).isEqualTo(NotificationType.LOT_WON);
    }

    // ========================================
    // Settlement
    // ========================================

    @Test
    @DisplayName("Settlement tells the buyer what is due and the consignor what is paid out")
    void onSettlementCreated() {
        // Given
        SettlementEvent event = new SettlementEvent(LOT_ID, "pay-1", "po-1", TestDataBuilder.BIDDER_ID,
                TestDataBuilder.SELLER_ID, new BigDecimal("1000.00"), new BigDecimal("1100.00"),
                new BigDecimal("950.00"));

        // When
        int delivered = notificationService.onSettlementCreated(event);

        // Then
        assertThat(delivered).isEqualTo(2);
        List<Notification> saved = savedNotifications(2);
        assertThat(saved.get(0).getType()).isEqualTo(NotificationType.PAYMENT_DUE);
        assertThat(saved.get(0).getPriority()).isEqualTo(NotificationPriority.URGENT);
        assertThat(saved.get(0).getReferenceId()).isEqualTo("pay-1");
        assertThat(saved.get(0).getMessage()).contains("1100.00");
        assertThat(saved.get(1).getType()).isEqualTo(NotificationType.PAYOUT_SCHEDULED);
        assertThat(saved.get(1).getRecipientId()).isEqualTo(TestDataBuilder.SELLER_ID);
        assertThat(saved.get(1).getMessage()).contains("950.00");
    }

    // ========================================
    // Redelivery
    // ========================================

    @Test
    @DisplayName("Already delivered event is not stored again")
    void deliver_AlreadyDelivered() {
        when(notificationRepository.existsByRecipientIdAndTypeAndReferenceId(
                TestDataBuilder.BIDDER_ID, NotificationType.OUTBID, "bid-2")).thenReturn(true);
        BidPlacedEvent event = new BidPlacedEvent("bid-2", LOT_ID, SESSION_ID, TestDataBuilder.OTHER_BIDDER_ID,
                new BigDecimal("1250.00"), TestDataBuilder.BIDDER_ID, Instant.now());

        assertThat(notificationService.onBidPlaced(event)).isZero();
        verify(notificationRepository, never()).saveAndFlush(any());
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("Duplicate key from a concurrent delivery is treated as delivered")
    void deliver_ConcurrentDuplicate() {
        when(notificationRepository.saveAndFlush(any(Notification.class)))
                .thenThrow(new DataIntegrityViolationException("uk_notification_event"));
        BidPlacedEvent event = new BidPlacedEvent("bid-2", LOT_ID, SESSION_ID, TestDataBuilder.OTHER_BIDDER_ID,
                new BigDecimal("1250.00"), TestDataBuilder.BIDDER_ID, Instant.now());

        assertThat(notificationService.onBidPlaced(event)).isZero();
        verifyNoInteractions(metricsService);
    }

    // ========================================
    // Inbox
    // ========================================

    @Test
    @DisplayName("Listing with a status filter only reads the caller's inbox")
    void list_FilteredByStatus() {
        Page<Notification> page = new PageImpl<>(List.of());
        when(notificationRepository.findByRecipientIdAndStatus(
                eq(TestDataBuilder.BIDDER_ID), eq(NotificationStatus.UNREAD), any(Pageable.class)))
                .thenReturn(page);

        assertThat(notificationService.list(TestDataBuilder.bidder(), NotificationStatus.UNREAD, 0, 10))
                .isSameAs(page);
        verify(notificationRepository, never()).findByRecipientId(anyString(), any());
    }

    @Test
    @DisplayName("Marking read sets the read time once")
    void markRead_Owner() {
        // Given
        Notification notification = Notification.builder()
                .notificationId("n-1")
                .recipientId(TestDataBuilder.BIDDER_ID)
                .status(NotificationStatus.UNREAD)
                .build();
        when(notificationRepository.findById("n-1")).thenReturn(Optional.of(notification));
        when(notificationRepository.save(notification)).thenReturn(notification);

        // When
        Notification result = notificationService.markRead("n-1", TestDataBuilder.bidder());
        Instant firstRead = result.getReadAt();
        result.markRead(Instant.now().plusSeconds(60));

        // Then
        assertThat(result.getStatus()).isEqualTo(NotificationStatus.READ);
        assertThat(firstRead).isNotNull();
        assertThat(result.getReadAt()).isEqualTo(firstRead);
    }

    @Test
    @DisplayName("Another user's notification cannot be marked read")
    void markRead_NotOwner() {
        when(notificationRepository.findById("n-1")).thenReturn(Optional.of(Notification.builder()
                .notificationId("n-1")
                .recipientId(TestDataBuilder.BIDDER_ID)
                .status(NotificationStatus.UNREAD)
                .build()));

        assertThatThrownBy(() -> notificationService.markRead("n-1", TestDataBuilder.member("someone-else")))
                .isInstanceOf(AuthorizationException.class);
        verify(notificationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Missing notification is not found")
    void markRead_Missing() {
        when(notificationRepository.findById("n-404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.markRead("n-404", TestDataBuilder.bidder()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Mark all read only touches the caller's unread notifications")
    void markAllRead() {
        when(notificationRepository.markAllRead(eq(TestDataBuilder.BIDDER_ID), eq(NotificationStatus.UNREAD),
                eq(NotificationStatus.READ), any(Instant.class))).thenReturn(3);

        assertThat(notificationService.markAllRead(TestDataBuilder.bidder())).isEqualTo(3);
    }
}
