package com.cred.freestyle.jewelryauction.testutil;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.BidIncrementPolicy;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest.SellRequestStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builder helpers for creating test data objects with sensible defaults.
 */
public class TestDataBuilder {

    public static final String SELLER_ID = "seller-001";
    public static final String BIDDER_ID = "bidder-001";
    public static final String OTHER_BIDDER_ID = "bidder-002";
    public static final String STAFF_ID = "staff-001";
    public static final String MANAGER_ID = "manager-001";
    public static final String ADMIN_ID = "admin-001";

    private static final AtomicInteger SEQUENCE = new AtomicInteger(1);

    public static AuthenticatedUser member(String userId) {
        return AuthenticatedUser.of(userId, Role.MEMBER);
    }

    public static AuthenticatedUser seller() {
        return member(SELLER_ID);
    }

    public static AuthenticatedUser bidder() {
        return member(BIDDER_ID);
    }

    public static AuthenticatedUser staff() {
        return AuthenticatedUser.of(STAFF_ID, Role.STAFF);
    }

    public static AuthenticatedUser manager() {
        return AuthenticatedUser.of(MANAGER_ID, Role.MANAGER);
    }

    public static AuthenticatedUser admin() {
        return AuthenticatedUser.of(ADMIN_ID, Role.ADMIN);
    }

    public static JewelryItem jewelry(JewelryStatus status) {
        return JewelryItem.builder()
                .jewelryItemId(UUID.randomUUID().toString())
                .code(String.format("JWL%07d", SEQUENCE.getAndIncrement()))
                .ownerId(SELLER_ID)
                .title("Art deco sapphire ring")
                .description("Platinum setting, 2ct sapphire")
                .status(status)
                .build();
    }

    /**
     * A sell request whose stage timestamps are filled in up to and including {@code status}.
     */
    public static SellRequest sellRequest(SellRequestStatus status, String jewelryItemId) {
        Instant t = Instant.now().minus(10, ChronoUnit.DAYS);
        SellRequest request = SellRequest.builder()
                .sellRequestId(UUID.randomUUID().toString())
                .sellerId(SELLER_ID)
                .jewelryItemId(jewelryItemId)
                .status(status)
                .submittedAt(t)
                .build();
        if (status == SellRequestStatus.REJECTED) {
            request.setRejectedAt(t);
            return request;
        }
        int ordinal = status.ordinal();
        if (ordinal >= SellRequestStatus.PRELIM_APPRAISED.ordinal()) {
            request.setPreliminaryAppraisedAt(t.plus(1, ChronoUnit.DAYS));
        }
        if (ordinal >= SellRequestStatus.RECEIVED.ordinal()) {
            request.setReceivedAt(t.plus(2, ChronoUnit.DAYS));
        }
        if (ordinal >= SellRequestStatus.FINAL_APPRAISED.ordinal()) {
            request.setAppraisedAt(t.plus(3, ChronoUnit.DAYS));
        }
        if (ordinal >= SellRequestStatus.MANAGER_APPROVED.ordinal()) {
            request.setApprovedAt(t.plus(4, ChronoUnit.DAYS));
        }
        if (ordinal >= SellRequestStatus.SELLER_ACCEPTED.ordinal()) {
            request.setAcceptedAt(t.plus(5, ChronoUnit.DAYS));
        }
        if (ordinal >= SellRequestStatus.ASSIGNED_TO_SESSION.ordinal()) {
            request.setAssignedAt(t.plus(6, ChronoUnit.DAYS));
        }
        return request;
    }

    public static AuctionSession session(SessionStatus status) {
        Instant now = Instant.now();
        return AuctionSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .code(String.format("AUC%05d", SEQUENCE.getAndIncrement()))
                .name("Autumn Fine Jewels")
                .startAt(now.minus(1, ChronoUnit.HOURS))
                .endAt(now.plus(2, ChronoUnit.HOURS))
                .status(status)
                .bidIncrementPolicy(BidIncrementPolicy.FIXED)
                .registrationRequired(false)
                .antiSnipingEnabled(true)
                .antiSnipingTriggerSeconds(60)
                .antiSnipingExtensionSeconds(300)
                .build();
    }

    public static SessionItem lot(String sessionId, SessionItemStatus status) {
        return SessionItem.builder()
                .sessionItemId(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .jewelryItemId(UUID.randomUUID().toString())
                .sellRequestId(UUID.randomUUID().toString())
                .sellerId(SELLER_ID)
                .lotNumber(1)
                .startPrice(new BigDecimal("1000.00"))
                .stepPrice(new BigDecimal("50.00"))
                .status(status)
                .build();
    }

    public static Bid winningBid(SessionItem lot, String bidderId, BigDecimal amount) {
        Bid bid = Bid.builder()
                .bidId(UUID.randomUUID().toString())
                .sessionItemId(lot.getSessionItemId())
                .sessionId(lot.getSessionId())
                .bidderId(bidderId)
                .amount(amount)
                .status(BidStatus.VALID)
                .build();
        bid.markWinning();
        lot.recordWinningBid(bid);
        return bid;
    }
}
