package com.cred.freestyle.jewelryauction.domain.model;

import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SessionItem Domain Model Tests")
class SessionItemTest {

    @Test
    @DisplayName("currentFloor - Start price until the first bid, then the highest bid")
    void currentFloor() {
        SessionItem lot = TestDataBuilder.lot("s-1", SessionItemStatus.ACTIVE);
        assertThat(lot.currentFloor()).isEqualByComparingTo("1000.00");

        TestDataBuilder.winningBid(lot, TestDataBuilder.BIDDER_ID, new BigDecimal("1050.00"));

        assertThat(lot.currentFloor()).isEqualByComparingTo("1050.00");
        assertThat(lot.getCurrentWinnerId()).isEqualTo(TestDataBuilder.BIDDER_ID);
        assertThat(lot.getBidCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("meetsReserve - No reserve always sells; otherwise the amount must reach it")
    void meetsReserve() {
        SessionItem lot = TestDataBuilder.lot("s-1", SessionItemStatus.ACTIVE);
        assertThat(lot.meetsReserve(new BigDecimal("1"))).isTrue();

        lot.setReservePrice(new BigDecimal("2000"));
        assertThat(lot.meetsReserve(new BigDecimal("1999.99"))).isFalse();
        assertThat(lot.meetsReserve(new BigDecimal("2000.00"))).isTrue();
    }

    @Test
    @DisplayName("Bid - markOutbid clears the winning lot pointer")
    void bidOutbid() {
        SessionItem lot = TestDataBuilder.lot("s-1", SessionItemStatus.ACTIVE);
        Bid bid = TestDataBuilder.winningBid(lot, TestDataBuilder.BIDDER_ID, new BigDecimal("1050"));
        assertThat(bid.getWinningLotId()).isEqualTo(lot.getSessionItemId());

        bid.markOutbid();

        assertThat(bid.getStatus()).isEqualTo(BidStatus.OUTBID);
        assertThat(bid.getWinningLotId()).isNull();
    }

    @Test
    @DisplayName("isOpen - Only PENDING and ACTIVE lots are open")
    void statusIsOpen() {
        assertThat(SessionItemStatus.PENDING.isOpen()).isTrue();
        assertThat(SessionItemStatus.ACTIVE.isOpen()).isTrue();
        assertThat(SessionItemStatus.SOLD.isOpen()).isFalse();
        assertThat(SessionItemStatus.UNSOLD.isOpen()).isFalse();
        assertThat(SessionItemStatus.WITHDRAWN.isOpen()).isFalse();
    }
}
