package com.cred.freestyle.jewelryauction.testutil;

import com.cred.freestyle.jewelryauction.api.dto.AddSessionItemRequest;
import com.cred.freestyle.jewelryauction.api.dto.CreateSessionRequest;
import com.cred.freestyle.jewelryauction.api.dto.SubmitSellRequestRequest;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.service.AuctionSessionService;
import com.cred.freestyle.jewelryauction.service.SellRequestService;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Drives the real services to produce consigned lots for integration tests.
 */
public class AuctionFixtures {

    private final SellRequestService sellRequestService;
    private final AuctionSessionService sessionService;

    public AuctionFixtures(SellRequestService sellRequestService, AuctionSessionService sessionService) {
        this.sellRequestService = sellRequestService;
        this.sessionService = sessionService;
    }

    /**
     * Take a new piece through every consignment step up to SELLER_ACCEPTED.
     */
    public SellRequest acceptedSellRequest(String title, BigDecimal reservePrice) {
        SubmitSellRequestRequest payload = new SubmitSellRequestRequest(
                null, title, title + ", consigned for auction", List.of("https://img.example.com/" + title.hashCode() + ".jpg"));
        SellRequest request = sellRequestService.submit(TestDataBuilder.seller(), payload);
        String id = request.getSellRequestId();

        sellRequestService.preliminaryAppraise(id, TestDataBuilder.staff(), reservePrice, "Photos look genuine");
        sellRequestService.markReceived(id, TestDataBuilder.staff(), "Received by courier");
        sellRequestService.finalAppraise(id, TestDataBuilder.staff(), reservePrice, "Hallmarks verified");
        sellRequestService.managerApprove(id, TestDataBuilder.manager(), reservePrice, "Reserve agreed");
        return sellRequestService.sellerAccept(id, TestDataBuilder.seller());
    }

    public AuctionSession draftSession(boolean registrationRequired) {
        Instant now = Instant.now();
        return sessionService.create(TestDataBuilder.staff(), CreateSessionRequest.builder()
                .name("Evening Jewels")
                .startAt(now.plus(1, ChronoUnit.MINUTES))
                .endAt(now.plus(2, ChronoUnit.HOURS))
                .registrationRequired(registrationRequired)
                .antiSnipingEnabled(false)
                .build());
    }

    /**
     * Session with anti-sniping on, ending shortly after it starts.
     */
    public AuctionSession closingSoonSession(int endInSeconds, int triggerSeconds, int extensionSeconds) {
        Instant now = Instant.now();
        return sessionService.create(TestDataBuilder.staff(), CreateSessionRequest.builder()
                .name("Last Call Jewels")
                .startAt(now.plus(1, ChronoUnit.MINUTES))
                .endAt(now.plusSeconds(endInSeconds))
                .registrationRequired(false)
                .antiSnipingEnabled(true)
                .antiSnipingTriggerSeconds(triggerSeconds)
                .antiSnipingExtensionSeconds(extensionSeconds)
                .build());
    }

    public SessionItem addLot(AuctionSession session, SellRequest request, String startPrice, String stepPrice) {
        return sessionService.addItem(session.getSessionId(), TestDataBuilder.staff(),
                new AddSessionItemRequest(request.getSellRequestId(), new BigDecimal(startPrice),
                        new BigDecimal(stepPrice), null));
    }

    public AuctionSession scheduleAndOpen(AuctionSession session) {
        sessionService.schedule(session.getSessionId(), TestDataBuilder.staff());
        return sessionService.open(session.getSessionId(), TestDataBuilder.staff());
    }
}
