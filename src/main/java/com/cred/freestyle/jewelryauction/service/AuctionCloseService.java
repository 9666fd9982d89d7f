package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.AuctionException;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Closes lots and sessions and settles the SOLD lots once the close has committed.
 *
 * Closing and settling run in separate transactions: a close never waits on settlement,
 * and a lot whose settlement fails stays SOLD and can be settled again later.
 *
 * @author Jewelry Auction Team
 */
@Service
public class AuctionCloseService {

    private static final Logger logger = LoggerFactory.getLogger(AuctionCloseService.class);

    private final BiddingService biddingService;
    private final AuctionSessionService sessionService;
    private final SettlementService settlementService;
    private final CloudWatchMetricsService metricsService;

    public AuctionCloseService(
            BiddingService biddingService,
            AuctionSessionService sessionService,
            SettlementService settlementService,
            CloudWatchMetricsService metricsService
    ) {
        this.biddingService = biddingService;
        this.sessionService = sessionService;
        this.settlementService = settlementService;
        this.metricsService = metricsService;
    }

    /**
     * Close one ACTIVE lot and settle it when SOLD.
     */
    public LotClosure closeItem(String sessionItemId, AuthenticatedUser actor) {
        SessionItem item = biddingService.closeItem(sessionItemId, actor);
        if (item.getStatus() != SessionItemStatus.SOLD) {
            return new LotClosure(item, null);
        }
        return new LotClosure(item, settlementService.settleLot(sessionItemId));
    }

    /**
     * Close a session and settle every SOLD lot.
     *
     * A failing settlement does not undo the close; the lot is reported as unsettled.
     */
    public SessionClosure closeSession(String sessionId, AuthenticatedUser actor) {
        AuctionSession session = sessionService.close(sessionId, actor);
        return settleSoldLots(session, false);
    }

    /**
     * Settle every SOLD lot of a CLOSED session, then mark it SETTLED.
     * Any settlement failure propagates and the session stays CLOSED.
     */
    public SessionClosure settleSession(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Settle auction session");
        SessionClosure settled = settleSoldLots(sessionService.get(sessionId), true);
        AuctionSession session = sessionService.markSettled(sessionId, actor);
        return new SessionClosure(session, settled.getSettlements(), settled.getUnsettledLotIds());
    }

    private SessionClosure settleSoldLots(AuctionSession session, boolean failFast) {
        List<SettlementResult> settlements = new ArrayList<>();
        List<String> unsettled = new ArrayList<>();

        for (SessionItem item : sessionService.listItems(session.getSessionId(), SessionItemStatus.SOLD)) {
            if (failFast) {
                settlements.add(settlementService.settleLot(item.getSessionItemId()));
                continue;
            }
            try {
                settlements.add(settlementService.settleLot(item.getSessionItemId()));
            } catch (AuctionException e) {
                logger.error("Settlement of lot {} in session {} failed: {}",
                        item.getSessionItemId(), session.getSessionId(), e.getMessage(), e);
                metricsService.recordError(e.getCode(), "settle_lot");
                unsettled.add(item.getSessionItemId());
            } catch (RuntimeException e) {
                logger.error("Unexpected error settling lot {} in session {}",
                        item.getSessionItemId(), session.getSessionId(), e);
                metricsService.recordError(e.getClass().getSimpleName(), "settle_lot");
                unsettled.add(item.getSessionItemId());
            }
        }

        logger.info("Session {}: {} lots settled, {} unsettled",
                session.getSessionId(), settlements.size(), unsettled.size());
        return new SessionClosure(session, settlements, unsettled);
    }

    /**
     * A closed lot and its settlement, null unless the lot was SOLD.
     */
    public static final class LotClosure {

        private final SessionItem lot;
        private final SettlementResult settlement;

        public LotClosure(SessionItem lot, SettlementResult settlement) {
            this.lot = lot;
            this.settlement = settlement;
        }

        public SessionItem getLot() {
            return lot;
        }

        public SettlementResult getSettlement() {
            return settlement;
        }
    }

    /**
     * A closed (or settled) session with the settlements made and the lots left unsettled.
     */
    public static final class SessionClosure {

        private final AuctionSession session;
        private final List<SettlementResult> settlements;
        private final List<String> unsettledLotIds;

        public SessionClosure(AuctionSession session, List<SettlementResult> settlements,
                              List<String> unsettledLotIds) {
            this.session = session;
            this.settlements = settlements;
            this.unsettledLotIds = unsettledLotIds;
        }

        public AuctionSession getSession() {
            return session;
        }

        public List<SettlementResult> getSettlements() {
            return settlements;
        }

        public List<String> getUnsettledLotIds() {
            return unsettledLotIds;
        }
    }
}
