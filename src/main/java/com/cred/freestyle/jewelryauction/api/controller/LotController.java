package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.BidResponse;
import com.cred.freestyle.jewelryauction.api.dto.LotCloseResponse;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.api.dto.PlaceBidRequest;
import com.cred.freestyle.jewelryauction.api.dto.SessionItemResponse;
import com.cred.freestyle.jewelryauction.api.dto.SettlementResponse;
import com.cred.freestyle.jewelryauction.api.dto.WinnerResponse;
import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.exception.AuctionException;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.AuctionCloseService;
import com.cred.freestyle.jewelryauction.service.AuctionCloseService.LotClosure;
import com.cred.freestyle.jewelryauction.service.AuctionSessionService;
import com.cred.freestyle.jewelryauction.service.BiddingService;
import com.cred.freestyle.jewelryauction.service.SettlementService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for individual lots: bidding, closing, withdrawal and settlement.
 * Bid placement is the hot path and is rate limited per bidder.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/lots")
public class LotController {

    private static final Logger logger = LoggerFactory.getLogger(LotController.class);

    private final BiddingService biddingService;
    private final AuctionSessionService sessionService;
    private final AuctionCloseService closeService;
    private final SettlementService settlementService;
    private final CloudWatchMetricsService metricsService;

    public LotController(
            BiddingService biddingService,
            AuctionSessionService sessionService,
            AuctionCloseService closeService,
            SettlementService settlementService,
            CloudWatchMetricsService metricsService
    ) {
        this.biddingService = biddingService;
        this.sessionService = sessionService;
        this.closeService = closeService;
        this.settlementService = settlementService;
        this.metricsService = metricsService;
    }

    @GetMapping("/{sessionItemId}")
    public ResponseEntity<SessionItemResponse> get(@PathVariable String sessionItemId) {
        return ResponseEntity.ok(SessionItemResponse.fromEntity(sessionService.getItem(sessionItemId)));
    }

    /**
     * Place a bid on a lot.
     *
     * The bid must be at least the current floor plus the session's increment.
     * Retrying with the same idempotency key returns the original bid instead of
     * placing a second one.
     *
     * @param sessionItemId Lot ID
     * @param request Amount and optional idempotency key
     * @return The accepted bid, now WINNING
     */
    @PostMapping("/{sessionItemId}/bids")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<BidResponse> placeBid(
            @PathVariable String sessionItemId,
            @Valid @RequestBody PlaceBidRequest request
    ) {
        AuthenticatedUser actor = SecurityUtils.currentActor();

        try {
            logger.debug("Bid request - lot: {}, bidder: {}, amount: {}",
                    sessionItemId, actor.getUserId(), request.getAmount());

            Bid bid = biddingService.placeBid(
                    sessionItemId,
                    actor,
                    request.getAmount(),
                    request.getIdempotencyKey()
            );

            return ResponseEntity.status(HttpStatus.CREATED).body(BidResponse.fromEntity(bid));

        } catch (AuctionException e) {
            // Already logged and counted by the bidding service
            throw e;

        } catch (Exception e) {
            logger.error("Unexpected error placing bid - lot: {}, bidder: {}",
                    sessionItemId, actor.getUserId(), e);
            metricsService.recordError("BID_PLACEMENT_ERROR", "placeBid");
            throw e;
        }
    }

    @GetMapping("/{sessionItemId}/bids")
    public ResponseEntity<PageResponse<BidResponse>> bids(
            @PathVariable String sessionItemId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                biddingService.bidsForLot(sessionItemId, page, size), BidResponse::fromEntity));
    }

    @GetMapping("/{sessionItemId}/winner")
    public ResponseEntity<WinnerResponse> winner(@PathVariable String sessionItemId) {
        BidResponse winningBid = biddingService.getCurrentWinner(sessionItemId)
                .map(BidResponse::fromEntity)
                .orElse(null);
        return ResponseEntity.ok(new WinnerResponse(
                sessionItemId,
                biddingService.getHighestAmount(sessionItemId),
                winningBid));
    }

    /**
     * Close a single lot ahead of the session. A sold lot is settled immediately.
     */
    @PostMapping("/{sessionItemId}/close")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<LotCloseResponse> close(@PathVariable String sessionItemId) {
        LotClosure closure = closeService.closeItem(sessionItemId, SecurityUtils.currentActor());
        SettlementResponse settlement = closure.getSettlement() == null
                ? null
                : SettlementResponse.from(closure.getSettlement());
        return ResponseEntity.ok(new LotCloseResponse(SessionItemResponse.fromEntity(closure.getLot()), settlement));
    }

    @PostMapping("/{sessionItemId}/withdraw")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionItemResponse> withdraw(@PathVariable String sessionItemId) {
        return ResponseEntity.ok(SessionItemResponse.fromEntity(
                sessionService.withdrawItem(sessionItemId, SecurityUtils.currentActor())));
    }

    /**
     * Create the payment and payout for a SOLD lot. Safe to repeat.
     */
    @PostMapping("/{sessionItemId}/settle")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SettlementResponse> settle(@PathVariable String sessionItemId) {
        return ResponseEntity.ok(SettlementResponse.from(
                settlementService.settle(sessionItemId, SecurityUtils.currentActor())));
    }
}
