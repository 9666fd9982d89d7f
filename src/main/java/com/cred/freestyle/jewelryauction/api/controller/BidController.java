package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.BidResponse;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.BiddingService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * The caller's own bid history.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/bids")
public class BidController {

    private final BiddingService biddingService;

    public BidController(BiddingService biddingService) {
        this.biddingService = biddingService;
    }

    @GetMapping("/mine")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<BidResponse>> mine(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                biddingService.bidsByBidder(SecurityUtils.currentActor(), page, size), BidResponse::fromEntity));
    }
}
