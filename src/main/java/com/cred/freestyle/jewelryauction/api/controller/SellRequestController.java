package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.AppraisalRequest;
import com.cred.freestyle.jewelryauction.api.dto.ApprovalRequest;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.api.dto.RejectionRequest;
import com.cred.freestyle.jewelryauction.api.dto.SellRequestResponse;
import com.cred.freestyle.jewelryauction.api.dto.SubmitSellRequestRequest;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest.SellRequestStatus;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.SellRequestService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the consignment workflow.
 * Each POST sub-resource advances a sell request by exactly one step.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/sell-requests")
@PreAuthorize("isAuthenticated()")
public class SellRequestController {

    private static final Logger logger = LoggerFactory.getLogger(SellRequestController.class);

    private final SellRequestService sellRequestService;

    public SellRequestController(SellRequestService sellRequestService) {
        this.sellRequestService = sellRequestService;
    }

    /**
     * Submit a piece for consignment. Passing an existing jewelry code re-consigns
     * an item that came back unsold, withdrawn or returned.
     *
     * @param request Item description and optional code
     * @return The new request in SUBMITTED state
     */
    @PostMapping
    public ResponseEntity<SellRequestResponse> submit(@Valid @RequestBody SubmitSellRequestRequest request) {
        SellRequest created = sellRequestService.submit(SecurityUtils.currentActor(), request);
        logger.info("Sell request {} submitted for jewelry {}", created.getSellRequestId(), created.getJewelryItemId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SellRequestResponse.fromEntity(created));
    }

    /**
     * List sell requests. Members only ever see their own.
     */
    @GetMapping
    public ResponseEntity<PageResponse<SellRequestResponse>> list(
            @RequestParam(required = false) SellRequestStatus status,
            @RequestParam(required = false) String sellerId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                sellRequestService.list(SecurityUtils.currentActor(), status, sellerId, page, size),
                SellRequestResponse::fromEntity));
    }

    @GetMapping("/{sellRequestId}")
    public ResponseEntity<SellRequestResponse> get(@PathVariable String sellRequestId) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(
                sellRequestService.get(sellRequestId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{sellRequestId}/preliminary-appraisal")
    public ResponseEntity<SellRequestResponse> preliminaryAppraise(
            @PathVariable String sellRequestId,
            @Valid @RequestBody AppraisalRequest request
    ) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(sellRequestService.preliminaryAppraise(
                sellRequestId, SecurityUtils.currentActor(), request.getEstimatedPrice(), request.getNotes())));
    }

    @PostMapping("/{sellRequestId}/receive")
    public ResponseEntity<SellRequestResponse> markReceived(
            @PathVariable String sellRequestId,
            @RequestParam(required = false) String notes
    ) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(
                sellRequestService.markReceived(sellRequestId, SecurityUtils.currentActor(), notes)));
    }

    @PostMapping("/{sellRequestId}/final-appraisal")
    public ResponseEntity<SellRequestResponse> finalAppraise(
            @PathVariable String sellRequestId,
            @Valid @RequestBody AppraisalRequest request
    ) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(sellRequestService.finalAppraise(
                sellRequestId, SecurityUtils.currentActor(), request.getEstimatedPrice(), request.getNotes())));
    }

    @PostMapping("/{sellRequestId}/approve")
    public ResponseEntity<SellRequestResponse> approve(
            @PathVariable String sellRequestId,
            @Valid @RequestBody ApprovalRequest request
    ) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(sellRequestService.managerApprove(
                sellRequestId, SecurityUtils.currentActor(), request.getReservePrice(), request.getNotes())));
    }

    @PostMapping("/{sellRequestId}/accept")
    public ResponseEntity<SellRequestResponse> accept(@PathVariable String sellRequestId) {
        return ResponseEntity.ok(SellRequestResponse.fromEntity(
                sellRequestService.sellerAccept(sellRequestId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{sellRequestId}/reject")
    public ResponseEntity<SellRequestResponse> reject(
            @PathVariable String sellRequestId,
            @Valid @RequestBody RejectionRequest request
    ) {
        SellRequest rejected = sellRequestService.reject(sellRequestId, SecurityUtils.currentActor(), request.getReason());
        logger.info("Sell request {} rejected", sellRequestId);
        return ResponseEntity.ok(SellRequestResponse.fromEntity(rejected));
    }
}
