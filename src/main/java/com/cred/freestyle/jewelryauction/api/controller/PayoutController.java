package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.PayoutResponse;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.PaymentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Seller payouts. Release is staff-only.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/payouts")
@PreAuthorize("isAuthenticated()")
public class PayoutController {

    private final PaymentService paymentService;

    public PayoutController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @GetMapping("/mine")
    public ResponseEntity<List<PayoutResponse>> mine() {
        return ResponseEntity.ok(paymentService.myPayouts(SecurityUtils.currentActor()).stream()
                .map(PayoutResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{payoutId}")
    public ResponseEntity<PayoutResponse> get(@PathVariable String payoutId) {
        return ResponseEntity.ok(PayoutResponse.fromEntity(
                paymentService.getPayout(payoutId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{payoutId}/release")
    public ResponseEntity<PayoutResponse> release(@PathVariable String payoutId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(PayoutResponse.fromEntity(
                paymentService.requestPayout(payoutId, SecurityUtils.currentActor())));
    }
}
