package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.PaymentResponse;
import com.cred.freestyle.jewelryauction.api.dto.ProcessPaymentRequest;
import com.cred.freestyle.jewelryauction.api.dto.RefundRequest;
import com.cred.freestyle.jewelryauction.api.dto.RefundResponse;
import com.cred.freestyle.jewelryauction.api.dto.VerificationResponse;
import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.PaymentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for buyer payments and refunds.
 *
 * Pay and refund requests are accepted asynchronously: the response carries the
 * record in PROCESSING (or PENDING for refunds) and the gateway outcome lands later.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/payments")
@PreAuthorize("isAuthenticated()")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @GetMapping("/mine")
    public ResponseEntity<List<PaymentResponse>> mine() {
        return ResponseEntity.ok(paymentService.myPayments(SecurityUtils.currentActor()).stream()
                .map(PaymentResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> get(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponse.fromEntity(
                paymentService.getPayment(paymentId, SecurityUtils.currentActor())));
    }

    /**
     * Pay for a won lot. Only the buyer may pay.
     */
    @PostMapping("/{paymentId}/pay")
    public ResponseEntity<PaymentResponse> pay(
            @PathVariable String paymentId,
            @Valid @RequestBody ProcessPaymentRequest request
    ) {
        Payment payment = paymentService.requestPayment(paymentId, request.getMethod(), SecurityUtils.currentActor());
        logger.info("Payment {} accepted for processing via {}", paymentId, request.getMethod());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(PaymentResponse.fromEntity(payment));
    }

    @GetMapping("/{paymentId}/verify")
    public ResponseEntity<VerificationResponse> verify(@PathVariable String paymentId) {
        AuthenticatedUser actor = SecurityUtils.currentActor();
        boolean verified = paymentService.verifyPayment(paymentId, actor);
        Payment payment = paymentService.getPayment(paymentId, actor);
        return ResponseEntity.ok(new VerificationResponse(paymentId, payment.getGatewayTransactionId(), verified));
    }

    @PostMapping("/{paymentId}/refunds")
    public ResponseEntity<RefundResponse> refund(
            @PathVariable String paymentId,
            @Valid @RequestBody RefundRequest request
    ) {
        Refund refund = paymentService.requestRefund(
                paymentId, request.getAmount(), request.getReason(), SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RefundResponse.fromEntity(refund));
    }

    @GetMapping("/refunds/{refundId}")
    public ResponseEntity<RefundResponse> getRefund(@PathVariable String refundId) {
        return ResponseEntity.ok(RefundResponse.fromEntity(
                paymentService.getRefund(refundId, SecurityUtils.currentActor())));
    }
}
