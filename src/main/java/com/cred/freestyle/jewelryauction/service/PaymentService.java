package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ExternalServiceException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage.Kind;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.infrastructure.payment.GatewayResult;
import com.cred.freestyle.jewelryauction.infrastructure.payment.PaymentGateway;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Payment, payout and refund requests.
 *
 * A request moves the record to PROCESSING (or creates a PENDING refund) in its own
 * transaction, then publishes a dispatch message and waits for the broker to acknowledge
 * it. The gateway itself is called later by the dispatch consumer. When the message cannot
 * be handed to the broker the record is put back, so the request can be repeated.
 *
 * @author Jewelry Auction Team
 */
@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private static final String DISPATCH_SERVICE = "kafka";

    private final PaymentLedger ledger;
    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final PaymentGateway paymentGateway;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;
    private final long dispatchTimeoutMs;

    public PaymentService(
            PaymentLedger ledger,
            PaymentRepository paymentRepository,
            PayoutRepository payoutRepository,
            PaymentGateway paymentGateway,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService,
            @Value("${auction.payment.dispatch-timeout-ms:10000}") long dispatchTimeoutMs
    ) {
        this.ledger = ledger;
        this.paymentRepository = paymentRepository;
        this.payoutRepository = payoutRepository;
        this.paymentGateway = paymentGateway;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.dispatchTimeoutMs = dispatchTimeoutMs;
    }

    /**
     * Buyer asks to pay a PENDING payment with the given method.
     *
     * @return Payment in PROCESSING
     * @throws ExternalServiceException if the dispatch could not be published
     */
    public Payment requestPayment(String paymentId, PaymentMethod method, AuthenticatedUser actor) {
        if (method == null) {
            throw new ValidationException("method", "Payment method is required");
        }
        Payment payment = ledger.findPayment(paymentId);
        AuthorizationGate.requireOwner(actor, payment.getBuyerId(), "Pay for lot");

        payment = ledger.markPaymentProcessing(paymentId, method);
        try {
            dispatch(new PaymentDispatchMessage(Kind.PAYMENT, paymentId, actor.getUserId()));
        } catch (ExternalServiceException e) {
            ledger.revertPayment(paymentId);
            throw e;
        }
        logger.info("Payment {} of {} dispatched via {} for buyer {}",
                paymentId, payment.getAmount(), method, actor.getUserId());
        return payment;
    }

    /**
     * Staff release a PENDING payout to the seller.
     */
    public Payout requestPayout(String payoutId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Release payout");

        Payout payout = ledger.markPayoutProcessing(payoutId);
        try {
            dispatch(new PaymentDispatchMessage(Kind.PAYOUT, payoutId, actor.getUserId()));
        } catch (ExternalServiceException e) {
            ledger.revertPayout(payoutId);
            throw e;
        }
        logger.info("Payout {} of {} dispatched for seller {}", payoutId, payout.getAmount(), payout.getSellerId());
        return payout;
    }

    /**
     * Refund a COMPLETED payment, at most once and at most the amount paid.
     *
     * @return PENDING refund, or FAILED when the dispatch could not be published
     */
    public Refund requestRefund(String paymentId, BigDecimal amount, String reason, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Refund payment");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "A refund reason is required");
        }

        Refund refund = ledger.createRefund(paymentId, amount, reason, actor.getUserId());
        try {
            dispatch(new PaymentDispatchMessage(Kind.REFUND, refund.getRefundId(), actor.getUserId()));
        } catch (ExternalServiceException e) {
            ledger.recordRefundResult(refund.getRefundId(), GatewayResult.failure("Dispatch failed: " + e.getMessage()));
            metricsService.recordPaymentOutcome(Kind.REFUND.name(), "DISPATCH_FAILED");
            throw e;
        }
        logger.info("Refund {} of {} for payment {} dispatched by {}",
                refund.getRefundId(), amount, paymentId, actor.getUserId());
        return refund;
    }

    /**
     * Ask the gateway whether the payment's transaction is known.
     */
    public boolean verifyPayment(String paymentId, AuthenticatedUser actor) {
        Payment payment = ledger.findPayment(paymentId);
        AuthorizationGate.requireOwnerOrAtLeast(actor, payment.getBuyerId(), Role.STAFF, "Verify payment");
        if (payment.getGatewayTransactionId() == null) {
            throw new BusinessRuleViolationException("Payment " + paymentId + " has no gateway transaction yet");
        }
        try {
            return paymentGateway.verifyPayment(payment.getGatewayTransactionId());
        } catch (RuntimeException e) {
            throw new ExternalServiceException("payment-gateway", "Verification of payment " + paymentId + " failed", e);
        }
    }

    public Payment getPayment(String paymentId, AuthenticatedUser actor) {
        Payment payment = ledger.findPayment(paymentId);
        AuthorizationGate.requireOwnerOrAtLeast(actor, payment.getBuyerId(), Role.STAFF, "View payment");
        return payment;
    }

    public List<Payment> myPayments(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "List payments");
        return paymentRepository.findByBuyerIdOrderByCreatedAtDesc(actor.getUserId());
    }

    public Payout getPayout(String payoutId, AuthenticatedUser actor) {
        Payout payout = ledger.findPayout(payoutId);
        AuthorizationGate.requireOwnerOrAtLeast(actor, payout.getSellerId(), Role.STAFF, "View payout");
        return payout;
    }

    public List<Payout> myPayouts(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "List payouts");
        return payoutRepository.findBySellerIdOrderByCreatedAtDesc(actor.getUserId());
    }

    public Refund getRefund(String refundId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "View refund");
        return ledger.findRefund(refundId);
    }

    private void dispatch(PaymentDispatchMessage message) {
        try {
            kafkaProducerService.publishPaymentDispatch(message).get(dispatchTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(DISPATCH_SERVICE, "Interrupted while dispatching "
                    + message.getKind() + " " + message.getReferenceId(), e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            logger.error("Failed to dispatch {} {}", message.getKind(), message.getReferenceId(), e);
            throw new ExternalServiceException(DISPATCH_SERVICE, "Could not dispatch "
                    + message.getKind() + " " + message.getReferenceId(), e);
        }
    }
}
