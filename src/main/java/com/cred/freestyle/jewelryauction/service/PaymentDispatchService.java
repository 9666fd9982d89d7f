package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Payout.PayoutStatus;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.domain.model.Refund.RefundStatus;
import com.cred.freestyle.jewelryauction.exception.ExternalServiceException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.infrastructure.payment.GatewayResult;
import com.cred.freestyle.jewelryauction.infrastructure.payment.PaymentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Executes dispatched money movements against the payment gateway.
 *
 * The gateway is called with no transaction open and no row locked; only the status
 * update afterwards runs in a short ledger transaction. A record that is no longer
 * awaiting the gateway (a redelivered message) is skipped. Failures are recorded as
 * FAILED and never retried automatically.
 *
 * @author Jewelry Auction Team
 */
@Service
public class PaymentDispatchService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentDispatchService.class);

    static final String GATEWAY_SERVICE = "payment-gateway";

    private final PaymentLedger ledger;
    private final PaymentGateway paymentGateway;
    private final CloudWatchMetricsService metricsService;

    public PaymentDispatchService(PaymentLedger ledger,
                                  PaymentGateway paymentGateway,
                                  CloudWatchMetricsService metricsService) {
        this.ledger = ledger;
        this.paymentGateway = paymentGateway;
        this.metricsService = metricsService;
    }

    /**
     * Execute one dispatch message.
     *
     * @param message Dispatch message
     */
    public void dispatch(PaymentDispatchMessage message) {
        if (message.getKind() == null || message.getReferenceId() == null) {
            logger.warn("Ignoring malformed dispatch message: kind={}, reference={}",
                    message.getKind(), message.getReferenceId());
            return;
        }
        switch (message.getKind()) {
            case PAYMENT:
                processPayment(message.getReferenceId());
                break;
            case PAYOUT:
                processPayout(message.getReferenceId());
                break;
            case REFUND:
                processRefund(message.getReferenceId());
                break;
            default:
                logger.warn("Unknown dispatch kind {}", message.getKind());
        }
    }

    void processPayment(String paymentId) {
        Payment payment = ledger.findPayment(paymentId);
        if (payment.getStatus() != PaymentStatus.PROCESSING) {
            logger.info("Skipping payment {} in status {}", paymentId, payment.getStatus());
            return;
        }

        Map<String, String> details = new HashMap<>();
        details.put("paymentId", paymentId);
        details.put("buyerId", payment.getBuyerId());
        details.put("sessionItemId", payment.getSessionItemId());

        GatewayResult result = callGateway("PAYMENT", paymentId,
                () -> paymentGateway.processPayment(payment.getAmount(), payment.getMethod(), details));
        Payment recorded = ledger.recordPaymentResult(paymentId, result);
        logger.info("Payment {} {}", paymentId, recorded.getStatus());
        metricsService.recordPaymentOutcome("PAYMENT", recorded.getStatus().name());
    }

    void processPayout(String payoutId) {
        Payout payout = ledger.findPayout(payoutId);
        if (payout.getStatus() != PayoutStatus.PROCESSING) {
            logger.info("Skipping payout {} in status {}", payoutId, payout.getStatus());
            return;
        }

        Map<String, String> details = new HashMap<>();
        details.put("payoutId", payoutId);
        details.put("sellerId", payout.getSellerId());
        details.put("sessionItemId", payout.getSessionItemId());

        GatewayResult result = callGateway("PAYOUT", payoutId,
                () -> paymentGateway.processPayment(payout.getAmount(), PaymentMethod.BANK_TRANSFER, details));
        Payout recorded = ledger.recordPayoutResult(payoutId, result);
        logger.info("Payout {} {}", payoutId, recorded.getStatus());
        metricsService.recordPaymentOutcome("PAYOUT", recorded.getStatus().name());
    }

    void processRefund(String refundId) {
        Refund refund = ledger.findRefund(refundId);
        if (refund.getStatus() != RefundStatus.PENDING) {
            logger.info("Skipping refund {} in status {}", refundId, refund.getStatus());
            return;
        }

        Payment payment = ledger.findPayment(refund.getPaymentId());
        GatewayResult result = callGateway("REFUND", refundId,
                () -> paymentGateway.processRefund(payment.getGatewayTransactionId(), refund.getAmount()));
        Refund recorded = ledger.recordRefundResult(refundId, result);
        logger.info("Refund {} {}", refundId, recorded.getStatus());
        metricsService.recordPaymentOutcome("REFUND", recorded.getStatus().name());
    }

    private GatewayResult callGateway(String kind, String referenceId, Supplier<GatewayResult> call) {
        long startTime = System.currentTimeMillis();
        try {
            GatewayResult result = call.get();
            if (result == null) {
                throw new ExternalServiceException(GATEWAY_SERVICE, "Gateway returned no result for "
                        + kind + " " + referenceId, null);
            }
            return result;
        } catch (ExternalServiceException e) {
            logger.error("{} {}: {}", kind, referenceId, e.getMessage());
            metricsService.recordError(e.getCode(), "gateway_" + kind.toLowerCase());
            return GatewayResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            ExternalServiceException failure = new ExternalServiceException(GATEWAY_SERVICE,
                    "Gateway error for " + kind + " " + referenceId + ": " + e.getMessage(), e);
            logger.error("{} {} failed at the gateway", kind, referenceId, failure);
            metricsService.recordError(failure.getCode(), "gateway_" + kind.toLowerCase());
            return GatewayResult.failure(failure.getMessage());
        } finally {
            metricsService.recordGatewayLatency(kind, System.currentTimeMillis() - startTime);
        }
    }
}
