package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import com.cred.freestyle.jewelryauction.domain.model.Refund.RefundStatus;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.payment.GatewayResult;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.repository.RefundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Short transactions that move payments, payouts and refunds between statuses.
 *
 * Each method commits on its own so that callers can publish to Kafka or call the
 * gateway between two status changes without holding a transaction open.
 * Concurrent updates of the same payment or payout are rejected by their version column.
 *
 * @author Jewelry Auction Team
 */
@Component
public class PaymentLedger {

    private static final Logger logger = LoggerFactory.getLogger(PaymentLedger.class);

    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final RefundRepository refundRepository;

    public PaymentLedger(PaymentRepository paymentRepository,
                         PayoutRepository payoutRepository,
                         RefundRepository refundRepository) {
        this.paymentRepository = paymentRepository;
        this.payoutRepository = payoutRepository;
        this.refundRepository = refundRepository;
    }

    // ========================================
    // Payments
    // ========================================

    @Transactional
    public Payment markPaymentProcessing(String paymentId, PaymentMethod method) {
        Payment payment = findPayment(paymentId);
        payment.startProcessing(method);
        return paymentRepository.saveAndFlush(payment);
    }

    @Transactional
    public Payment revertPayment(String paymentId) {
        Payment payment = findPayment(paymentId);
        payment.returnToPending();
        logger.warn("Payment {} returned to PENDING", paymentId);
        return paymentRepository.save(payment);
    }

    @Transactional
    public Payment recordPaymentResult(String paymentId, GatewayResult result) {
        Payment payment = findPayment(paymentId);
        if (result.isSuccess()) {
            payment.complete(result.getTransactionId());
        } else {
            payment.fail(result.getFailureReason());
        }
        return paymentRepository.save(payment);
    }

    // ========================================
    // Payouts
    // ========================================

    @Transactional
    public Payout markPayoutProcessing(String payoutId) {
        Payout payout = findPayout(payoutId);
        payout.startProcessing();
        return payoutRepository.saveAndFlush(payout);
    }

    @Transactional
    public Payout revertPayout(String payoutId) {
        Payout payout = findPayout(payoutId);
        payout.returnToPending();
        logger.warn("Payout {} returned to PENDING", payoutId);
        return payoutRepository.save(payout);
    }

    @Transactional
    public Payout recordPayoutResult(String payoutId, GatewayResult result) {
        Payout payout = findPayout(payoutId);
        if (result.isSuccess()) {
            payout.complete(result.getTransactionId());
        } else {
            payout.fail(result.getFailureReason());
        }
        return payoutRepository.save(payout);
    }

    // ========================================
    // Refunds
    // ========================================

    /**
     * Create a PENDING refund for a completed payment.
     *
     * @throws BusinessRuleViolationException if the payment is not COMPLETED or already has a refund
     * @throws ValidationException if the amount is not within (0, payment amount]
     */
    @Transactional
    public Refund createRefund(String paymentId, BigDecimal amount, String reason, String requestedBy) {
        Payment payment = findPayment(paymentId);
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new BusinessRuleViolationException("Only completed payments can be refunded, payment "
                    + paymentId + " is " + payment.getStatus());
        }
        if (amount == null || amount.signum() <= 0 || amount.compareTo(payment.getAmount()) > 0) {
            throw new ValidationException("amount", "Refund amount must be positive and at most "
                    + payment.getAmount().toPlainString());
        }
        if (refundRepository.existsByPaymentId(paymentId)) {
            throw new BusinessRuleViolationException("Payment " + paymentId + " already has a refund");
        }

        Refund refund = Refund.builder()
                .paymentId(paymentId)
                .amount(amount)
                .reason(reason)
                .requestedBy(requestedBy)
                .status(RefundStatus.PENDING)
                .build();
        return refundRepository.saveAndFlush(refund);
    }

    @Transactional
    public Refund recordRefundResult(String refundId, GatewayResult result) {
        Refund refund = findRefund(refundId);
        if (result.isSuccess()) {
            refund.complete(result.getTransactionId());
            Payment payment = findPayment(refund.getPaymentId());
            payment.markRefunded();
            paymentRepository.save(payment);
        } else {
            refund.fail(result.getFailureReason());
        }
        return refundRepository.save(refund);
    }

    // ========================================
    // Lookups
    // ========================================

    @Transactional(readOnly = true)
    public Payment findPayment(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public Payout findPayout(String payoutId) {
        return payoutRepository.findById(payoutId)
                .orElseThrow(() -> new ResourceNotFoundException("Payout", payoutId));
    }

    @Transactional(readOnly = true)
    public Refund findRefund(String refundId) {
        return refundRepository.findById(refundId)
                .orElseThrow(() -> new ResourceNotFoundException("Refund", refundId));
    }
}
