package com.cred.freestyle.jewelryauction.infrastructure.payment;

import com.cred.freestyle.jewelryauction.domain.model.PaymentMethod;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Port to the external payment processor.
 * Implementations may throw runtime exceptions on transport failures; callers translate
 * those into {@code ExternalServiceException} and record the attempt as failed.
 *
 * @author Jewelry Auction Team
 */
public interface PaymentGateway {

    /**
     * Charge or pay out an amount.
     *
     * @param amount Amount to move, always positive
     * @param method Payment instrument
     * @param details Free-form context (reference ID, counterparty) forwarded to the processor
     * @return Outcome with the processor's transaction ID on success
     */
    GatewayResult processPayment(BigDecimal amount, PaymentMethod method, Map<String, String> details);

    /**
     * Refund part or all of an earlier transaction.
     *
     * @param transactionId Original transaction ID
     * @param amount Amount to refund
     * @return Outcome with the refund transaction ID on success
     */
    GatewayResult processRefund(String transactionId, BigDecimal amount);

    /**
     * Check whether the processor knows a transaction.
     *
     * @param transactionId Transaction ID
     * @return true if the transaction was issued by the processor
     */
    boolean verifyPayment(String transactionId);
}
