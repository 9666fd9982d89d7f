package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
public class PaymentResponse {

    private String paymentId;
    private String sessionItemId;
    private String sessionId;
    private String buyerId;
    private BigDecimal hammerPrice;
    private BigDecimal buyerPremium;
    private BigDecimal amount;
    private String method;
    private String status;
    private String gatewayTransactionId;
    private String failureReason;
    private Instant processedAt;
    private Instant createdAt;

    public static PaymentResponse fromEntity(Payment payment) {
        PaymentResponse response = new PaymentResponse();
        response.setPaymentId(payment.getPaymentId());
        response.setSessionItemId(payment.getSessionItemId());
        response.setSessionId(payment.getSessionId());
        response.setBuyerId(payment.getBuyerId());
        response.setHammerPrice(payment.getHammerPrice());
        response.setBuyerPremium(payment.getBuyerPremium());
        response.setAmount(payment.getAmount());
        response.setMethod(payment.getMethod() != null ? payment.getMethod().name() : null);
        response.setStatus(payment.getStatus().name());
        response.setGatewayTransactionId(payment.getGatewayTransactionId());
        response.setFailureReason(payment.getFailureReason());
        response.setProcessedAt(payment.getProcessedAt());
        response.setCreatedAt(payment.getCreatedAt());
        return response;
    }
}
