package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Refund;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
public class RefundResponse {

    private String refundId;
    private String paymentId;
    private BigDecimal amount;
    private String reason;
    private String status;
    private String requestedBy;
    private String gatewayTransactionId;
    private String failureReason;
    private Instant processedAt;
    private Instant createdAt;

    public static RefundResponse fromEntity(Refund refund) {
        RefundResponse response = new RefundResponse();
        response.setRefundId(refund.getRefundId());
        response.setPaymentId(refund.getPaymentId());
        response.setAmount(refund.getAmount());
        response.setReason(refund.getReason());
        response.setStatus(refund.getStatus().name());
        response.setRequestedBy(refund.getRequestedBy());
        response.setGatewayTransactionId(refund.getGatewayTransactionId());
        response.setFailureReason(refund.getFailureReason());
        response.setProcessedAt(refund.getProcessedAt());
        response.setCreatedAt(refund.getCreatedAt());
        return response;
    }
}
