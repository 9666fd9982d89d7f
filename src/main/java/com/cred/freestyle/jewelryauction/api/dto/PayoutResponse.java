package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Payout;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
public class PayoutResponse {

    private String payoutId;
    private String sessionItemId;
    private String sessionId;
    private String sellerId;
    private BigDecimal hammerPrice;
    private BigDecimal sellerCommission;
    private BigDecimal amount;
    private String status;
    private String gatewayTransactionId;
    private String failureReason;
    private Instant processedAt;
    private Instant createdAt;

    public static PayoutResponse fromEntity(Payout payout) {
        PayoutResponse response = new PayoutResponse();
        response.setPayoutId(payout.getPayoutId());
        response.setSessionItemId(payout.getSessionItemId());
        response.setSessionId(payout.getSessionId());
        response.setSellerId(payout.getSellerId());
        response.setHammerPrice(payout.getHammerPrice());
        response.setSellerCommission(payout.getSellerCommission());
        response.setAmount(payout.getAmount());
        response.setStatus(payout.getStatus().name());
        response.setGatewayTransactionId(payout.getGatewayTransactionId());
        response.setFailureReason(payout.getFailureReason());
        response.setProcessedAt(payout.getProcessedAt());
        response.setCreatedAt(payout.getCreatedAt());
        return response;
    }
}
