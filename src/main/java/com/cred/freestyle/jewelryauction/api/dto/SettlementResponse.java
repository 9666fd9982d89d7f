package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.service.SettlementResult;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Settlement of one lot: the buyer payment, the seller payout and the fees charged.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class SettlementResponse {

    private String sessionItemId;
    private PaymentResponse payment;
    private PayoutResponse payout;
    private BigDecimal buyerPremium;
    private BigDecimal sellerCommission;
    private String feeScheduleId;

    public static SettlementResponse from(SettlementResult result) {
        SettlementResponse response = new SettlementResponse();
        response.setSessionItemId(result.getPayment().getSessionItemId());
        response.setPayment(PaymentResponse.fromEntity(result.getPayment()));
        response.setPayout(PayoutResponse.fromEntity(result.getPayout()));
        response.setBuyerPremium(result.getCharges().getBuyerPremium());
        response.setSellerCommission(result.getCharges().getSellerCommission());
        response.setFeeScheduleId(result.getCharges().getFeeScheduleId());
        return response;
    }
}
