package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.service.FeeCalculator.FeeSchedule;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The fee schedule in force. {@code feeId} is null when the configured defaults apply.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class FeeScheduleResponse {

    private String feeId;
    private String name;
    private BigDecimal buyerPercentage;
    private BigDecimal sellerPercentage;
    private BigDecimal minFee;
    private BigDecimal maxFee;

    public static FeeScheduleResponse from(FeeSchedule schedule) {
        FeeScheduleResponse response = new FeeScheduleResponse();
        response.setFeeId(schedule.getFeeId());
        response.setName(schedule.getName());
        response.setBuyerPercentage(schedule.getBuyerPercentage());
        response.setSellerPercentage(schedule.getSellerPercentage());
        response.setMinFee(schedule.getMinFee());
        response.setMaxFee(schedule.getMaxFee());
        return response;
    }
}
