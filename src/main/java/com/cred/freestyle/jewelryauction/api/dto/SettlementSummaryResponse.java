package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Financial summary of a session.
 *
 * @author Jewelry Auction Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementSummaryResponse {

    private String sessionId;
    private String sessionStatus;
    private int totalLots;
    private int soldLots;
    private int unsoldLots;
    private int withdrawnLots;
    private int openLots;
    private BigDecimal totalHammer;
    private BigDecimal totalBuyerPremium;
    private BigDecimal totalSellerCommission;
    private BigDecimal totalPayments;
    private BigDecimal totalPayouts;
    private int completedPayments;
    private int completedPayouts;
}
