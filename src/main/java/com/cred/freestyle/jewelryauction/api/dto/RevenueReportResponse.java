package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Money moved within a time window. Platform revenue is buyer premium plus seller commission.
 *
 * @author Jewelry Auction Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueReportResponse {

    private Instant from;
    private Instant to;
    private int completedPayments;
    private BigDecimal grossPayments;
    private BigDecimal totalHammer;
    private BigDecimal totalBuyerPremium;
    private int completedPayouts;
    private BigDecimal totalPayouts;
    private BigDecimal totalSellerCommission;
    private int refunds;
    private BigDecimal totalRefunded;
    private BigDecimal platformRevenue;
}
