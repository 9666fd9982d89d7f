package com.cred.freestyle.jewelryauction.service;

import java.math.BigDecimal;

/**
 * Fees charged on one hammer price.
 *
 * @author Jewelry Auction Team
 */
public final class FeeCharges {

    private final BigDecimal hammerPrice;
    private final BigDecimal buyerPremium;
    private final BigDecimal sellerCommission;
    private final String feeScheduleId;

    public FeeCharges(BigDecimal hammerPrice, BigDecimal buyerPremium, BigDecimal sellerCommission,
                      String feeScheduleId) {
        this.hammerPrice = hammerPrice;
        this.buyerPremium = buyerPremium;
        this.sellerCommission = sellerCommission;
        this.feeScheduleId = feeScheduleId;
    }

    public BigDecimal getHammerPrice() {
        return hammerPrice;
    }

    public BigDecimal getBuyerPremium() {
        return buyerPremium;
    }

    public BigDecimal getSellerCommission() {
        return sellerCommission;
    }

    public String getFeeScheduleId() {
        return feeScheduleId;
    }

    /**
     * @return hammer price plus buyer premium
     */
    public BigDecimal buyerTotal() {
        return hammerPrice.add(buyerPremium);
    }

    /**
     * @return hammer price minus seller commission
     */
    public BigDecimal sellerNet() {
        return hammerPrice.subtract(sellerCommission);
    }
}
