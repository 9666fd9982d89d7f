package com.cred.freestyle.jewelryauction.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published once a sold lot has been settled into a payment and a payout.
 *
 * @author Jewelry Auction Team
 */
public class SettlementEvent {

    private String sessionItemId;
    private String paymentId;
    private String payoutId;
    private String buyerId;
    private String sellerId;
    private BigDecimal hammerPrice;
    private BigDecimal buyerAmount;
    private BigDecimal sellerAmount;
    private Instant timestamp;

    public SettlementEvent() {
    }

    public SettlementEvent(
            String sessionItemId,
            String paymentId,
            String payoutId,
            String buyerId,
            String sellerId,
            BigDecimal hammerPrice,
            BigDecimal buyerAmount,
            BigDecimal sellerAmount
    ) {
        this.sessionItemId = sessionItemId;
        this.paymentId = paymentId;
        this.payoutId = payoutId;
        this.buyerId = buyerId;
        this.sellerId = sellerId;
        this.hammerPrice = hammerPrice;
        this.buyerAmount = buyerAmount;
        this.sellerAmount = sellerAmount;
        this.timestamp = Instant.now();
    }

    public String getSessionItemId() {
        return sessionItemId;
    }

    public void setSessionItemId(String sessionItemId) {
        this.sessionItemId = sessionItemId;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(String paymentId) {
        this.paymentId = paymentId;
    }

    public String getPayoutId() {
        return payoutId;
    }

    public void setPayoutId(String payoutId) {
        this.payoutId = payoutId;
    }

    public String getBuyerId() {
        return buyerId;
    }

    public void setBuyerId(String buyerId) {
        this.buyerId = buyerId;
    }

    public String getSellerId() {
        return sellerId;
    }

    public void setSellerId(String sellerId) {
        this.sellerId = sellerId;
    }

    public BigDecimal getHammerPrice() {
        return hammerPrice;
    }

    public void setHammerPrice(BigDecimal hammerPrice) {
        this.hammerPrice = hammerPrice;
    }

    public BigDecimal getBuyerAmount() {
        return buyerAmount;
    }

    public void setBuyerAmount(BigDecimal buyerAmount) {
        this.buyerAmount = buyerAmount;
    }

    public BigDecimal getSellerAmount() {
        return sellerAmount;
    }

    public void setSellerAmount(BigDecimal sellerAmount) {
        this.sellerAmount = sellerAmount;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
