package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payout;

/**
 * Payment and payout of a settled lot. {@code created} is false when the lot had already been settled.
 *
 * @author Jewelry Auction Team
 */
public final class SettlementResult {

    private final Payment payment;
    private final Payout payout;
    private final FeeCharges charges;
    private final boolean created;

    public SettlementResult(Payment payment, Payout payout, FeeCharges charges, boolean created) {
        this.payment = payment;
        this.payout = payout;
        this.charges = charges;
        this.created = created;
    }

    static SettlementResult existing(Payment payment, Payout payout) {
        FeeCharges charges = new FeeCharges(payment.getHammerPrice(), payment.getBuyerPremium(),
                payout.getSellerCommission(), payment.getFeeScheduleId());
        return new SettlementResult(payment, payout, charges, false);
    }

    public Payment getPayment() {
        return payment;
    }

    public Payout getPayout() {
        return payout;
    }

    public FeeCharges getCharges() {
        return charges;
    }

    public boolean isCreated() {
        return created;
    }
}
