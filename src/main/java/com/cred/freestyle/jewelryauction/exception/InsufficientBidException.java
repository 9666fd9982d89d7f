package com.cred.freestyle.jewelryauction.exception;

import java.math.BigDecimal;

/**
 * Thrown when a bid amount is below the current floor plus the increment.
 *
 * @author Jewelry Auction Team
 */
public class InsufficientBidException extends BusinessRuleViolationException {

    public static final String CODE = "INSUFFICIENT_BID";

    private final BigDecimal offeredAmount;
    private final BigDecimal minimumAmount;

    public InsufficientBidException(BigDecimal offeredAmount, BigDecimal minimumAmount) {
        super(CODE, "Bid of " + offeredAmount.toPlainString() + " is too low, minimum is "
                + minimumAmount.toPlainString());
        this.offeredAmount = offeredAmount;
        this.minimumAmount = minimumAmount;
    }

    public BigDecimal getOfferedAmount() {
        return offeredAmount;
    }

    public BigDecimal getMinimumAmount() {
        return minimumAmount;
    }
}
