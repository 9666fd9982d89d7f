package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when an operation is not permitted given the current state of an entity.
 * Reported to the caller, never retried.
 *
 * @author Jewelry Auction Team
 */
public class BusinessRuleViolationException extends AuctionException {

    public static final String CODE = "BUSINESS_RULE_VIOLATION";

    public BusinessRuleViolationException(String message) {
        super(CODE, message);
    }

    protected BusinessRuleViolationException(String code, String message) {
        super(code, message);
    }
}
