package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when a bid targets a lot that is not ACTIVE.
 *
 * @author Jewelry Auction Team
 */
public class ItemNotAvailableException extends BusinessRuleViolationException {

    public static final String CODE = "ITEM_NOT_AVAILABLE";

    private final String sessionItemId;

    public ItemNotAvailableException(String sessionItemId, Enum<?> status) {
        super(CODE, "Lot " + sessionItemId + " is not available for bidding (status " + status + ")");
        this.sessionItemId = sessionItemId;
    }

    public String getSessionItemId() {
        return sessionItemId;
    }
}
