package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when a bid targets a session that is not OPEN or whose end time has passed.
 *
 * @author Jewelry Auction Team
 */
public class AuctionNotOpenException extends BusinessRuleViolationException {

    public static final String CODE = "AUCTION_NOT_OPEN";

    private final String sessionId;

    public AuctionNotOpenException(String sessionId, String reason) {
        super(CODE, "Auction session " + sessionId + " is not open for bidding: " + reason);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
