package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when a bidder has no APPROVED enrollment for the session of the lot.
 *
 * @author Jewelry Auction Team
 */
public class UserNotEnrolledException extends BusinessRuleViolationException {

    public static final String CODE = "USER_NOT_ENROLLED";

    private final String userId;
    private final String sessionId;

    public UserNotEnrolledException(String userId, String sessionId) {
        super(CODE, "User " + userId + " is not approved to bid in session " + sessionId);
        this.userId = userId;
        this.sessionId = sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
