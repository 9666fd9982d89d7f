package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when the caller's role or ownership is insufficient for an operation.
 *
 * @author Jewelry Auction Team
 */
public class AuthorizationException extends AuctionException {

    public static final String CODE = "INSUFFICIENT_PERMISSIONS";

    public AuthorizationException(String message) {
        super(CODE, message);
    }
}
