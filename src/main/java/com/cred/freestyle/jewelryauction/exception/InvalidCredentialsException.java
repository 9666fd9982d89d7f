package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when an email and password pair does not match an active account.
 * The message never says which half was wrong.
 *
 * @author Jewelry Auction Team
 */
public class InvalidCredentialsException extends AuctionException {

    public static final String CODE = "INVALID_CREDENTIALS";

    public InvalidCredentialsException() {
        super(CODE, "Invalid email or password");
    }
}
