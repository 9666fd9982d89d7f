package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown on a uniqueness collision, such as a duplicate email or jewelry code.
 *
 * @author Jewelry Auction Team
 */
public class ConflictException extends AuctionException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message) {
        super(CODE, message);
    }

    public ConflictException(String code, String message) {
        super(code, message);
    }
}
