package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when caller input is missing or malformed.
 *
 * @author Jewelry Auction Team
 */
public class ValidationException extends AuctionException {

    public static final String CODE = "VALIDATION_ERROR";

    private final String field;

    public ValidationException(String field, String message) {
        super(CODE, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
