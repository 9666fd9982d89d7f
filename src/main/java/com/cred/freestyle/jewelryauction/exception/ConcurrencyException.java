package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when a write lost a race against a concurrent writer (lock or version failure).
 * This is the only failure callers are expected to retry, with backoff.
 *
 * @author Jewelry Auction Team
 */
public class ConcurrencyException extends AuctionException {

    public static final String CODE = "CONCURRENT_MODIFICATION";

    public ConcurrencyException(String message) {
        super(CODE, message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
