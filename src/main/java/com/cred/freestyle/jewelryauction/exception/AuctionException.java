package com.cred.freestyle.jewelryauction.exception;

/**
 * Base class for every failure raised by the auction core.
 * Each subclass carries a stable machine-readable code alongside the human message,
 * so the API layer can map errors without parsing message text.
 *
 * @author Jewelry Auction Team
 */
public abstract class AuctionException extends RuntimeException {

    private final String code;

    protected AuctionException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AuctionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether the caller may retry the same request after a backoff.
     *
     * @return true only for transient contention failures
     */
    public boolean isRetryable() {
        return false;
    }
}
