package com.cred.freestyle.jewelryauction.exception;

/**
 * Thrown when the payment gateway fails or cannot be reached.
 * The failure is recorded on the payment record; it never rolls back auction state.
 *
 * @author Jewelry Auction Team
 */
public class ExternalServiceException extends AuctionException {

    public static final String CODE = "EXTERNAL_SERVICE_ERROR";

    private final String service;

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(CODE, message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
