package com.cred.freestyle.jewelryauction.infrastructure.payment;

/**
 * Result of a payment gateway call.
 *
 * @author Jewelry Auction Team
 */
public class GatewayResult {
    private final boolean success;
    private final String transactionId;
    private final String failureReason;

    private GatewayResult(boolean success, String transactionId, String failureReason) {
        this.success = success;
        this.transactionId = transactionId;
        this.failureReason = failureReason;
    }

    public static GatewayResult success(String transactionId) {
        return new GatewayResult(true, transactionId, null);
    }

    public static GatewayResult failure(String failureReason) {
        return new GatewayResult(false, null, failureReason);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
