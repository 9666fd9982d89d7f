package com.cred.freestyle.jewelryauction.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Message asking the gateway consumer to execute a money movement.
 * Published to Kafka by the payment service; consumed in batches by
 * {@code PaymentGatewayConsumer}.
 *
 * The referenced record carries the amount and method; the message only says what to do.
 *
 * @author Jewelry Auction Team
 */
public class PaymentDispatchMessage {

    private Kind kind;
    private String referenceId;
    private String requestedBy;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public PaymentDispatchMessage() {
    }

    /**
     * @param kind What to execute
     * @param referenceId Payment, payout or refund ID
     * @param requestedBy User who requested the dispatch
     */
    public PaymentDispatchMessage(Kind kind, String referenceId, String requestedBy) {
        this.kind = kind;
        this.referenceId = referenceId;
        this.requestedBy = requestedBy;
        this.timestamp = Instant.now();
    }

    public Kind getKind() {
        return kind;
    }

    public void setKind(Kind kind) {
        this.kind = kind;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public void setRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Dispatch kind.
     */
    public enum Kind {
        PAYMENT,
        PAYOUT,
        REFUND
    }
}
