package com.cred.freestyle.jewelryauction.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published after a bid is accepted and becomes the winning bid of its lot.
 * Keyed by lot ID so that consumers see the bids of a lot in order.
 *
 * @author Jewelry Auction Team
 */
public class BidPlacedEvent {

    private String bidId;
    private String sessionItemId;
    private String sessionId;
    private String bidderId;
    private BigDecimal amount;
    private String previousWinnerId;
    private Instant sessionEndAt;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public BidPlacedEvent() {
    }

    public BidPlacedEvent(
            String bidId,
            String sessionItemId,
            String sessionId,
            String bidderId,
            BigDecimal amount,
            String previousWinnerId,
            Instant sessionEndAt
    ) {
        this.bidId = bidId;
        this.sessionItemId = sessionItemId;
        this.sessionId = sessionId;
        this.bidderId = bidderId;
        this.amount = amount;
        this.previousWinnerId = previousWinnerId;
        this.sessionEndAt = sessionEndAt;
        this.timestamp = Instant.now();
    }

    public String getBidId() {
        return bidId;
    }

    public void setBidId(String bidId) {
        this.bidId = bidId;
    }

    public String getSessionItemId() {
        return sessionItemId;
    }

    public void setSessionItemId(String sessionItemId) {
        this.sessionItemId = sessionItemId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getBidderId() {
        return bidderId;
    }

    public void setBidderId(String bidderId) {
        this.bidderId = bidderId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getPreviousWinnerId() {
        return previousWinnerId;
    }

    public void setPreviousWinnerId(String previousWinnerId) {
        this.previousWinnerId = previousWinnerId;
    }

    public Instant getSessionEndAt() {
        return sessionEndAt;
    }

    public void setSessionEndAt(Instant sessionEndAt) {
        this.sessionEndAt = sessionEndAt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
