package com.cred.freestyle.jewelryauction.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published when a lot leaves the bidding phase.
 *
 * Outcomes:
 * - SOLD: winning bid met the reserve; winnerId and hammerPrice are set
 * - UNSOLD: no bids, or the best bid stayed under the reserve
 * - WITHDRAWN: lot pulled from the session
 *
 * @author Jewelry Auction Team
 */
public class LotClosedEvent {

    private String sessionItemId;
    private String sessionId;
    private Integer lotNumber;
    private String outcome;
    private String winnerId;
    private BigDecimal hammerPrice;
    private Instant timestamp;

    public LotClosedEvent() {
    }

    public LotClosedEvent(
            String sessionItemId,
            String sessionId,
            Integer lotNumber,
            String outcome,
            String winnerId,
            BigDecimal hammerPrice
    ) {
        this.sessionItemId = sessionItemId;
        this.sessionId = sessionId;
        this.lotNumber = lotNumber;
        this.outcome = outcome;
        this.winnerId = winnerId;
        this.hammerPrice = hammerPrice;
        this.timestamp = Instant.now();
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

    public Integer getLotNumber() {
        return lotNumber;
    }

    public void setLotNumber(Integer lotNumber) {
        this.lotNumber = lotNumber;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public void setWinnerId(String winnerId) {
        this.winnerId = winnerId;
    }

    public BigDecimal getHammerPrice() {
        return hammerPrice;
    }

    public void setHammerPrice(BigDecimal hammerPrice) {
        this.hammerPrice = hammerPrice;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
