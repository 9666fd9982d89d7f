package com.cred.freestyle.jewelryauction.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * CloudWatch metrics service for monitoring and observability.
 * Publishes custom metrics to AWS CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Bid acceptance and rejection rates, bid latency
 * - Lot outcomes (sold, unsold, withdrawn)
 * - Settlement volume and hammer totals
 * - Payment, payout and refund outcomes
 * - Sell-request workflow transitions
 * - Error rates
 *
 * @author Jewelry Auction Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "auction.";
    private static final String BID_PREFIX = METRIC_PREFIX + "bid.";
    private static final String LOT_PREFIX = METRIC_PREFIX + "lot.";
    private static final String SETTLEMENT_PREFIX = METRIC_PREFIX + "settlement.";
    private static final String PAYMENT_PREFIX = METRIC_PREFIX + "payment.";

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record an accepted bid.
     *
     * @param sessionId Session ID
     */
    public void recordBidAccepted(String sessionId) {
        Counter.builder(BID_PREFIX + "accepted")
                .tag("session_id", sessionId)
                .description("Accepted bids")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded bid accepted for session: {}", sessionId);
    }

    /**
     * Record a rejected bid.
     *
     * @param reason Error code (e.g., "INSUFFICIENT_BID", "AUCTION_NOT_OPEN")
     */
    public void recordBidRejected(String reason) {
        Counter.builder(BID_PREFIX + "rejected")
                .tag("reason", reason)
                .description("Rejected bids")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded bid rejected, reason: {}", reason);
    }

    /**
     * Record bid placement latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordBidLatency(long durationMs) {
        Timer.builder(BID_PREFIX + "latency")
                .description("Bid placement latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record an anti-sniping extension of a session's end time.
     *
     * @param sessionId Session ID
     */
    public void recordSessionExtended(String sessionId) {
        Counter.builder(METRIC_PREFIX + "session.extended")
                .tag("session_id", sessionId)
                .description("Anti-sniping session extensions")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a lot closing.
     *
     * @param outcome Final lot status (SOLD, UNSOLD, WITHDRAWN)
     */
    public void recordLotClosed(String outcome) {
        Counter.builder(LOT_PREFIX + "closed")
                .tag("outcome", outcome)
                .description("Closed lots by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded lot closed with outcome: {}", outcome);
    }

    /**
     * Record a settled lot and its hammer price.
     *
     * @param hammerPrice Winning bid amount
     */
    public void recordSettlement(BigDecimal hammerPrice) {
        Counter.builder(SETTLEMENT_PREFIX + "created")
                .description("Settled lots")
                .register(meterRegistry)
                .increment();

        Counter.builder(SETTLEMENT_PREFIX + "hammer.total")
                .description("Sum of hammer prices of settled lots")
                .register(meterRegistry)
                .increment(hammerPrice.doubleValue());
        logger.debug("Recorded settlement, hammer price: {}", hammerPrice);
    }

    /**
     * Record the outcome of a gateway dispatch.
     *
     * @param kind PAYMENT, PAYOUT or REFUND
     * @param outcome COMPLETED or FAILED
     */
    public void recordPaymentOutcome(String kind, String outcome) {
        Counter.builder(PAYMENT_PREFIX + "outcome")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .description("Gateway dispatch outcomes")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded {} outcome: {}", kind, outcome);
    }

    /**
     * Record gateway call latency.
     *
     * @param kind PAYMENT, PAYOUT or REFUND
     * @param durationMs Duration in milliseconds
     */
    public void recordGatewayLatency(String kind, long durationMs) {
        Timer.builder(PAYMENT_PREFIX + "gateway.latency")
                .tag("kind", kind)
                .description("Payment gateway latency")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a sell-request workflow transition.
     *
     * @param status Status the request moved to
     */
    public void recordSellRequestTransition(String status) {
        Counter.builder(METRIC_PREFIX + "sell_request.transition")
                .tag("status", status)
                .description("Sell request status transitions")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR", "GATEWAY_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }

    /**
     * Record a request rejected by the rate limiter.
     *
     * @param tier User tier
     */
    public void recordRateLimited(String tier) {
        Counter.builder(METRIC_PREFIX + "rate_limit.rejected")
                .tag("tier", tier)
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a notification delivered to a user's inbox.
     *
     * @param type Notification type (e.g., "OUTBID", "PAYMENT_DUE")
     */
    public void recordNotificationDelivered(String type) {
        Counter.builder(METRIC_PREFIX + "notification.delivered")
                .tag("type", type)
                .description("Notifications delivered to user inboxes")
                .register(meterRegistry)
                .increment();
    }
}
