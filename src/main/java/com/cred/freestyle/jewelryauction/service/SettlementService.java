package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.SettlementEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Settles SOLD lots into a buyer payment and a seller payout. Idempotent per lot.
 *
 * Runs outside a transaction so that a duplicate-key failure in the recording
 * transaction can be answered by reading the records the concurrent winner committed.
 *
 * @author Jewelry Auction Team
 */
@Service
public class SettlementService {

    private static final Logger logger = LoggerFactory.getLogger(SettlementService.class);

    private final SettlementRecorder settlementRecorder;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public SettlementService(
            SettlementRecorder settlementRecorder,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.settlementRecorder = settlementRecorder;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Settle a lot on behalf of a staff member.
     */
    public SettlementResult settle(String sessionItemId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Settle lot");
        return settleLot(sessionItemId);
    }

    /**
     * Settle a lot. Used after a lot or session close has committed.
     *
     * @param sessionItemId SOLD lot
     * @return Payment, payout and charges; existing records when already settled
     * @throws ConcurrencyException if the duplicate-key loser cannot find the winner's records
     */
    public SettlementResult settleLot(String sessionItemId) {
        SettlementResult result;
        try {
            result = settlementRecorder.record(sessionItemId);
        } catch (DataIntegrityViolationException e) {
            logger.info("Concurrent settlement of lot {} detected, reading existing records", sessionItemId);
            result = settlementRecorder.findExisting(sessionItemId)
                    .orElseThrow(() -> new ConcurrencyException(
                            "Settlement of lot " + sessionItemId + " conflicted, please retry", e));
        }

        if (result.isCreated()) {
            kafkaProducerService.publishSettlementCreated(new SettlementEvent(
                    sessionItemId,
                    result.getPayment().getPaymentId(),
                    result.getPayout().getPayoutId(),
                    result.getPayment().getBuyerId(),
                    result.getPayout().getSellerId(),
                    result.getCharges().getHammerPrice(),
                    result.getPayment().getAmount(),
                    result.getPayout().getAmount()
            ));
            metricsService.recordSettlement(result.getCharges().getHammerPrice());
        }
        return result;
    }
}
