package com.cred.freestyle.jewelryauction.infrastructure.messaging;

import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.BidPlacedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.SettlementEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for auction events and payment dispatch requests.
 *
 * Topic partitioning strategy:
 * - Bid and lot events are keyed by lot ID, so the events of one lot stay ordered
 * - Settlement events are keyed by lot ID
 * - Dispatch messages are keyed by the payment/payout/refund ID
 *
 * Event publication is fire-and-forget: a failed send is logged, it never rolls back
 * the state change that produced it. Dispatch messages are the exception; their send
 * failure is reported to the caller so the record can be put back.
 *
 * @author Jewelry Auction Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    private final String bidTopic;
    private final String lotTopic;
    private final String settlementTopic;
    private final String paymentDispatchTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${auction.kafka.topics.bid-events:auction-bid-events}") String bidTopic,
            @Value("${auction.kafka.topics.lot-events:auction-lot-events}") String lotTopic,
            @Value("${auction.kafka.topics.settlement-events:auction-settlement-events}") String settlementTopic,
            @Value("${auction.kafka.topics.payment-dispatch:auction-payment-dispatch}") String paymentDispatchTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.bidTopic = bidTopic;
        this.lotTopic = lotTopic;
        this.settlementTopic = settlementTopic;
        this.paymentDispatchTopic = paymentDispatchTopic;
    }

    /**
     * Publish bid placed event.
     *
     * @param event Bid event
     */
    public void publishBidPlaced(BidPlacedEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    bidTopic,
                    event.getSessionItemId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published bid placed event for bid {}, lot: {}, partition: {}",
                            event.getBidId(), event.getSessionItemId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish bid placed event for bid {}, lot: {}",
                            event.getBidId(), event.getSessionItemId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing bid placed event for bid {}", event.getBidId(), e);
        }
    }

    /**
     * Publish lot closed event (sold, unsold or withdrawn).
     *
     * @param event Lot event
     */
    public void publishLotClosed(LotClosedEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    lotTopic,
                    event.getSessionItemId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published lot closed event for lot {}, outcome: {}",
                            event.getSessionItemId(), event.getOutcome());
                } else {
                    logger.error("Failed to publish lot closed event for lot {}",
                            event.getSessionItemId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing lot closed event for lot {}", event.getSessionItemId(), e);
        }
    }

    /**
     * Publish settlement created event.
     *
     * @param event Settlement event
     */
    public void publishSettlementCreated(SettlementEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    settlementTopic,
                    event.getSessionItemId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published settlement event for lot {}, payment: {}, payout: {}",
                            event.getSessionItemId(), event.getPaymentId(), event.getPayoutId());
                } else {
                    logger.error("Failed to publish settlement event for lot {}",
                            event.getSessionItemId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing settlement event for lot {}", event.getSessionItemId(), e);
        }
    }

    /**
     * Publish a payment dispatch request for the gateway consumer.
     *
     * @param message Dispatch message
     * @return Future completing when the broker acknowledged the message
     * @throws IllegalStateException if the message cannot be serialized
     */
    public CompletableFuture<SendResult<String, String>> publishPaymentDispatch(PaymentDispatchMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing dispatch message for {} {}", message.getKind(), message.getReferenceId(), e);
            throw new IllegalStateException("Cannot serialize dispatch message", e);
        }

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                paymentDispatchTopic,
                message.getReferenceId(),
                payload
        );

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Published {} dispatch for {}, partition: {}",
                        message.getKind(), message.getReferenceId(), result.getRecordMetadata().partition());
            } else {
                logger.error("Failed to publish {} dispatch for {}",
                        message.getKind(), message.getReferenceId(), ex);
            }
        });
        return future;
    }
}
