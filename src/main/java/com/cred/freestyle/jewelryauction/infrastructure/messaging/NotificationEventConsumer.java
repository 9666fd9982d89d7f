package com.cred.freestyle.jewelryauction.infrastructure.messaging;

import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.BidPlacedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.SettlementEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.service.NotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Kafka consumer feeding user inboxes from bid, lot and settlement events.
 *
 * Runs in its own consumer group so notifications never hold back payment dispatch.
 * Delivery is idempotent per (recipient, type, reference), so a redelivered batch is harmless.
 *
 * @author Jewelry Auction Team
 */
@Service
public class NotificationEventConsumer {

    private static final Logger logger = LoggerFactory.getLogger(NotificationEventConsumer.class);

    private final NotificationService notificationService;
    private final CloudWatchMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public NotificationEventConsumer(
            NotificationService notificationService,
            CloudWatchMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.notificationService = notificationService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(
            topics = "${auction.kafka.topics.bid-events:auction-bid-events}",
            groupId = "${auction.kafka.notifications.group-id:jewelry-auction-notifications}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeBidEvents(List<ConsumerRecord<String, String>> records, Acknowledgment acknowledgment) {
        consume(records, acknowledgment, BidPlacedEvent.class, notificationService::onBidPlaced);
    }

    @KafkaListener(
            topics = "${auction.kafka.topics.lot-events:auction-lot-events}",
            groupId = "${auction.kafka.notifications.group-id:jewelry-auction-notifications}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeLotEvents(List<ConsumerRecord<String, String>> records, Acknowledgment acknowledgment) {
        consume(records, acknowledgment, LotClosedEvent.class, notificationService::onLotClosed);
    }

    @KafkaListener(
            topics = "${auction.kafka.topics.settlement-events:auction-settlement-events}",
            groupId = "${auction.kafka.notifications.group-id:jewelry-auction-notifications}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeSettlementEvents(List<ConsumerRecord<String, String>> records, Acknowledgment acknowledgment) {
        consume(records, acknowledgment, SettlementEvent.class, notificationService::onSettlementCreated);
    }

    private <E> void consume(
            List<ConsumerRecord<String, String>> records,
            Acknowledgment acknowledgment,
            Class<E> eventType,
            ToIntFunction<E> handler
    ) {
        if (records == null || records.isEmpty()) {
            logger.debug("Received empty batch, skipping processing");
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
            return;
        }

        long batchStartTime = System.currentTimeMillis();
        int partition = records.get(0).partition();
        String eventName = eventType.getSimpleName();
        int delivered = 0;

        for (E event : parseEvents(records, eventType)) {
            try {
                delivered += handler.applyAsInt(event);
            } catch (Exception e) {
                logger.error("Error creating notifications from {}", eventName, e);
                metricsService.recordError("NOTIFICATION_PROCESSING_ERROR", "consume" + eventName);
                // Continue with the rest of the batch
            }
        }

        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
        logger.info("Completed {} batch: partition={}, size={}, delivered={}, duration={}ms",
                eventName, partition, records.size(), delivered, System.currentTimeMillis() - batchStartTime);
    }

    private <E> List<E> parseEvents(List<ConsumerRecord<String, String>> records, Class<E> eventType) {
        List<E> events = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            try {
                events.add(objectMapper.readValue(record.value(), eventType));
            } catch (JsonProcessingException e) {
                logger.error("Failed to parse {} at partition {}, offset {}",
                        eventType.getSimpleName(), record.partition(), record.offset(), e);
                metricsService.recordError("MESSAGE_PARSE_ERROR", "parseEvents");
            }
        }
        return events;
    }
}
