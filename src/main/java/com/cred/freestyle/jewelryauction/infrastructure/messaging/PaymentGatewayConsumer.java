package com.cred.freestyle.jewelryauction.infrastructure.messaging;

import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.PaymentDispatchMessage;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.service.PaymentDispatchService;
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

/**
 * Kafka consumer executing payment, payout and refund dispatches.
 *
 * Messages are keyed by the payment/payout/refund ID, so every dispatch of one record lands
 * on the same partition and is handled sequentially. A failing record is logged and
 * skipped so the rest of the batch still goes through; the record keeps its status.
 *
 * @author Jewelry Auction Team
 */
@Service
public class PaymentGatewayConsumer {

    private static final Logger logger = LoggerFactory.getLogger(PaymentGatewayConsumer.class);

    private final PaymentDispatchService paymentDispatchService;
    private final CloudWatchMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public PaymentGatewayConsumer(
            PaymentDispatchService paymentDispatchService,
            CloudWatchMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.paymentDispatchService = paymentDispatchService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    /**
     * Batch listener for dispatch messages.
     *
     * @param records Batch of consumer records
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = "${auction.kafka.topics.payment-dispatch:auction-payment-dispatch}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeDispatches(
            List<ConsumerRecord<String, String>> records,
            Acknowledgment acknowledgment
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
        logger.info("Processing {} dispatch messages from partition {}", records.size(), partition);

        for (PaymentDispatchMessage message : parseMessages(records)) {
            try {
                paymentDispatchService.dispatch(message);
            } catch (Exception e) {
                logger.error("Error processing {} dispatch for {}", message.getKind(), message.getReferenceId(), e);
                metricsService.recordError("DISPATCH_PROCESSING_ERROR", "consumeDispatches");
                // Continue with the rest of the batch
            }
        }

        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
        logger.info("Completed dispatch batch: partition={}, size={}, duration={}ms",
                partition, records.size(), System.currentTimeMillis() - batchStartTime);
    }

    private List<PaymentDispatchMessage> parseMessages(List<ConsumerRecord<String, String>> records) {
        List<PaymentDispatchMessage> messages = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            try {
                messages.add(objectMapper.readValue(record.value(), PaymentDispatchMessage.class));
            } catch (JsonProcessingException e) {
                logger.error("Failed to parse dispatch message at partition {}, offset {}",
                        record.partition(), record.offset(), e);
                metricsService.recordError("MESSAGE_PARSE_ERROR", "parseMessages");
            }
        }
        return messages;
    }
}
