package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.repository.BidRepository;
import com.cred.freestyle.jewelryauction.repository.JewelryItemRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides the outcome of a lot and records it.
 *
 * Callers must hold the write lock on the lot row and run inside a transaction.
 * A lot is SOLD when it has a WINNING bid that meets the reserve, otherwise UNSOLD.
 *
 * @author Jewelry Auction Team
 */
@Component
public class LotCloser {

    private static final Logger logger = LoggerFactory.getLogger(LotCloser.class);

    private final SessionItemRepository sessionItemRepository;
    private final BidRepository bidRepository;
    private final JewelryItemRepository jewelryItemRepository;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public LotCloser(
            SessionItemRepository sessionItemRepository,
            BidRepository bidRepository,
            JewelryItemRepository jewelryItemRepository,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.sessionItemRepository = sessionItemRepository;
        this.bidRepository = bidRepository;
        this.jewelryItemRepository = jewelryItemRepository;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Close an open lot.
     *
     * @param item Locked lot in PENDING or ACTIVE status
     * @param now Close time
     * @return The lot, now SOLD or UNSOLD
     */
    public SessionItem close(SessionItem item, Instant now) {
        if (!item.getStatus().isOpen()) {
            throw new InvalidStateTransitionException("SessionItem", item.getSessionItemId(),
                    item.getStatus(), "PENDING or ACTIVE");
        }

        Optional<Bid> winningBid = bidRepository.findBySessionItemIdAndStatus(
                item.getSessionItemId(), BidStatus.WINNING);

        boolean sold = winningBid.isPresent() && item.meetsReserve(winningBid.get().getAmount());
        JewelryItem jewelry = jewelryItemRepository.findById(item.getJewelryItemId())
                .orElseThrow(() -> new ResourceNotFoundException("JewelryItem", item.getJewelryItemId()));

        if (sold) {
            item.setStatus(SessionItemStatus.SOLD);
            jewelry.moveTo(JewelryStatus.SOLD);
        } else {
            item.setStatus(SessionItemStatus.UNSOLD);
            jewelry.moveTo(JewelryStatus.UNSOLD);
        }
        item.setClosedAt(now);
        jewelryItemRepository.save(jewelry);
        SessionItem saved = sessionItemRepository.save(item);

        if (sold) {
            logger.info("Lot {} (#{}) SOLD to {} at {}", saved.getSessionItemId(), saved.getLotNumber(),
                    winningBid.get().getBidderId(), winningBid.get().getAmount());
        } else {
            logger.info("Lot {} (#{}) UNSOLD, highest bid {} against reserve {}", saved.getSessionItemId(),
                    saved.getLotNumber(), saved.getCurrentHighestBid(), saved.getReservePrice());
        }

        kafkaProducerService.publishLotClosed(new LotClosedEvent(
                saved.getSessionItemId(),
                saved.getSessionId(),
                saved.getLotNumber(),
                saved.getStatus().name(),
                sold ? winningBid.get().getBidderId() : null,
                sold ? winningBid.get().getAmount() : null
        ));
        metricsService.recordLotClosed(saved.getStatus().name());
        return saved;
    }
}
