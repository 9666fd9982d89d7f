package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment.EnrollmentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.AuctionException;
import com.cred.freestyle.jewelryauction.exception.AuctionNotOpenException;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.exception.InsufficientBidException;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.exception.ItemNotAvailableException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.UserNotEnrolledException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.BidPlacedEvent;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.BidRepository;
import com.cred.freestyle.jewelryauction.repository.EnrollmentRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Bidding engine.
 *
 * Bid admission is serialized per lot: the transaction takes a write lock on the lot row
 * and only then reads the session, so a concurrent pause or close either commits first
 * (and the bid sees the new status) or waits for the bid to commit. The unique
 * {@code winning_lot_id} column is the last line: a second concurrent winner fails the
 * insert and surfaces as a retryable {@link ConcurrencyException}.
 *
 * @author Jewelry Auction Team
 */
@Service
public class BiddingService {

    private static final Logger logger = LoggerFactory.getLogger(BiddingService.class);

    private final SessionItemRepository sessionItemRepository;
    private final AuctionSessionRepository sessionRepository;
    private final BidRepository bidRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final LotCloser lotCloser;
    private final Pagination pagination;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;

    public BiddingService(
            SessionItemRepository sessionItemRepository,
            AuctionSessionRepository sessionRepository,
            BidRepository bidRepository,
            EnrollmentRepository enrollmentRepository,
            LotCloser lotCloser,
            Pagination pagination,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService
    ) {
        this.sessionItemRepository = sessionItemRepository;
        this.sessionRepository = sessionRepository;
        this.bidRepository = bidRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.lotCloser = lotCloser;
        this.pagination = pagination;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Place a bid on a lot.
     *
     * Checks, in order: session open and not past its end, lot ACTIVE, bidder enrolled
     * (when the session requires registration), amount at least the current price plus the
     * increment. The reserve never blocks a bid.
     *
     * @param sessionItemId Lot ID
     * @param actor Bidder
     * @param amount Offered amount
     * @param idempotencyKey Optional client key; a repeat returns the original bid
     * @return The WINNING bid
     * @throws AuctionNotOpenException if the session is not accepting bids
     * @throws ItemNotAvailableException if the lot is not ACTIVE
     * @throws UserNotEnrolledException if the bidder has no approved enrollment
     * @throws InsufficientBidException if the amount is below the minimum
     * @throws ConcurrencyException if a concurrent bid won the race
     */
    @Transactional
    public Bid placeBid(String sessionItemId, AuthenticatedUser actor, BigDecimal amount, String idempotencyKey) {
        long startTime = System.currentTimeMillis();

        try {
            AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Place bid");
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException("amount", "Bid amount must be positive");
            }
            String bidderId = actor.getUserId();

            // Step 1: Lock the lot row; everything below is serialized per lot
            SessionItem item = sessionItemRepository.findByIdWithLock(sessionItemId)
                    .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));

            // Step 2: Idempotent replay
            if (idempotencyKey != null && !idempotencyKey.isBlank()) {
                Optional<Bid> replay = bidRepository.findBySessionItemIdAndBidderIdAndIdempotencyKey(
                        sessionItemId, bidderId, idempotencyKey);
                if (replay.isPresent()) {
                    logger.info("Replaying bid {} for idempotency key {} on lot {}",
                            replay.get().getBidId(), idempotencyKey, sessionItemId);
                    return replay.get();
                }
            }

            // Step 3: Session status, read under the lot lock
            AuctionSession session = sessionRepository.findById(item.getSessionId())
                    .orElseThrow(() -> new ResourceNotFoundException("AuctionSession", item.getSessionId()));
            Instant now = Instant.now();
            if (!session.isAcceptingBids(now)) {
                String reason = session.getStatus() == SessionStatus.OPEN
                        ? "bidding ended at " + session.getEndAt()
                        : "session is " + session.getStatus();
                throw new AuctionNotOpenException(session.getSessionId(), reason);
            }

            // Step 4: Lot status
            if (item.getStatus() != SessionItemStatus.ACTIVE) {
                throw new ItemNotAvailableException(sessionItemId, item.getStatus());
            }

            // Step 5: Enrollment
            if (Boolean.TRUE.equals(session.getRegistrationRequired())
                    && !enrollmentRepository.existsByUserIdAndSessionIdAndStatus(
                            bidderId, session.getSessionId(), EnrollmentStatus.APPROVED)) {
                throw new UserNotEnrolledException(bidderId, session.getSessionId());
            }

            // Step 6: Minimum amount
            BigDecimal floor = item.currentFloor();
            BigDecimal minimum = floor.add(session.getBidIncrementPolicy().increment(floor, item.getStepPrice()));
            if (amount.compareTo(minimum) < 0) {
                throw new InsufficientBidException(amount, minimum);
            }

            // Step 7: Demote the previous winner, then store the new winner
            String previousWinnerId = null;
            Optional<Bid> previous = bidRepository.findBySessionItemIdAndStatus(sessionItemId, BidStatus.WINNING);
            if (previous.isPresent()) {
                Bid outbid = previous.get();
                previousWinnerId = outbid.getBidderId();
                outbid.markOutbid();
                bidRepository.saveAndFlush(outbid);
            }

            Bid bid = Bid.builder()
                    .bidId(UUID.randomUUID().toString())
                    .sessionItemId(sessionItemId)
                    .sessionId(session.getSessionId())
                    .bidderId(bidderId)
                    .amount(amount)
                    .idempotencyKey(idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey)
                    .build();
            bid.markWinning();

            try {
                bid = bidRepository.saveAndFlush(bid);
            } catch (DataIntegrityViolationException e) {
                throw new ConcurrencyException("Another bid on lot " + sessionItemId + " was accepted first, please retry", e);
            }

            item.recordWinningBid(bid);
            sessionItemRepository.save(item);

            // Step 8: Anti-sniping
            Instant endAt = session.getEndAt();
            if (Boolean.TRUE.equals(session.getAntiSnipingEnabled())
                    && !now.plusSeconds(session.getAntiSnipingTriggerSeconds()).isBefore(endAt)) {
                Instant newEndAt = now.plusSeconds(session.getAntiSnipingExtensionSeconds());
                if (sessionRepository.extendEndAt(session.getSessionId(), SessionStatus.OPEN, newEndAt, now) > 0) {
                    endAt = newEndAt;
                    logger.info("Anti-sniping: session {} end extended to {} after bid on lot {}",
                            session.getSessionId(), newEndAt, sessionItemId);
                    metricsService.recordSessionExtended(session.getSessionId());
                }
            }

            logger.info("Bid {} accepted on lot {}: {} by {} (previous winner {})",
                    bid.getBidId(), sessionItemId, amount, bidderId, previousWinnerId);

            // Step 9: Publish and record
            kafkaProducerService.publishBidPlaced(new BidPlacedEvent(
                    bid.getBidId(),
                    sessionItemId,
                    session.getSessionId(),
                    bidderId,
                    amount,
                    previousWinnerId,
                    endAt
            ));
            metricsService.recordBidAccepted(session.getSessionId());
            metricsService.recordBidLatency(System.currentTimeMillis() - startTime);
            return bid;

        } catch (AuctionException e) {
            logger.warn("Bid rejected on lot {}: {}", sessionItemId, e.getMessage());
            metricsService.recordBidRejected(e.getCode());
            throw e;
        }
    }

    /**
     * @return the lot's WINNING bid, if any
     */
    @Transactional(readOnly = true)
    public Optional<Bid> getCurrentWinner(String sessionItemId) {
        requireItem(sessionItemId);
        return bidRepository.findBySessionItemIdAndStatus(sessionItemId, BidStatus.WINNING);
    }

    /**
     * @return the committed highest amount on the lot, or null when nobody has bid
     */
    @Transactional(readOnly = true)
    public BigDecimal getHighestAmount(String sessionItemId) {
        return requireItem(sessionItemId).getCurrentHighestBid();
    }

    /**
     * Close a single ACTIVE lot. Settlement of a SOLD lot happens after this commits.
     */
    @Transactional
    public SessionItem closeItem(String sessionItemId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Close lot");

        SessionItem item = sessionItemRepository.findByIdWithLock(sessionItemId)
                .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));
        if (item.getStatus() != SessionItemStatus.ACTIVE) {
            throw new InvalidStateTransitionException("SessionItem", sessionItemId, item.getStatus(),
                    SessionItemStatus.ACTIVE);
        }

        SessionItem closed = lotCloser.close(item, Instant.now());
        logger.info("Lot {} closed by {} as {}", sessionItemId, actor.getUserId(), closed.getStatus());
        return closed;
    }

    /**
     * Bid history of a lot, highest first.
     */
    @Transactional(readOnly = true)
    public Page<Bid> bidsForLot(String sessionItemId, Integer page, Integer size) {
        requireItem(sessionItemId);
        return bidRepository.findBySessionItemIdOrderByAmountDescCreatedAtAsc(
                sessionItemId, pagination.unsorted(page, size));
    }

    /**
     * The caller's own bids, newest first.
     */
    @Transactional(readOnly = true)
    public Page<Bid> bidsByBidder(AuthenticatedUser actor, Integer page, Integer size) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "List bids");
        return bidRepository.findByBidderIdOrderByCreatedAtDesc(actor.getUserId(), pagination.unsorted(page, size));
    }

    private SessionItem requireItem(String sessionItemId) {
        return sessionItemRepository.findById(sessionItemId)
                .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));
    }
}
