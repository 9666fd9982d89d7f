package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.api.dto.AddSessionItemRequest;
import com.cred.freestyle.jewelryauction.api.dto.CreateSessionRequest;
import com.cred.freestyle.jewelryauction.api.dto.SettlementSummaryResponse;
import com.cred.freestyle.jewelryauction.api.dto.UpdateSessionRequest;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.BidIncrementPolicy;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payment;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.jewelryauction.infrastructure.messaging.events.LotClosedEvent;
import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.JewelryItemRepository;
import com.cred.freestyle.jewelryauction.repository.PaymentRepository;
import com.cred.freestyle.jewelryauction.repository.PayoutRepository;
import com.cred.freestyle.jewelryauction.repository.SellRequestRepository;
import com.cred.freestyle.jewelryauction.repository.SessionItemRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Service for assembling auction sessions and driving their lifecycle.
 *
 * Locking order: any operation that needs both the lots and the session locks the lots
 * first (in lot order) and the session second, and validates the session only once it
 * holds the session lock. Bid placement locks a lot and then updates the session row for
 * anti-sniping, so taking the locks in the same order keeps the two paths from
 * deadlocking. Lot numbering only locks the session row.
 *
 * @author Jewelry Auction Team
 */
@Service
public class AuctionSessionService {

    private static final Logger logger = LoggerFactory.getLogger(AuctionSessionService.class);

    private final AuctionSessionRepository sessionRepository;
    private final SessionItemRepository sessionItemRepository;
    private final SellRequestRepository sellRequestRepository;
    private final JewelryItemRepository jewelryItemRepository;
    private final PaymentRepository paymentRepository;
    private final PayoutRepository payoutRepository;
    private final LotCloser lotCloser;
    private final CodeGenerator codeGenerator;
    private final Pagination pagination;
    private final KafkaProducerService kafkaProducerService;

    private final int defaultTriggerSeconds;
    private final int defaultExtensionSeconds;

    public AuctionSessionService(
            AuctionSessionRepository sessionRepository,
            SessionItemRepository sessionItemRepository,
            SellRequestRepository sellRequestRepository,
            JewelryItemRepository jewelryItemRepository,
            PaymentRepository paymentRepository,
            PayoutRepository payoutRepository,
            LotCloser lotCloser,
            CodeGenerator codeGenerator,
            Pagination pagination,
            KafkaProducerService kafkaProducerService,
            @Value("${auction.anti-sniping.trigger-seconds:60}") int defaultTriggerSeconds,
            @Value("${auction.anti-sniping.extension-seconds:300}") int defaultExtensionSeconds
    ) {
        this.sessionRepository = sessionRepository;
        this.sessionItemRepository = sessionItemRepository;
        this.sellRequestRepository = sellRequestRepository;
        this.jewelryItemRepository = jewelryItemRepository;
        this.paymentRepository = paymentRepository;
        this.payoutRepository = payoutRepository;
        this.lotCloser = lotCloser;
        this.codeGenerator = codeGenerator;
        this.pagination = pagination;
        this.kafkaProducerService = kafkaProducerService;
        this.defaultTriggerSeconds = defaultTriggerSeconds;
        this.defaultExtensionSeconds = defaultExtensionSeconds;
    }

    // ========================================
    // Assembly
    // ========================================

    /**
     * Create a session in DRAFT.
     *
     * @throws ValidationException if the name is missing or the end is not after the start
     */
    @Transactional
    public AuctionSession create(AuthenticatedUser actor, CreateSessionRequest request) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Create auction session");
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("name", "Session name is required");
        }
        validateWindow(request.getStartAt(), request.getEndAt());

        AuctionSession session = AuctionSession.builder()
                .code(codeGenerator.nextSessionCode())
                .name(request.getName().trim())
                .description(request.getDescription())
                .startAt(request.getStartAt())
                .endAt(request.getEndAt())
                .status(SessionStatus.DRAFT)
                .assignedStaffId(request.getAssignedStaffId())
                .createdBy(actor.getUserId())
                .bidIncrementPolicy(request.getBidIncrementPolicy() != null
                        ? request.getBidIncrementPolicy() : BidIncrementPolicy.FIXED)
                .registrationRequired(request.getRegistrationRequired() != null
                        ? request.getRegistrationRequired() : Boolean.TRUE)
                .antiSnipingEnabled(request.getAntiSnipingEnabled() != null
                        ? request.getAntiSnipingEnabled() : Boolean.TRUE)
                .antiSnipingTriggerSeconds(request.getAntiSnipingTriggerSeconds() != null
                        ? request.getAntiSnipingTriggerSeconds() : defaultTriggerSeconds)
                .antiSnipingExtensionSeconds(request.getAntiSnipingExtensionSeconds() != null
                        ? request.getAntiSnipingExtensionSeconds() : defaultExtensionSeconds)
                .build();

        session = sessionRepository.save(session);
        logger.info("Created auction session {} ({}) by {}", session.getSessionId(), session.getCode(), actor.getUserId());
        return session;
    }

    /**
     * Update a session's details and rule set while it is still DRAFT or SCHEDULED.
     */
    @Transactional
    public AuctionSession update(String sessionId, AuthenticatedUser actor, UpdateSessionRequest request) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Update auction session");
        AuctionSession session = lockSession(sessionId);
        requireEditable(session);

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException("name", "Session name must not be blank");
            }
            session.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            session.setDescription(request.getDescription());
        }

        Instant startAt = request.getStartAt() != null ? request.getStartAt() : session.getStartAt();
        Instant endAt = request.getEndAt() != null ? request.getEndAt() : session.getEndAt();
        validateWindow(startAt, endAt);
        if (session.getStatus() == SessionStatus.SCHEDULED && !startAt.isAfter(Instant.now())) {
            throw new ValidationException("startAt", "A scheduled session must start in the future");
        }
        session.setStartAt(startAt);
        session.setEndAt(endAt);

        if (request.getAssignedStaffId() != null) {
            session.setAssignedStaffId(request.getAssignedStaffId());
        }
        if (request.getBidIncrementPolicy() != null) {
            session.setBidIncrementPolicy(request.getBidIncrementPolicy());
        }
        if (request.getRegistrationRequired() != null) {
            session.setRegistrationRequired(request.getRegistrationRequired());
        }
        if (request.getAntiSnipingEnabled() != null) {
            session.setAntiSnipingEnabled(request.getAntiSnipingEnabled());
        }
        if (request.getAntiSnipingTriggerSeconds() != null) {
            session.setAntiSnipingTriggerSeconds(request.getAntiSnipingTriggerSeconds());
        }
        if (request.getAntiSnipingExtensionSeconds() != null) {
            session.setAntiSnipingExtensionSeconds(request.getAntiSnipingExtensionSeconds());
        }

        session = sessionRepository.save(session);
        logger.info("Updated auction session {} by {}", sessionId, actor.getUserId());
        return session;
    }

    /**
     * Place an approved sell request into a session as the next lot.
     *
     * The session row is write-locked while the lot number is computed; the unique
     * (session_id, lot_number) constraint backs it up.
     *
     * @return The new PENDING lot
     */
    @Transactional
    public SessionItem addItem(String sessionId, AuthenticatedUser actor, AddSessionItemRequest request) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Add item to session");
        validatePricing(request);

        // Step 1: Lock the session and check it can still take lots
        AuctionSession session = lockSession(sessionId);
        requireEditable(session);

        // Step 2: Lock the sell request and mark it assigned (validates MANAGER_APPROVED / SELLER_ACCEPTED)
        SellRequest sellRequest = sellRequestRepository.findByIdWithLock(request.getSellRequestId())
                .orElseThrow(() -> new ResourceNotFoundException("SellRequest", request.getSellRequestId()));
        Instant now = Instant.now();
        sellRequest.assignToSession(now);

        JewelryItem jewelry = jewelryItemRepository.findById(sellRequest.getJewelryItemId())
                .orElseThrow(() -> new ResourceNotFoundException("JewelryItem", sellRequest.getJewelryItemId()));

        // Step 3: Next lot number under the session lock
        int lotNumber = sessionItemRepository.findMaxLotNumber(sessionId) + 1;

        SessionItem item = SessionItem.builder()
                .sessionId(sessionId)
                .jewelryItemId(jewelry.getJewelryItemId())
                .sellRequestId(sellRequest.getSellRequestId())
                .sellerId(sellRequest.getSellerId())
                .lotNumber(lotNumber)
                .startPrice(request.getStartPrice())
                .stepPrice(request.getStepPrice())
                .reservePrice(request.getReservePrice() != null ? request.getReservePrice() : jewelry.getReservePrice())
                .status(SessionItemStatus.PENDING)
                .build();

        try {
            item = sessionItemRepository.saveAndFlush(item);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Lot insert conflict in session {} for lot number {}", sessionId, lotNumber);
            throw new ConcurrencyException("Lot could not be added to session " + sessionId + ", please retry", e);
        }

        // Step 4: Update the request and the jewelry
        sellRequestRepository.save(sellRequest);
        jewelry.moveTo(JewelryStatus.IN_AUCTION);
        jewelryItemRepository.save(jewelry);

        logger.info("Added lot #{} ({}) to session {} from sell request {}",
                lotNumber, item.getSessionItemId(), sessionId, sellRequest.getSellRequestId());
        return item;
    }

    /**
     * Withdraw a lot before its session closes. The lot keeps its number.
     */
    @Transactional
    public SessionItem withdrawItem(String sessionItemId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Withdraw lot");

        SessionItem item = sessionItemRepository.findByIdWithLock(sessionItemId)
                .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));
        AuctionSession session = lockSession(item.getSessionId());

        if (!session.getStatus().isBeforeClose()) {
            throw new InvalidStateTransitionException("AuctionSession", session.getSessionId(),
                    session.getStatus(), "DRAFT, SCHEDULED, OPEN or PAUSED");
        }
        if (!item.getStatus().isOpen()) {
            throw new InvalidStateTransitionException("SessionItem", sessionItemId, item.getStatus(), "PENDING or ACTIVE");
        }

        item.setStatus(SessionItemStatus.WITHDRAWN);
        item.setClosedAt(Instant.now());
        item = sessionItemRepository.save(item);
        releaseJewelry(item, JewelryStatus.WITHDRAWN);

        kafkaProducerService.publishLotClosed(new LotClosedEvent(
                item.getSessionItemId(), item.getSessionId(), item.getLotNumber(),
                SessionItemStatus.WITHDRAWN.name(), null, null));
        logger.info("Lot {} (#{}) withdrawn from session {} by {}",
                sessionItemId, item.getLotNumber(), item.getSessionId(), actor.getUserId());
        return item;
    }

    // ========================================
    // Lifecycle
    // ========================================

    /**
     * DRAFT → SCHEDULED. Requires at least one lot that is not withdrawn and a future start.
     */
    @Transactional
    public AuctionSession schedule(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Schedule auction session");
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.SCHEDULED);

        if (sessionItemRepository.countBySessionIdAndStatusNot(sessionId, SessionItemStatus.WITHDRAWN) == 0) {
            throw new BusinessRuleViolationException("Session " + sessionId + " has no lots to auction");
        }
        Instant now = Instant.now();
        if (!session.getStartAt().isAfter(now)) {
            throw new BusinessRuleViolationException("Session " + sessionId + " start time must be in the future");
        }

        session.transitionTo(SessionStatus.SCHEDULED, now);
        session = sessionRepository.save(session);
        logger.info("Session {} scheduled for {} by {}", sessionId, session.getStartAt(), actor.getUserId());
        return session;
    }

    /**
     * SCHEDULED → OPEN (every PENDING lot becomes ACTIVE) or PAUSED → OPEN (resume).
     */
    @Transactional
    public AuctionSession open(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Open auction session");
        List<SessionItem> items = sessionItemRepository.findBySessionIdWithLock(sessionId);
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.OPEN);

        Instant now = Instant.now();
        if (!now.isBefore(session.getEndAt())) {
            throw new BusinessRuleViolationException("Session " + sessionId + " end time has already passed");
        }

        boolean resuming = session.getStatus() == SessionStatus.PAUSED;
        if (!resuming) {
            int activated = 0;
            for (SessionItem item : items) {
                if (item.getStatus() == SessionItemStatus.PENDING) {
                    item.setStatus(SessionItemStatus.ACTIVE);
                    activated++;
                }
            }
            sessionItemRepository.saveAll(items);
            logger.info("Activated {} lots in session {}", activated, sessionId);
        }

        session.transitionTo(SessionStatus.OPEN, now);
        session = sessionRepository.save(session);
        logger.info("Session {} {} by {}", sessionId, resuming ? "resumed" : "opened", actor.getUserId());
        return session;
    }

    /**
     * OPEN → PAUSED. Lots are locked first so in-flight bids finish before the pause commits.
     */
    @Transactional
    public AuctionSession pause(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Pause auction session");
        sessionItemRepository.findBySessionIdWithLock(sessionId);
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.PAUSED);
        session.transitionTo(SessionStatus.PAUSED, Instant.now());
        session = sessionRepository.save(session);
        logger.info("Session {} paused by {}", sessionId, actor.getUserId());
        return session;
    }

    /**
     * OPEN/PAUSED → CLOSED. Every open lot is closed as SOLD or UNSOLD.
     * Settlement of the SOLD lots is left to the caller, after this transaction commits.
     */
    @Transactional
    public AuctionSession close(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Close auction session");
        List<SessionItem> items = sessionItemRepository.findBySessionIdWithLock(sessionId);
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.CLOSED);
        Instant now = Instant.now();
        session.transitionTo(SessionStatus.CLOSED, now);

        int sold = 0;
        for (SessionItem item : items) {
            if (item.getStatus().isOpen()) {
                if (lotCloser.close(item, now).getStatus() == SessionItemStatus.SOLD) {
                    sold++;
                }
            }
        }

        session = sessionRepository.save(session);
        logger.info("Session {} closed by {}: {} lots, {} newly sold", sessionId, actor.getUserId(), items.size(), sold);
        return session;
    }

    /**
     * Any state before CLOSED → CANCELED. Open lots are withdrawn and their jewelry returned.
     */
    @Transactional
    public AuctionSession cancel(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Cancel auction session");
        List<SessionItem> items = sessionItemRepository.findBySessionIdWithLock(sessionId);
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.CANCELED);
        Instant now = Instant.now();
        session.transitionTo(SessionStatus.CANCELED, now);

        for (SessionItem item : items) {
            if (item.getStatus().isOpen()) {
                item.setStatus(SessionItemStatus.WITHDRAWN);
                item.setClosedAt(now);
                sessionItemRepository.save(item);
                releaseJewelry(item, JewelryStatus.RETURNED);
            }
        }

        session = sessionRepository.save(session);
        logger.info("Session {} canceled by {}", sessionId, actor.getUserId());
        return session;
    }

    /**
     * CLOSED → SETTLED. Callers settle every SOLD lot before calling this.
     */
    @Transactional
    public AuctionSession markSettled(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Settle auction session");
        AuctionSession session = lockSession(sessionId);
        requireTransition(session, SessionStatus.SETTLED);

        for (SessionItem item : sessionItemRepository.findBySessionIdAndStatusOrderByLotNumberAsc(
                sessionId, SessionItemStatus.SOLD)) {
            if (!paymentRepository.existsBySessionItemId(item.getSessionItemId())) {
                throw new BusinessRuleViolationException("Lot " + item.getSessionItemId() + " is not settled yet");
            }
        }

        session.transitionTo(SessionStatus.SETTLED, Instant.now());
        session = sessionRepository.save(session);
        logger.info("Session {} settled by {}", sessionId, actor.getUserId());
        return session;
    }

    // ========================================
    // Queries
    // ========================================

    @Transactional(readOnly = true)
    public AuctionSession get(String sessionId) {
        return findSession(sessionId);
    }

    @Transactional(readOnly = true)
    public Page<AuctionSession> list(SessionStatus status, Integer page, Integer size) {
        if (status == null) {
            return sessionRepository.findAll(pagination.of(page, size, Sort.by(Sort.Direction.DESC, "startAt")));
        }
        return sessionRepository.findByStatus(status, pagination.of(page, size, Sort.by(Sort.Direction.DESC, "startAt")));
    }

    @Transactional(readOnly = true)
    public List<SessionItem> listItems(String sessionId) {
        findSession(sessionId);
        return sessionItemRepository.findBySessionIdOrderByLotNumberAsc(sessionId);
    }

    @Transactional(readOnly = true)
    public List<SessionItem> listItems(String sessionId, SessionItemStatus status) {
        findSession(sessionId);
        return sessionItemRepository.findBySessionIdAndStatusOrderByLotNumberAsc(sessionId, status);
    }

    @Transactional(readOnly = true)
    public SessionItem getItem(String sessionItemId) {
        return sessionItemRepository.findById(sessionItemId)
                .orElseThrow(() -> new ResourceNotFoundException("SessionItem", sessionItemId));
    }

    /**
     * Lot counts per outcome and money totals for a session.
     */
    @Transactional(readOnly = true)
    public SettlementSummaryResponse settlementSummary(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "View settlement summary");
        AuctionSession session = findSession(sessionId);
        List<SessionItem> items = sessionItemRepository.findBySessionIdOrderByLotNumberAsc(sessionId);
        List<Payment> payments = paymentRepository.findBySessionId(sessionId);
        List<Payout> payouts = payoutRepository.findBySessionId(sessionId);

        int sold = 0;
        int unsold = 0;
        int withdrawn = 0;
        int open = 0;
        for (SessionItem item : items) {
            switch (item.getStatus()) {
                case SOLD:
                    sold++;
                    break;
                case UNSOLD:
                    unsold++;
                    break;
                case WITHDRAWN:
                    withdrawn++;
                    break;
                default:
                    open++;
                    break;
            }
        }

        BigDecimal totalHammer = BigDecimal.ZERO;
        BigDecimal totalPremium = BigDecimal.ZERO;
        BigDecimal totalPayments = BigDecimal.ZERO;
        int completedPayments = 0;
        for (Payment payment : payments) {
            totalHammer = totalHammer.add(payment.getHammerPrice());
            totalPremium = totalPremium.add(payment.getBuyerPremium());
            totalPayments = totalPayments.add(payment.getAmount());
            if (payment.getStatus() == Payment.PaymentStatus.COMPLETED) {
                completedPayments++;
            }
        }

        BigDecimal totalCommission = BigDecimal.ZERO;
        BigDecimal totalPayouts = BigDecimal.ZERO;
        int completedPayouts = 0;
        for (Payout payout : payouts) {
            totalCommission = totalCommission.add(payout.getSellerCommission());
            totalPayouts = totalPayouts.add(payout.getAmount());
            if (payout.getStatus() == Payout.PayoutStatus.COMPLETED) {
                completedPayouts++;
            }
        }

        return SettlementSummaryResponse.builder()
                .sessionId(sessionId)
                .sessionStatus(session.getStatus().name())
                .totalLots(items.size())
                .soldLots(sold)
                .unsoldLots(unsold)
                .withdrawnLots(withdrawn)
                .openLots(open)
                .totalHammer(totalHammer)
                .totalBuyerPremium(totalPremium)
                .totalSellerCommission(totalCommission)
                .totalPayments(totalPayments)
                .totalPayouts(totalPayouts)
                .completedPayments(completedPayments)
                .completedPayouts(completedPayouts)
                .build();
    }

    // ========================================
    // Helpers
    // ========================================

    private AuctionSession findSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("AuctionSession", sessionId));
    }

    private AuctionSession lockSession(String sessionId) {
        return sessionRepository.findByIdWithLock(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("AuctionSession", sessionId));
    }

    private static void requireEditable(AuctionSession session) {
        if (!session.isEditable()) {
            throw new InvalidStateTransitionException("AuctionSession", session.getSessionId(),
                    session.getStatus(), "DRAFT or SCHEDULED");
        }
    }

    private static void requireTransition(AuctionSession session, SessionStatus next) {
        if (!session.getStatus().canTransitionTo(next)) {
            throw new InvalidStateTransitionException("AuctionSession", session.getSessionId(),
                    session.getStatus(), "one of " + next.allowedPredecessors());
        }
    }

    private static void validateWindow(Instant startAt, Instant endAt) {
        if (startAt == null || endAt == null) {
            throw new ValidationException("startAt", "Start and end time are required");
        }
        if (!endAt.isAfter(startAt)) {
            throw new ValidationException("endAt", "End time must be after start time");
        }
    }

    private static void validatePricing(AddSessionItemRequest request) {
        if (request.getSellRequestId() == null || request.getSellRequestId().isBlank()) {
            throw new ValidationException("sellRequestId", "Sell request ID is required");
        }
        if (request.getStartPrice() == null || request.getStartPrice().signum() <= 0) {
            throw new ValidationException("startPrice", "Start price must be positive");
        }
        if (request.getStepPrice() == null || request.getStepPrice().signum() <= 0) {
            throw new ValidationException("stepPrice", "Step price must be positive");
        }
        if (request.getReservePrice() != null && request.getReservePrice().signum() < 0) {
            throw new ValidationException("reservePrice", "Reserve price must not be negative");
        }
    }

    private void releaseJewelry(SessionItem item, JewelryStatus status) {
        JewelryItem jewelry = jewelryItemRepository.findById(item.getJewelryItemId())
                .orElseThrow(() -> new ResourceNotFoundException("JewelryItem", item.getJewelryItemId()));
        jewelry.moveTo(status);
        jewelryItemRepository.save(jewelry);
    }
}
