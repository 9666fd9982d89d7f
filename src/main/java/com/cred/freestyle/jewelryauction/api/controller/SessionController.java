package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.AddSessionItemRequest;
import com.cred.freestyle.jewelryauction.api.dto.CreateSessionRequest;
import com.cred.freestyle.jewelryauction.api.dto.EnrollmentResponse;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.api.dto.SessionCloseResponse;
import com.cred.freestyle.jewelryauction.api.dto.SessionItemResponse;
import com.cred.freestyle.jewelryauction.api.dto.SessionResponse;
import com.cred.freestyle.jewelryauction.api.dto.SettlementResponse;
import com.cred.freestyle.jewelryauction.api.dto.SettlementSummaryResponse;
import com.cred.freestyle.jewelryauction.api.dto.UpdateSessionRequest;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.AuctionCloseService;
import com.cred.freestyle.jewelryauction.service.AuctionCloseService.SessionClosure;
import com.cred.freestyle.jewelryauction.service.AuctionSessionService;
import com.cred.freestyle.jewelryauction.service.EnrollmentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for auction sessions, their lots and enrollments.
 *
 * Listing sessions and lots is public. Everything else requires an
 * authenticated caller; role checks happen in the service layer.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final AuctionSessionService sessionService;
    private final AuctionCloseService closeService;
    private final EnrollmentService enrollmentService;
    private final CloudWatchMetricsService metricsService;

    public SessionController(
            AuctionSessionService sessionService,
            AuctionCloseService closeService,
            EnrollmentService enrollmentService,
            CloudWatchMetricsService metricsService
    ) {
        this.sessionService = sessionService;
        this.closeService = closeService;
        this.enrollmentService = enrollmentService;
        this.metricsService = metricsService;
    }

    // ========================================
    // Session lifecycle
    // ========================================

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        AuctionSession session = sessionService.create(SecurityUtils.currentActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.fromEntity(session));
    }

    @PutMapping("/{sessionId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> update(
            @PathVariable String sessionId,
            @Valid @RequestBody UpdateSessionRequest request
    ) {
        return ResponseEntity.ok(SessionResponse.fromEntity(
                sessionService.update(sessionId, SecurityUtils.currentActor(), request)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<SessionResponse>> list(
            @RequestParam(required = false) SessionStatus status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                sessionService.list(status, page, size), SessionResponse::fromEntity));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.fromEntity(sessionService.get(sessionId)));
    }

    @PostMapping("/{sessionId}/schedule")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> schedule(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.fromEntity(
                sessionService.schedule(sessionId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{sessionId}/open")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> open(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.fromEntity(
                sessionService.open(sessionId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{sessionId}/pause")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> pause(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.fromEntity(
                sessionService.pause(sessionId, SecurityUtils.currentActor())));
    }

    /**
     * Close the session, finalize every open lot and settle the sold ones.
     * Lots whose settlement failed are listed in {@code unsettledLotIds}.
     */
    @PostMapping("/{sessionId}/close")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionCloseResponse> close(@PathVariable String sessionId) {
        SessionClosure closure = closeService.closeSession(sessionId, SecurityUtils.currentActor());
        if (!closure.getUnsettledLotIds().isEmpty()) {
            logger.warn("Session {} closed with {} unsettled lots", sessionId, closure.getUnsettledLotIds().size());
        }
        return ResponseEntity.ok(toResponse(closure));
    }

    @PostMapping("/{sessionId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionResponse> cancel(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.fromEntity(
                sessionService.cancel(sessionId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{sessionId}/settle")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionCloseResponse> settle(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(toResponse(closeService.settleSession(sessionId, SecurityUtils.currentActor())));
        } catch (RuntimeException e) {
            logger.warn("Settling session {} failed: {}", sessionId, e.getMessage());
            metricsService.recordError("SESSION_SETTLEMENT_ERROR", "settleSession");
            throw e;
        }
    }

    @GetMapping("/{sessionId}/settlement-summary")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SettlementSummaryResponse> settlementSummary(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.settlementSummary(sessionId, SecurityUtils.currentActor()));
    }

    // ========================================
    // Lots
    // ========================================

    @GetMapping("/{sessionId}/items")
    public ResponseEntity<List<SessionItemResponse>> listItems(
            @PathVariable String sessionId,
            @RequestParam(required = false) SessionItemStatus status
    ) {
        List<SessionItem> items = status == null
                ? sessionService.listItems(sessionId)
                : sessionService.listItems(sessionId, status);
        return ResponseEntity.ok(items.stream()
                .map(SessionItemResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    /**
     * Place a manager-approved, seller-accepted piece in the session as its next lot.
     */
    @PostMapping("/{sessionId}/items")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SessionItemResponse> addItem(
            @PathVariable String sessionId,
            @Valid @RequestBody AddSessionItemRequest request
    ) {
        SessionItem item = sessionService.addItem(sessionId, SecurityUtils.currentActor(), request);
        logger.info("Lot {} added to session {} from sell request {}",
                item.getLotNumber(), sessionId, request.getSellRequestId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionItemResponse.fromEntity(item));
    }

    // ========================================
    // Enrollments
    // ========================================

    @PostMapping("/{sessionId}/enrollments")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EnrollmentResponse> enroll(@PathVariable String sessionId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(EnrollmentResponse.fromEntity(
                enrollmentService.enroll(sessionId, SecurityUtils.currentActor())));
    }

    @GetMapping("/{sessionId}/enrollments")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<EnrollmentResponse>> listEnrollments(@PathVariable String sessionId) {
        return ResponseEntity.ok(enrollmentService.listBySession(sessionId, SecurityUtils.currentActor())
                .stream()
                .map(EnrollmentResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    private SessionCloseResponse toResponse(SessionClosure closure) {
        List<SettlementResponse> settlements = closure.getSettlements().stream()
                .map(SettlementResponse::from)
                .collect(Collectors.toList());
        return new SessionCloseResponse(
                SessionResponse.fromEntity(closure.getSession()),
                settlements,
                closure.getUnsettledLotIds());
    }
}
