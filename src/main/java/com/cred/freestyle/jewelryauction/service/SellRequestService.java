package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.api.dto.SubmitSellRequestRequest;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest.SellRequestStatus;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ConflictException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.repository.JewelryItemRepository;
import com.cred.freestyle.jewelryauction.repository.SellRequestRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

/**
 * Service driving a consignment from submission to approval.
 *
 * Every transition checks the caller's role first, then locks the request row and lets
 * {@link SellRequest#advance} verify the exact predecessor status and its stage timestamp.
 * A failed check throws before anything is modified, so the transaction rolls back with the
 * record untouched.
 *
 * @author Jewelry Auction Team
 */
@Service
public class SellRequestService {

    private static final Logger logger = LoggerFactory.getLogger(SellRequestService.class);

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 2000;
    static final int MAX_PHOTOS = 10;

    private static final Set<SellRequestStatus> OPEN_STATUSES = EnumSet.complementOf(
            EnumSet.of(SellRequestStatus.REJECTED, SellRequestStatus.ASSIGNED_TO_SESSION));

    /**
     * Jewelry statuses from which an item may be consigned again.
     */
    private static final Set<JewelryStatus> RESUBMITTABLE = EnumSet.of(
            JewelryStatus.RETURNED, JewelryStatus.UNSOLD, JewelryStatus.WITHDRAWN);

    private final SellRequestRepository sellRequestRepository;
    private final JewelryItemRepository jewelryItemRepository;
    private final CodeGenerator codeGenerator;
    private final Pagination pagination;
    private final CloudWatchMetricsService metricsService;

    public SellRequestService(
            SellRequestRepository sellRequestRepository,
            JewelryItemRepository jewelryItemRepository,
            CodeGenerator codeGenerator,
            Pagination pagination,
            CloudWatchMetricsService metricsService
    ) {
        this.sellRequestRepository = sellRequestRepository;
        this.jewelryItemRepository = jewelryItemRepository;
        this.codeGenerator = codeGenerator;
        this.pagination = pagination;
        this.metricsService = metricsService;
    }

    /**
     * Submit a jewelry item for consignment.
     *
     * When the payload carries a code that already belongs to the seller's item (for example
     * one returned after an earlier rejection), that item is updated and re-consigned.
     *
     * @param actor Seller
     * @param payload Item details
     * @return Created request in SUBMITTED status
     * @throws ValidationException if title, description or photos are missing or too long
     * @throws ConflictException if the code belongs to another seller's item
     * @throws BusinessRuleViolationException if the seller already has an open request for the code
     */
    @Transactional
    public SellRequest submit(AuthenticatedUser actor, SubmitSellRequestRequest payload) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Submit sell request");
        validatePayload(payload);

        String sellerId = actor.getUserId();
        JewelryItem jewelry;

        String code = normalizeCode(payload.getCode());
        if (code != null) {
            jewelry = jewelryItemRepository.findByCode(code).orElse(null);
            if (jewelry != null) {
                if (!jewelry.getOwnerId().equals(sellerId)) {
                    logger.warn("Seller {} tried to submit item code {} owned by {}",
                            sellerId, code, jewelry.getOwnerId());
                    throw new ConflictException("Item code " + code + " belongs to another seller");
                }
                if (sellRequestRepository.existsBySellerAndCodeInStatuses(sellerId, code, OPEN_STATUSES)) {
                    throw new BusinessRuleViolationException(
                            "An open sell request already exists for item " + code);
                }
                if (!RESUBMITTABLE.contains(jewelry.getStatus())) {
                    throw new BusinessRuleViolationException(
                            "Item " + code + " cannot be consigned while " + jewelry.getStatus());
                }
                applyPayload(jewelry, payload);
                jewelry.moveTo(JewelryStatus.PENDING_APPRAISAL);
                jewelry.setEstimatedPrice(null);
                jewelry.setReservePrice(null);
            } else {
                jewelry = newJewelry(code, sellerId, payload);
            }
        } else {
            jewelry = newJewelry(codeGenerator.nextJewelryCode(), sellerId, payload);
        }
        jewelry = jewelryItemRepository.save(jewelry);

        SellRequest request = SellRequest.builder()
                .sellerId(sellerId)
                .jewelryItemId(jewelry.getJewelryItemId())
                .status(SellRequestStatus.SUBMITTED)
                .sellerNotes(payload.getSellerNotes())
                .submittedAt(Instant.now())
                .build();
        request = sellRequestRepository.save(request);

        logger.info("Sell request {} submitted by {} for item {}",
                request.getSellRequestId(), sellerId, jewelry.getCode());
        metricsService.recordSellRequestTransition(SellRequestStatus.SUBMITTED.name());
        return request;
    }

    /**
     * SUBMITTED → PRELIM_APPRAISED. The estimate is optional at this stage.
     */
    @Transactional
    public SellRequest preliminaryAppraise(String sellRequestId, AuthenticatedUser actor,
                                           BigDecimal estimatedPrice, String notes) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Preliminary appraisal");
        if (estimatedPrice != null && estimatedPrice.signum() <= 0) {
            throw new ValidationException("estimatedPrice", "Estimated price must be positive");
        }

        SellRequest request = lock(sellRequestId);
        request.advance(SellRequestStatus.SUBMITTED, SellRequestStatus.PRELIM_APPRAISED, Instant.now());
        appendStaffNotes(request, notes);

        if (estimatedPrice != null) {
            JewelryItem jewelry = jewelryOf(request);
            jewelry.setEstimatedPrice(estimatedPrice);
            jewelryItemRepository.save(jewelry);
        }
        return persist(request, actor);
    }

    /**
     * PRELIM_APPRAISED → RECEIVED: the physical item reached the house.
     */
    @Transactional
    public SellRequest markReceived(String sellRequestId, AuthenticatedUser actor, String notes) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Mark item received");

        SellRequest request = lock(sellRequestId);
        request.advance(SellRequestStatus.PRELIM_APPRAISED, SellRequestStatus.RECEIVED, Instant.now());
        appendStaffNotes(request, notes);
        return persist(request, actor);
    }

    /**
     * RECEIVED → FINAL_APPRAISED. Requires an estimated price; the jewelry becomes APPRAISED.
     */
    @Transactional
    public SellRequest finalAppraise(String sellRequestId, AuthenticatedUser actor,
                                     BigDecimal estimatedPrice, String notes) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Final appraisal");
        if (estimatedPrice == null || estimatedPrice.signum() <= 0) {
            throw new ValidationException("estimatedPrice", "Final appraisal requires a positive estimated price");
        }

        SellRequest request = lock(sellRequestId);
        request.advance(SellRequestStatus.RECEIVED, SellRequestStatus.FINAL_APPRAISED, Instant.now());
        appendStaffNotes(request, notes);

        JewelryItem jewelry = jewelryOf(request);
        jewelry.setEstimatedPrice(estimatedPrice);
        jewelry.moveTo(JewelryStatus.APPRAISED);
        jewelryItemRepository.save(jewelry);
        return persist(request, actor);
    }

    /**
     * FINAL_APPRAISED → MANAGER_APPROVED. May set the reserve; the jewelry becomes APPROVED.
     */
    @Transactional
    public SellRequest managerApprove(String sellRequestId, AuthenticatedUser actor,
                                      BigDecimal reservePrice, String notes) {
        AuthorizationGate.requireAtLeast(actor, Role.MANAGER, "Manager approval");
        if (reservePrice != null && reservePrice.signum() < 0) {
            throw new ValidationException("reservePrice", "Reserve price must not be negative");
        }

        SellRequest request = lock(sellRequestId);
        request.advance(SellRequestStatus.FINAL_APPRAISED, SellRequestStatus.MANAGER_APPROVED, Instant.now());
        if (notes != null && !notes.isBlank()) {
            request.setManagerNotes(notes);
        }

        JewelryItem jewelry = jewelryOf(request);
        if (reservePrice != null) {
            jewelry.setReservePrice(reservePrice);
        }
        jewelry.moveTo(JewelryStatus.APPROVED);
        jewelryItemRepository.save(jewelry);
        return persist(request, actor);
    }

    /**
     * MANAGER_APPROVED → SELLER_ACCEPTED. Only the owning seller may accept.
     */
    @Transactional
    public SellRequest sellerAccept(String sellRequestId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Accept sell request terms");
        SellRequest request = lock(sellRequestId);
        AuthorizationGate.requireOwner(actor, request.getSellerId(), "Accept sell request terms");

        request.advance(SellRequestStatus.MANAGER_APPROVED, SellRequestStatus.SELLER_ACCEPTED, Instant.now());
        return persist(request, actor);
    }

    /**
     * Reject from any non-terminal status. The jewelry is returned to the seller.
     */
    @Transactional
    public SellRequest reject(String sellRequestId, AuthenticatedUser actor, String reason) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Reject sell request");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "A rejection reason is required");
        }

        SellRequest request = lock(sellRequestId);
        AuthorizationGate.requireOwnerOrAtLeast(actor, request.getSellerId(), Role.STAFF, "Reject sell request");

        request.reject(reason, actor.getUserId(), Instant.now());

        JewelryItem jewelry = jewelryOf(request);
        jewelry.moveTo(JewelryStatus.RETURNED);
        jewelryItemRepository.save(jewelry);
        return persist(request, actor);
    }

    @Transactional(readOnly = true)
    public SellRequest get(String sellRequestId, AuthenticatedUser actor) {
        SellRequest request = sellRequestRepository.findById(sellRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("SellRequest", sellRequestId));
        AuthorizationGate.requireOwnerOrAtLeast(actor, request.getSellerId(), Role.STAFF, "View sell request");
        return request;
    }

    @Transactional(readOnly = true)
    public JewelryItem getJewelry(SellRequest request) {
        return jewelryOf(request);
    }

    /**
     * List requests. Callers below STAFF only ever see their own.
     */
    @Transactional(readOnly = true)
    public Page<SellRequest> list(AuthenticatedUser actor, SellRequestStatus status, String sellerId,
                                  Integer page, Integer size) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "List sell requests");
        String effectiveSeller = actor.hasAtLeast(Role.STAFF) ? sellerId : actor.getUserId();
        return sellRequestRepository.search(status, effectiveSeller, pagination.newestFirst(page, size));
    }

    // ========================================
    // Helpers
    // ========================================

    private SellRequest lock(String sellRequestId) {
        return sellRequestRepository.findByIdWithLock(sellRequestId)
                .orElseThrow(() -> new ResourceNotFoundException("SellRequest", sellRequestId));
    }

    private JewelryItem jewelryOf(SellRequest request) {
        return jewelryItemRepository.findById(request.getJewelryItemId())
                .orElseThrow(() -> new ResourceNotFoundException("JewelryItem", request.getJewelryItemId()));
    }

    private SellRequest persist(SellRequest request, AuthenticatedUser actor) {
        SellRequest saved = sellRequestRepository.save(request);
        logger.info("Sell request {} moved to {} by {}", saved.getSellRequestId(), saved.getStatus(), actor.getUserId());
        metricsService.recordSellRequestTransition(saved.getStatus().name());
        return saved;
    }

    private void appendStaffNotes(SellRequest request, String notes) {
        if (notes == null || notes.isBlank()) {
            return;
        }
        String existing = request.getStaffNotes();
        request.setStaffNotes(existing == null ? notes : existing + "\n" + notes);
    }

    private void validatePayload(SubmitSellRequestRequest payload) {
        if (payload == null) {
            throw new ValidationException("payload", "Item details are required");
        }
        if (payload.getTitle() == null || payload.getTitle().isBlank()) {
            throw new ValidationException("title", "Title is required");
        }
        if (payload.getTitle().length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title", "Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (payload.getDescription() == null || payload.getDescription().isBlank()) {
            throw new ValidationException("description", "Description is required");
        }
        if (payload.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description",
                    "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (payload.getPhotos() == null || payload.getPhotos().isEmpty()) {
            throw new ValidationException("photos", "At least one photo is required");
        }
        if (payload.getPhotos().size() > MAX_PHOTOS) {
            throw new ValidationException("photos", "At most " + MAX_PHOTOS + " photos are allowed");
        }
        if (payload.getWeight() != null && payload.getWeight().signum() <= 0) {
            throw new ValidationException("weight", "Weight must be positive");
        }
    }

    private static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase();
    }

    private static JewelryItem newJewelry(String code, String sellerId, SubmitSellRequestRequest payload) {
        JewelryItem jewelry = JewelryItem.builder()
                .code(code)
                .ownerId(sellerId)
                .status(JewelryStatus.PENDING_APPRAISAL)
                .build();
        applyPayload(jewelry, payload);
        return jewelry;
    }

    private static void applyPayload(JewelryItem jewelry, SubmitSellRequestRequest payload) {
        jewelry.setTitle(payload.getTitle().trim());
        jewelry.setDescription(payload.getDescription().trim());
        jewelry.setWeight(payload.getWeight());
        jewelry.setAttributes(payload.getAttributes() == null
                ? new HashMap<>() : new HashMap<>(payload.getAttributes()));
        List<String> photos = new ArrayList<>(payload.getPhotos());
        jewelry.setPhotos(photos);
    }
}
