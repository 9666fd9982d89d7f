package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment.EnrollmentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.exception.AuctionNotOpenException;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.EnrollmentRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Registration of bidders to sessions.
 *
 * @author Jewelry Auction Team
 */
@Service
public class EnrollmentService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentService.class);

    private final EnrollmentRepository enrollmentRepository;
    private final AuctionSessionRepository sessionRepository;

    public EnrollmentService(EnrollmentRepository enrollmentRepository,
                             AuctionSessionRepository sessionRepository) {
        this.enrollmentRepository = enrollmentRepository;
        this.sessionRepository = sessionRepository;
    }

    /**
     * Ask to bid in a session. An existing enrollment of the caller is returned unchanged.
     *
     * @throws AuctionNotOpenException if the session is not SCHEDULED or OPEN
     */
    @Transactional
    public Enrollment enroll(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "Enroll in session");

        AuctionSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("AuctionSession", sessionId));

        Optional<Enrollment> existing = enrollmentRepository.findByUserIdAndSessionId(actor.getUserId(), sessionId);
        if (existing.isPresent()) {
            logger.debug("User {} already enrolled in session {} ({})",
                    actor.getUserId(), sessionId, existing.get().getStatus());
            return existing.get();
        }

        if (session.getStatus() != SessionStatus.SCHEDULED && session.getStatus() != SessionStatus.OPEN) {
            throw new AuctionNotOpenException(sessionId, "enrollment is only possible while SCHEDULED or OPEN");
        }

        Enrollment enrollment = Enrollment.builder()
                .userId(actor.getUserId())
                .sessionId(sessionId)
                .status(EnrollmentStatus.PENDING)
                .build();

        try {
            enrollment = enrollmentRepository.saveAndFlush(enrollment);
        } catch (DataIntegrityViolationException e) {
            // Concurrent duplicate from the same user; a retry returns the stored enrollment
            throw new ConcurrencyException("Enrollment for session " + sessionId + " is already being created", e);
        }

        logger.info("User {} enrolled in session {}", actor.getUserId(), sessionId);
        return enrollment;
    }

    @Transactional
    public Enrollment approve(String enrollmentId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Approve enrollment");
        Enrollment enrollment = find(enrollmentId);
        enrollment.approve(actor.getUserId());
        enrollment = enrollmentRepository.save(enrollment);
        logger.info("Enrollment {} approved by {}", enrollmentId, actor.getUserId());
        return enrollment;
    }

    @Transactional
    public Enrollment reject(String enrollmentId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "Reject enrollment");
        Enrollment enrollment = find(enrollmentId);
        enrollment.reject(actor.getUserId());
        enrollment = enrollmentRepository.save(enrollment);
        logger.info("Enrollment {} rejected by {}", enrollmentId, actor.getUserId());
        return enrollment;
    }

    @Transactional
    public Enrollment cancel(String enrollmentId, AuthenticatedUser actor) {
        Enrollment enrollment = find(enrollmentId);
        AuthorizationGate.requireOwner(actor, enrollment.getUserId(), "Cancel enrollment");
        enrollment.cancel();
        enrollment = enrollmentRepository.save(enrollment);
        logger.info("Enrollment {} canceled by {}", enrollmentId, actor.getUserId());
        return enrollment;
    }

    @Transactional(readOnly = true)
    public List<Enrollment> listBySession(String sessionId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.STAFF, "List session enrollments");
        return enrollmentRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    @Transactional(readOnly = true)
    public List<Enrollment> mine(AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.MEMBER, "List enrollments");
        return enrollmentRepository.findByUserIdOrderByCreatedAtDesc(actor.getUserId());
    }

    private Enrollment find(String enrollmentId) {
        return enrollmentRepository.findById(enrollmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Enrollment", enrollmentId));
    }
}
