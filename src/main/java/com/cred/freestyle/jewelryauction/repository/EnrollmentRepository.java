package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Enrollment;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment.EnrollmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Enrollment entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface EnrollmentRepository extends JpaRepository<Enrollment, String> {

    Optional<Enrollment> findByUserIdAndSessionId(String userId, String sessionId);

    /**
     * Check whether the user may bid in the session.
     *
     * @param userId User ID
     * @param sessionId Session ID
     * @param status Required status (APPROVED)
     * @return true if a matching enrollment exists
     */
    boolean existsByUserIdAndSessionIdAndStatus(String userId, String sessionId, EnrollmentStatus status);

    List<Enrollment> findBySessionIdOrderByCreatedAtAsc(String sessionId);

    List<Enrollment> findByUserIdOrderByCreatedAtDesc(String userId);

    long countByStatus(EnrollmentStatus status);
}
