package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuctionSession entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface AuctionSessionRepository extends JpaRepository<AuctionSession, String> {

    /**
     * Find a session with a pessimistic write lock.
     * Serializes lot-number assignment and status transitions per session.
     *
     * @param sessionId Session ID
     * @return Optional containing the locked session
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AuctionSession s WHERE s.sessionId = :sessionId")
    Optional<AuctionSession> findByIdWithLock(@Param("sessionId") String sessionId);

    boolean existsByCode(String code);

    Page<AuctionSession> findByStatus(SessionStatus status, Pageable pageable);

    /**
     * Push the session end out for anti-sniping. Never shortens the session and only
     * applies while the session is OPEN.
     *
     * @param sessionId Session ID
     * @param status OPEN
     * @param newEndAt Proposed end time
     * @param updatedAt Modification timestamp
     * @return Number of rows updated (0 or 1)
     */
    @Modifying
    @Query("UPDATE AuctionSession s SET s.endAt = :newEndAt, s.updatedAt = :updatedAt " +
           "WHERE s.sessionId = :sessionId AND s.status = :status AND s.endAt < :newEndAt")
    int extendEndAt(@Param("sessionId") String sessionId,
                    @Param("status") SessionStatus status,
                    @Param("newEndAt") Instant newEndAt,
                    @Param("updatedAt") Instant updatedAt);

    long countByStatus(SessionStatus status);
}
