package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import com.cred.freestyle.jewelryauction.domain.model.SessionItem.SessionItemStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for SessionItem (lot) entity.
 * Provides the row locks that serialize bid admission per lot.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface SessionItemRepository extends JpaRepository<SessionItem, String> {

    /**
     * Find a lot with a pessimistic write lock (SELECT ... FOR UPDATE).
     * Every bid on the lot goes through this lock, so the read-highest, insert,
     * flip-winner sequence runs one transaction at a time per lot.
     *
     * @param sessionItemId Lot ID
     * @return Optional containing the locked lot
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM SessionItem i WHERE i.sessionItemId = :id")
    Optional<SessionItem> findByIdWithLock(@Param("id") String sessionItemId);

    /**
     * Lock every lot of a session, in lot order.
     * Used by transitions that take a session out of OPEN, so that a bid in flight
     * either commits first or sees the new session status.
     *
     * @param sessionId Session ID
     * @return Locked lots ordered by lot number
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM SessionItem i WHERE i.sessionId = :sessionId ORDER BY i.lotNumber ASC")
    List<SessionItem> findBySessionIdWithLock(@Param("sessionId") String sessionId);

    List<SessionItem> findBySessionIdOrderByLotNumberAsc(String sessionId);

    List<SessionItem> findBySessionIdAndStatusOrderByLotNumberAsc(String sessionId, SessionItemStatus status);

    /**
     * Highest lot number assigned in a session, or 0 when the session is empty.
     *
     * @param sessionId Session ID
     * @return Current maximum lot number
     */
    @Query("SELECT COALESCE(MAX(i.lotNumber), 0) FROM SessionItem i WHERE i.sessionId = :sessionId")
    int findMaxLotNumber(@Param("sessionId") String sessionId);

    long countBySessionIdAndStatusNot(String sessionId, SessionItemStatus status);

    long countByStatus(SessionItemStatus status);
}
