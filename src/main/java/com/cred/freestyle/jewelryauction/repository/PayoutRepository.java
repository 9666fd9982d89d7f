package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Payout.PayoutStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Payout entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface PayoutRepository extends JpaRepository<Payout, String> {

    Optional<Payout> findBySessionItemId(String sessionItemId);

    List<Payout> findBySessionId(String sessionId);

    List<Payout> findBySellerIdOrderByCreatedAtDesc(String sellerId);

    long countByStatus(PayoutStatus status);

    List<Payout> findByStatusAndProcessedAtBetween(PayoutStatus status, Instant from, Instant to);
}
