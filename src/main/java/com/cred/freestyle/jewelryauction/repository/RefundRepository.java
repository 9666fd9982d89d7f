package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Refund.RefundStatus;
import com.cred.freestyle.jewelryauction.domain.model.Refund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Refund entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface RefundRepository extends JpaRepository<Refund, String> {

    Optional<Refund> findByPaymentId(String paymentId);

    boolean existsByPaymentId(String paymentId);

    List<Refund> findByStatusAndProcessedAtBetween(RefundStatus status, Instant from, Instant to);
}
