package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Payment.PaymentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Payment entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    /**
     * Find the payment created when the lot was settled.
     * One-to-one: each sold lot yields exactly one payment.
     *
     * @param sessionItemId Lot ID
     * @return Optional containing the payment
     */
    Optional<Payment> findBySessionItemId(String sessionItemId);

    boolean existsBySessionItemId(String sessionItemId);

    List<Payment> findBySessionId(String sessionId);

    List<Payment> findByBuyerIdOrderByCreatedAtDesc(String buyerId);

    long countByStatus(PaymentStatus status);

    List<Payment> findByStatusAndProcessedAtBetween(PaymentStatus status, Instant from, Instant to);
}
