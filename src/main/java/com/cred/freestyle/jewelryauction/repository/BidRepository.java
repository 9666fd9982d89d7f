package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.Bid;
import com.cred.freestyle.jewelryauction.domain.model.Bid.BidStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Bid entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface BidRepository extends JpaRepository<Bid, String> {

    /**
     * Find the WINNING bid of a lot. The unique winning_lot_id column guarantees at most one.
     *
     * @param sessionItemId Lot ID
     * @param status WINNING
     * @return Optional containing the winning bid
     */
    Optional<Bid> findBySessionItemIdAndStatus(String sessionItemId, BidStatus status);

    /**
     * Find a previously placed bid by its client idempotency key.
     *
     * @param sessionItemId Lot ID
     * @param bidderId Bidder ID
     * @param idempotencyKey Client-supplied key
     * @return Optional containing the original bid
     */
    Optional<Bid> findBySessionItemIdAndBidderIdAndIdempotencyKey(
            String sessionItemId, String bidderId, String idempotencyKey);

    Page<Bid> findBySessionItemIdOrderByAmountDescCreatedAtAsc(String sessionItemId, Pageable pageable);

    Page<Bid> findByBidderIdOrderByCreatedAtDesc(String bidderId, Pageable pageable);

    long countBySessionItemIdAndStatus(String sessionItemId, BidStatus status);
}
