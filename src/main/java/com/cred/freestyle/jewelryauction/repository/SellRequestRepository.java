package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import com.cred.freestyle.jewelryauction.domain.model.SellRequest.SellRequestStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository interface for SellRequest entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface SellRequestRepository extends JpaRepository<SellRequest, String> {

    /**
     * Find a sell request with a pessimistic write lock, so that two staff members
     * cannot move the same request concurrently.
     *
     * @param sellRequestId Sell request ID
     * @return Optional containing the locked request
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SellRequest s WHERE s.sellRequestId = :id")
    Optional<SellRequest> findByIdWithLock(@Param("id") String sellRequestId);

    /**
     * Check whether the seller already has a request in one of the given statuses
     * for the jewelry carrying this code.
     *
     * @param sellerId Seller ID
     * @param code Jewelry code
     * @param statuses Statuses that count as open
     * @return true if such a request exists
     */
    @Query("SELECT COUNT(s) > 0 FROM SellRequest s, JewelryItem j " +
           "WHERE s.jewelryItemId = j.jewelryItemId AND s.sellerId = :sellerId " +
           "AND j.code = :code AND s.status IN :statuses")
    boolean existsBySellerAndCodeInStatuses(
            @Param("sellerId") String sellerId,
            @Param("code") String code,
            @Param("statuses") Collection<SellRequestStatus> statuses
    );

    /**
     * List requests with optional status and seller filters.
     *
     * @param status Status filter, or null
     * @param sellerId Seller filter, or null
     * @param pageable Page request
     * @return Page of sell requests
     */
    @Query("SELECT s FROM SellRequest s WHERE " +
           "(:status IS NULL OR s.status = :status) AND " +
           "(:sellerId IS NULL OR s.sellerId = :sellerId)")
    Page<SellRequest> search(
            @Param("status") SellRequestStatus status,
            @Param("sellerId") String sellerId,
            Pageable pageable
    );

    long countByStatus(SellRequestStatus status);
}
