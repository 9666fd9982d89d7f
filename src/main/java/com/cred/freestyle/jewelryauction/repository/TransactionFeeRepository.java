package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.TransactionFee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for TransactionFee (fee schedule) entity.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface TransactionFeeRepository extends JpaRepository<TransactionFee, String> {

    /**
     * Find the most recently created active fee schedule.
     *
     * @return Optional containing the active schedule
     */
    Optional<TransactionFee> findFirstByActiveTrueOrderByCreatedAtDesc();

    /**
     * Deactivate every fee schedule. Called before activating a new one.
     *
     * @return Number of schedules deactivated
     */
    @Modifying
    @Query("UPDATE TransactionFee f SET f.active = false WHERE f.active = true")
    int deactivateAll();
}
