package com.cred.freestyle.jewelryauction.repository;

import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Repository interface for JewelryItem entity.
 * Provides the filtered catalogue search used by the listing endpoints.
 *
 * @author Jewelry Auction Team
 */
@Repository
public interface JewelryItemRepository extends JpaRepository<JewelryItem, String> {

    /**
     * Find jewelry by its catalogue code.
     *
     * @param code Jewelry code
     * @return Optional containing the item if found
     */
    Optional<JewelryItem> findByCode(String code);

    /**
     * Check whether a catalogue code is already taken.
     *
     * @param code Jewelry code
     * @return true if an item uses the code
     */
    boolean existsByCode(String code);

    /**
     * Search the catalogue. Every filter is optional; a null filter matches everything.
     * The search term must already be lower-cased and wrapped in '%' wildcards.
     *
     * @param status Jewelry status
     * @param ownerId Owner (seller) ID
     * @param search Free-text pattern over title, description and code
     * @param minPrice Lower bound on estimated price
     * @param maxPrice Upper bound on estimated price
     * @param pageable Page request, normally sorted by creation time descending
     * @return Page of matching items
     */
    @Query("SELECT j FROM JewelryItem j WHERE " +
           "(:status IS NULL OR j.status = :status) AND " +
           "(:ownerId IS NULL OR j.ownerId = :ownerId) AND " +
           "(:search IS NULL OR LOWER(j.title) LIKE :search OR LOWER(j.description) LIKE :search " +
           "    OR LOWER(j.code) LIKE :search) AND " +
           "(:minPrice IS NULL OR j.estimatedPrice >= :minPrice) AND " +
           "(:maxPrice IS NULL OR j.estimatedPrice <= :maxPrice)")
    Page<JewelryItem> search(
            @Param("status") JewelryStatus status,
            @Param("ownerId") String ownerId,
            @Param("search") String search,
            @Param("minPrice") BigDecimal minPrice,
            @Param("maxPrice") BigDecimal maxPrice,
            Pageable pageable
    );
}
