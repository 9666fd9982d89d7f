package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.JewelryItem;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.repository.JewelryItemRepository;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Read-only queries over the jewelry catalogue.
 *
 * @author Jewelry Auction Team
 */
@Service
public class CatalogService {

    private final JewelryItemRepository jewelryItemRepository;
    private final Pagination pagination;

    public CatalogService(JewelryItemRepository jewelryItemRepository, Pagination pagination) {
        this.jewelryItemRepository = jewelryItemRepository;
        this.pagination = pagination;
    }

    /**
     * Filtered listing, newest first. Every filter is optional.
     *
     * @param status Jewelry status
     * @param ownerId Owner (seller) ID
     * @param query Free text matched against title, description and code
     * @param minPrice Lower bound on the estimated price
     * @param maxPrice Upper bound on the estimated price
     */
    @Transactional(readOnly = true)
    public Page<JewelryItem> search(JewelryStatus status, String ownerId, String query,
                                    BigDecimal minPrice, BigDecimal maxPrice,
                                    Integer page, Integer size) {
        if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
            throw new ValidationException("minPrice", "Minimum price must not exceed maximum price");
        }
        String pattern = query == null || query.isBlank() ? null : "%" + query.trim().toLowerCase() + "%";
        return jewelryItemRepository.search(status, ownerId, pattern, minPrice, maxPrice,
                pagination.newestFirst(page, size));
    }

    @Transactional(readOnly = true)
    public JewelryItem get(String jewelryItemId) {
        return jewelryItemRepository.findById(jewelryItemId)
                .orElseThrow(() -> new ResourceNotFoundException("JewelryItem", jewelryItemId));
    }
}
