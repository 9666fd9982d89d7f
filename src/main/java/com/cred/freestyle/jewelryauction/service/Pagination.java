package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Builds bounded page requests for list endpoints.
 *
 * @author Jewelry Auction Team
 */
@Component
public class Pagination {

    private final int defaultPageSize;
    private final int maxPageSize;

    public Pagination(
            @Value("${auction.pagination.default-page-size:20}") int defaultPageSize,
            @Value("${auction.pagination.max-page-size:100}") int maxPageSize
    ) {
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Page request sorted newest first.
     *
     * @param page Zero-based page index, null for the first page
     * @param size Page size, null for the default
     * @return Page request
     * @throws ValidationException if the page is negative or the size is outside 1..max
     */
    public Pageable newestFirst(Integer page, Integer size) {
        return of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    public Pageable of(Integer page, Integer size, Sort sort) {
        int pageIndex = page == null ? 0 : page;
        int pageSize = size == null ? defaultPageSize : size;

        if (pageIndex < 0) {
            throw new ValidationException("page", "Page index must not be negative");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new ValidationException("size", "Page size must be between 1 and " + maxPageSize);
        }
        return PageRequest.of(pageIndex, pageSize, sort);
    }

    public Pageable unsorted(Integer page, Integer size) {
        return of(page, size, Sort.unsorted());
    }
}
