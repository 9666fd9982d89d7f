package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.JewelryItemResponse;
import com.cred.freestyle.jewelryauction.api.dto.PageResponse;
import com.cred.freestyle.jewelryauction.domain.model.JewelryItem.JewelryStatus;
import com.cred.freestyle.jewelryauction.service.CatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

/**
 * Public catalogue browsing.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/jewelry")
public class JewelryController {

    private final CatalogService catalogService;

    public JewelryController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * Search the catalogue.
     *
     * @param status Optional status filter
     * @param ownerId Optional owner filter
     * @param q Optional free text over title, description and code
     * @param minPrice Optional lower bound on the estimate
     * @param maxPrice Optional upper bound on the estimate
     * @param page Zero-based page
     * @param size Page size, at most 100
     */
    @GetMapping
    public ResponseEntity<PageResponse<JewelryItemResponse>> search(
            @RequestParam(required = false) JewelryStatus status,
            @RequestParam(required = false) String ownerId,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) BigDecimal minPrice,
            @RequestParam(required = false) BigDecimal maxPrice,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                catalogService.search(status, ownerId, q, minPrice, maxPrice, page, size),
                JewelryItemResponse::fromEntity));
    }

    @GetMapping("/{jewelryItemId}")
    public ResponseEntity<JewelryItemResponse> get(@PathVariable String jewelryItemId) {
        return ResponseEntity.ok(JewelryItemResponse.fromEntity(catalogService.get(jewelryItemId)));
    }
}
