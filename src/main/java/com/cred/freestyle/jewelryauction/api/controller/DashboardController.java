package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.DashboardOverviewResponse;
import com.cred.freestyle.jewelryauction.api.dto.RevenueReportResponse;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.ReportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Read-only dashboard endpoints. Role checks happen in {@link ReportService}.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/dashboard")
@PreAuthorize("isAuthenticated()")
public class DashboardController {

    private final ReportService reportService;

    public DashboardController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/overview")
    public ResponseEntity<DashboardOverviewResponse> overview() {
        return ResponseEntity.ok(reportService.overview(SecurityUtils.currentActor()));
    }

    @GetMapping("/revenue")
    public ResponseEntity<RevenueReportResponse> revenue(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        return ResponseEntity.ok(reportService.revenue(SecurityUtils.currentActor(), from, to));
    }
}
