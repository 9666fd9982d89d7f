package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.RevenueReportResponse;
import com.cred.freestyle.jewelryauction.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.jewelryauction.config.SecurityConfig;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.jewelryauction.service.ReportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for DashboardController using MockMvc.
 */
@WebMvcTest(DashboardController.class)
@ContextConfiguration(classes = {DashboardController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("DashboardController Tests")
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;

    @MockBean
    private CloudWatchMetricsService metricsService;

    @Test
    @DisplayName("GET /dashboard/revenue - Window parameters are passed through")
    void revenue_WithWindow() throws Exception {
        // Given
        Instant from = Instant.parse("2026-10-01T00:00:00Z");
        Instant to = Instant.parse("2026-10-31T00:00:00Z");
        when(reportService.revenue(any(), eq(from), eq(to))).thenReturn(RevenueReportResponse.builder()
                .from(from)
                .to(to)
                .platformRevenue(new BigDecimal("350.00"))
                .build());

        // When / Then
        mockMvc.perform(get("/api/v1/dashboard/revenue")
                        .param("from", "2026-10-01T00:00:00Z")
                        .param("to", "2026-10-31T00:00:00Z")
                        .header("X-User-Id", "manager-001")
                        .header("X-User-Role", "MANAGER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platformRevenue").value(350.00));
    }

    @Test
    @DisplayName("GET /dashboard/overview - Member is forbidden")
    void overview_Member_Returns403() throws Exception {
        when(reportService.overview(any())).thenThrow(new AuthorizationException("View dashboard requires STAFF"));

        mockMvc.perform(get("/api/v1/dashboard/overview")
                        .header("X-User-Id", "bidder-001")
                        .header("X-User-Role", "MEMBER"))
                .andExpect(status().isForbidden());
    }
}
