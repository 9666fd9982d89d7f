package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time counts across the consignment pipeline, keyed by status name.
 *
 * @author Jewelry Auction Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardOverviewResponse {

    private Instant generatedAt;
    private Map<String, Long> sellRequests;
    private Map<String, Long> sessions;
    private Map<String, Long> lots;
    private Map<String, Long> payments;
    private Map<String, Long> payouts;
    private long pendingEnrollments;
    private long activeUsers;
}
