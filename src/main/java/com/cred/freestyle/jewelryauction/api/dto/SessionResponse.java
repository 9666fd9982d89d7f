package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class SessionResponse {

    private String sessionId;
    private String code;
    private String name;
    private String description;
    private Instant startAt;
    private Instant endAt;
    private String status;
    private String assignedStaffId;
    private String bidIncrementPolicy;
    private boolean registrationRequired;
    private boolean antiSnipingEnabled;
    private Integer antiSnipingTriggerSeconds;
    private Integer antiSnipingExtensionSeconds;
    private Instant openedAt;
    private Instant closedAt;
    private Instant settledAt;
    private Instant canceledAt;
    private Instant createdAt;

    public static SessionResponse fromEntity(AuctionSession session) {
        SessionResponse response = new SessionResponse();
        response.setSessionId(session.getSessionId());
        response.setCode(session.getCode());
        response.setName(session.getName());
        response.setDescription(session.getDescription());
        response.setStartAt(session.getStartAt());
        response.setEndAt(session.getEndAt());
        response.setStatus(session.getStatus().name());
        response.setAssignedStaffId(session.getAssignedStaffId());
        response.setBidIncrementPolicy(session.getBidIncrementPolicy().name());
        response.setRegistrationRequired(Boolean.TRUE.equals(session.getRegistrationRequired()));
        response.setAntiSnipingEnabled(Boolean.TRUE.equals(session.getAntiSnipingEnabled()));
        response.setAntiSnipingTriggerSeconds(session.getAntiSnipingTriggerSeconds());
        response.setAntiSnipingExtensionSeconds(session.getAntiSnipingExtensionSeconds());
        response.setOpenedAt(session.getOpenedAt());
        response.setClosedAt(session.getClosedAt());
        response.setSettledAt(session.getSettledAt());
        response.setCanceledAt(session.getCanceledAt());
        response.setCreatedAt(session.getCreatedAt());
        return response;
    }
}
