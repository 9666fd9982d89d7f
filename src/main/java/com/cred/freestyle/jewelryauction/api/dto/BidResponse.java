package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Bid;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
public class BidResponse {

    private String bidId;
    private String sessionItemId;
    private String sessionId;
    private String bidderId;
    private BigDecimal amount;
    private String status;
    private Instant createdAt;

    public static BidResponse fromEntity(Bid bid) {
        BidResponse response = new BidResponse();
        response.setBidId(bid.getBidId());
        response.setSessionItemId(bid.getSessionItemId());
        response.setSessionId(bid.getSessionId());
        response.setBidderId(bid.getBidderId());
        response.setAmount(bid.getAmount());
        response.setStatus(bid.getStatus().name());
        response.setCreatedAt(bid.getCreatedAt());
        return response;
    }
}
