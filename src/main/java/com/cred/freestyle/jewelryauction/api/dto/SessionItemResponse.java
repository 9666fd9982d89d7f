package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.SessionItem;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for lots.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class SessionItemResponse {

    private String sessionItemId;
    private String sessionId;
    private String jewelryItemId;
    private String sellRequestId;
    private String sellerId;
    private Integer lotNumber;
    private BigDecimal reservePrice;
    private BigDecimal startPrice;
    private BigDecimal stepPrice;
    private String status;
    private BigDecimal currentHighestBid;
    private String currentWinnerId;
    private Integer bidCount;
    private Instant closedAt;

    public static SessionItemResponse fromEntity(SessionItem item) {
        SessionItemResponse response = new SessionItemResponse();
        response.setSessionItemId(item.getSessionItemId());
        response.setSessionId(item.getSessionId());
        response.setJewelryItemId(item.getJewelryItemId());
        response.setSellRequestId(item.getSellRequestId());
        response.setSellerId(item.getSellerId());
        response.setLotNumber(item.getLotNumber());
        response.setReservePrice(item.getReservePrice());
        response.setStartPrice(item.getStartPrice());
        response.setStepPrice(item.getStepPrice());
        response.setStatus(item.getStatus().name());
        response.setCurrentHighestBid(item.getCurrentHighestBid());
        response.setCurrentWinnerId(item.getCurrentWinnerId());
        response.setBidCount(item.getBidCount());
        response.setClosedAt(item.getClosedAt());
        return response;
    }
}
