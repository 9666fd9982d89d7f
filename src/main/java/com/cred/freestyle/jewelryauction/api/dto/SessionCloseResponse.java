package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of closing or settling a session.
 * {@code unsettledLotIds} lists SOLD lots whose settlement failed and must be retried.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionCloseResponse {

    private SessionResponse session;
    private List<SettlementResponse> settlements;
    private List<String> unsettledLotIds;
}
