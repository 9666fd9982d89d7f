package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of closing a lot. {@code settlement} is present only for SOLD lots.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LotCloseResponse {

    private SessionItemResponse lot;
    private SettlementResponse settlement;
}
