package com.cred.freestyle.jewelryauction.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Current standing of a lot. {@code winningBid} is null while the lot has no bids.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WinnerResponse {

    private String sessionItemId;
    private BigDecimal highestAmount;
    private BidResponse winningBid;
}
