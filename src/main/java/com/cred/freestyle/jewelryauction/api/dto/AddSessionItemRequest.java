package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for placing an approved sell request into a session as a lot.
 * The reserve defaults to the jewelry's reserve when omitted.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddSessionItemRequest {

    @NotBlank(message = "Sell request ID is required")
    private String sellRequestId;

    @NotNull(message = "Start price is required")
    private BigDecimal startPrice;

    @NotNull(message = "Step price is required")
    private BigDecimal stepPrice;

    private BigDecimal reservePrice;
}
