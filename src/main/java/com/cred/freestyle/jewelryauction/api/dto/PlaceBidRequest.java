package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for placing a bid.
 *
 * The optional idempotency key lets a client retry a timed-out submission safely:
 * a repeated key from the same bidder on the same lot returns the original bid.
 *
 * @author Jewelry Auction Team
 */
public class PlaceBidRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Amount must be positive")
    private BigDecimal amount;

    @Size(max = 64, message = "Idempotency key must be at most 64 characters")
    private String idempotencyKey;

    public PlaceBidRequest() {
    }

    public PlaceBidRequest(BigDecimal amount, String idempotencyKey) {
        this.amount = amount;
        this.idempotencyKey = idempotencyKey;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }
}
