package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for a new fee schedule. Percentages are expressed in percent (10.00 = 10%).
 *
 * @author Jewelry Auction Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateFeeScheduleRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Buyer percentage is required")
    @DecimalMin(value = "0.00", message = "Buyer percentage must not be negative")
    @DecimalMax(value = "100.00", message = "Buyer percentage must be at most 100")
    private BigDecimal buyerPercentage;

    @NotNull(message = "Seller percentage is required")
    @DecimalMin(value = "0.00", message = "Seller percentage must not be negative")
    @DecimalMax(value = "100.00", message = "Seller percentage must be at most 100")
    private BigDecimal sellerPercentage;

    @NotNull(message = "Minimum fee is required")
    @DecimalMin(value = "0.00", message = "Minimum fee must not be negative")
    private BigDecimal minFee;

    @NotNull(message = "Maximum fee is required")
    @DecimalMin(value = "0.00", message = "Maximum fee must not be negative")
    private BigDecimal maxFee;
}
