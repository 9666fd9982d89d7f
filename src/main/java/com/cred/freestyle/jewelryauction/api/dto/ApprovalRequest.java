package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequest {

    private BigDecimal reservePrice;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
