package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Staff input for an appraisal or receipt step. The estimate is mandatory only for the
 * final appraisal; the service enforces that.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppraisalRequest {

    private BigDecimal estimatedPrice;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
