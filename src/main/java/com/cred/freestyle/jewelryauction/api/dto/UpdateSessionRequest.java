package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.BidIncrementPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a session; null fields are left unchanged.
 *
 * @author Jewelry Auction Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSessionRequest {

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    private Instant startAt;

    private Instant endAt;

    private String assignedStaffId;

    private BidIncrementPolicy bidIncrementPolicy;

    private Boolean registrationRequired;

    private Boolean antiSnipingEnabled;

    @Min(value = 1, message = "Trigger window must be at least 1 second")
    private Integer antiSnipingTriggerSeconds;

    @Min(value = 1, message = "Extension must be at least 1 second")
    private Integer antiSnipingExtensionSeconds;
}
