package com.cred.freestyle.jewelryauction.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for checking a member's login credentials.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsRequest {

    @NotBlank(message = "Email is required")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;
}
