package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.User;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for users. Never exposes the password hash.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class UserResponse {

    private String userId;
    private String name;
    private String email;
    private String role;
    private boolean active;
    private String phone;
    private String address;
    private Instant createdAt;

    public static UserResponse fromEntity(User user) {
        UserResponse response = new UserResponse();
        response.setUserId(user.getUserId());
        response.setName(user.getName());
        response.setEmail(user.getEmail());
        response.setRole(user.getRole().name());
        response.setActive(Boolean.TRUE.equals(user.getActive()));
        response.setPhone(user.getPhone());
        response.setAddress(user.getAddress());
        response.setCreatedAt(user.getCreatedAt());
        return response;
    }
}
