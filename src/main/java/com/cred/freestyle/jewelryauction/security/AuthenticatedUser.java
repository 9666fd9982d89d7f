package com.cred.freestyle.jewelryauction.security;

import com.cred.freestyle.jewelryauction.domain.model.Role;

/**
 * The caller of an operation: user ID plus role, as resolved from the request headers.
 *
 * @author Jewelry Auction Team
 */
public final class AuthenticatedUser {

    private final String userId;
    private final Role role;

    public AuthenticatedUser(String userId, Role role) {
        this.userId = userId;
        this.role = role == null ? Role.GUEST : role;
    }

    public static AuthenticatedUser of(String userId, Role role) {
        return new AuthenticatedUser(userId, role);
    }

    public String getUserId() {
        return userId;
    }

    public Role getRole() {
        return role;
    }

    public boolean hasAtLeast(Role required) {
        return role.atLeast(required);
    }

    public boolean isUser(String otherUserId) {
        return userId != null && userId.equals(otherUserId);
    }

    @Override
    public String toString() {
        return userId + "(" + role + ")";
    }
}
