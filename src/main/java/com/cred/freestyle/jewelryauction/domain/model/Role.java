package com.cred.freestyle.jewelryauction.domain.model;

/**
 * User roles, declared in ascending order of privilege.
 * Comparisons go through {@link #atLeast(Role)} rather than name matching.
 *
 * @author Jewelry Auction Team
 */
public enum Role {
    GUEST,
    MEMBER,
    STAFF,
    MANAGER,
    ADMIN;

    /**
     * Check whether this role grants at least the privileges of the given role.
     *
     * @param required Minimum role
     * @return true if this role ranks the same as or above {@code required}
     */
    public boolean atLeast(Role required) {
        return this.ordinal() >= required.ordinal();
    }

    /**
     * Resolve a role name leniently (case-insensitive, optional ROLE_ prefix).
     *
     * @param value Role name
     * @return Matching role, or GUEST when the value is unknown
     */
    public static Role fromString(String value) {
        if (value == null || value.isBlank()) {
            return GUEST;
        }
        String normalized = value.trim().toUpperCase();
        if (normalized.startsWith("ROLE_")) {
            normalized = normalized.substring("ROLE_".length());
        }
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        return GUEST;
    }
}
