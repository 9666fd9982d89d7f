package com.cred.freestyle.jewelryauction.security;

import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Utility class for reading the caller's identity from the security context.
 *
 * @author Jewelry Auction Team
 */
public class SecurityUtils {

    /**
     * Get the currently authenticated user.
     *
     * @return Caller identity, or null if not authenticated
     */
    public static AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof AuthenticatedUser) {
                return (AuthenticatedUser) principal;
            }
        }

        return null;
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID, or null if not authenticated
     */
    public static String getCurrentUserId() {
        AuthenticatedUser user = getCurrentUser();
        return user != null ? user.getUserId() : null;
    }

    /**
     * Get the current user, failing when the request carries no identity.
     *
     * @return Caller identity
     * @throws AuthorizationException if not authenticated
     */
    public static AuthenticatedUser currentActor() {
        AuthenticatedUser user = getCurrentUser();
        if (user == null) {
            throw new AuthorizationException("User not authenticated");
        }
        return user;
    }
}
