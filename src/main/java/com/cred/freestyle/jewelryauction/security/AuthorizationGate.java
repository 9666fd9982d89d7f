package com.cred.freestyle.jewelryauction.security;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;

/**
 * Role checks performed by the service layer before any state is touched.
 *
 * @author Jewelry Auction Team
 */
public final class AuthorizationGate {

    private AuthorizationGate() {
    }

    /**
     * Require the actor to hold at least the given role.
     *
     * @param actor Caller
     * @param required Minimum role
     * @param action Human-readable action, used in the error message
     * @throws AuthorizationException if the actor's role is lower
     */
    public static void requireAtLeast(AuthenticatedUser actor, Role required, String action) {
        if (actor == null || !actor.hasAtLeast(required)) {
            throw new AuthorizationException(String.format(
                    "%s requires role %s or higher", action, required));
        }
    }

    /**
     * Require the actor to be the owner of the resource, or to hold at least the given role.
     *
     * @param actor Caller
     * @param ownerId Owner of the resource
     * @param required Role that bypasses the ownership check
     * @param action Human-readable action
     * @throws AuthorizationException if neither condition holds
     */
    public static void requireOwnerOrAtLeast(AuthenticatedUser actor, String ownerId, Role required, String action) {
        if (actor == null) {
            throw new AuthorizationException(action + " requires an authenticated user");
        }
        if (actor.isUser(ownerId) || actor.hasAtLeast(required)) {
            return;
        }
        throw new AuthorizationException(String.format(
                "%s is restricted to the owner or role %s and higher", action, required));
    }

    /**
     * Require the actor to be the owner of the resource.
     *
     * @throws AuthorizationException if the actor is someone else
     */
    public static void requireOwner(AuthenticatedUser actor, String ownerId, String action) {
        if (actor == null || !actor.isUser(ownerId)) {
            throw new AuthorizationException(action + " is restricted to the owner");
        }
    }
}
