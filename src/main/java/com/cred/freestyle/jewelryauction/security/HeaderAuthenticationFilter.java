package com.cred.freestyle.jewelryauction.security;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Custom authentication filter that extracts user identity from HTTP headers.
 *
 * Header-based Authentication:
 * - X-User-Id: User identifier (required for authenticated requests)
 * - X-User-Role: One of GUEST, MEMBER, STAFF, MANAGER, ADMIN (optional, defaults to MEMBER)
 *
 * The API gateway in front of the service validates tokens and forwards the claims
 * as headers. Unknown role names resolve to GUEST.
 *
 * The principal stored in the SecurityContext is an {@link AuthenticatedUser}; the granted
 * authority is the role name with the ROLE_ prefix.
 *
 * @author Jewelry Auction Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String roleHeader = request.getHeader(USER_ROLE_HEADER);
            Role role = (roleHeader == null || roleHeader.isBlank())
                    ? Role.MEMBER
                    : Role.fromString(roleHeader);

            List<SimpleGrantedAuthority> authorities = Collections.singletonList(
                new SimpleGrantedAuthority("ROLE_" + role.name())
            );

            UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(new AuthenticatedUser(userId.trim(), role), null, authorities);

            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with role: {}", userId, role);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }
}
