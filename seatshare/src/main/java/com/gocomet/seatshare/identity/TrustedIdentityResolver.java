package com.gocomet.seatshare.identity;

import com.gocomet.seatshare.common.exception.ForbiddenException;
import com.gocomet.seatshare.common.exception.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Reads the principal the upstream authentication filter stored on the
 * request ({@code userId} and {@code role} attributes).
 */
@Component
@ConditionalOnProperty(name = "app.identity.mode", havingValue = "trusted", matchIfMissing = true)
public class TrustedIdentityResolver implements IdentityResolver {

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String ROLE_ATTRIBUTE = "role";

    @Override
    public CallerIdentity resolve(HttpServletRequest request, UserRole expectedRole) {
        Object userId = request.getAttribute(USER_ID_ATTRIBUTE);
        Object role = request.getAttribute(ROLE_ATTRIBUTE);
        if (userId == null || role == null) {
            throw new UnauthenticatedException("Authentication required");
        }

        UserRole callerRole = role instanceof UserRole ? (UserRole) role : parseRole(role.toString());
        if (callerRole != expectedRole) {
            throw new ForbiddenException("This operation requires the " + expectedRole.name().toLowerCase() + " role");
        }
        UUID id = userId instanceof UUID ? (UUID) userId : parseUserId(userId.toString());
        return new CallerIdentity(id, callerRole);
    }

    private static UserRole parseRole(String role) {
        try {
            return UserRole.valueOf(role.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Unrecognized role: " + role);
        }
    }

    private static UUID parseUserId(String userId) {
        try {
            return UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Malformed user id");
        }
    }
}
