package com.gocomet.seatshare.identity;

import com.gocomet.seatshare.common.exception.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Takes the caller's id as stated by the client ({@code X-User-Id} header or
 * {@code userId} query parameter) with the role implied by the endpoint.
 * Nothing is verified, so this is only for test and development setups.
 */
@Component
@ConditionalOnProperty(name = "app.identity.mode", havingValue = "asserted")
@Slf4j
public class AssertedIdentityResolver implements IdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_PARAM = "userId";

    @Override
    public CallerIdentity resolve(HttpServletRequest request, UserRole expectedRole) {
        String asserted = request.getHeader(USER_ID_HEADER);
        if (asserted == null || asserted.isBlank()) {
            asserted = request.getParameter(USER_ID_PARAM);
        }
        if (asserted == null || asserted.isBlank()) {
            throw new UnauthenticatedException(expectedRole.name().toLowerCase() + " id is required");
        }

        UUID userId;
        try {
            userId = UUID.fromString(asserted.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Invalid " + expectedRole.name().toLowerCase() + " id");
        }
        log.warn("Using asserted {} id {} without verification ({} {})",
                expectedRole, userId, request.getMethod(), request.getRequestURI());
        return new CallerIdentity(userId, expectedRole);
    }
}
