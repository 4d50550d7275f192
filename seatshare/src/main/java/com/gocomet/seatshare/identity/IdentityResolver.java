package com.gocomet.seatshare.identity;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves who is calling. Authentication itself happens upstream; the core
 * only consumes the result through this seam, so it never checks which
 * environment it runs in.
 */
public interface IdentityResolver {

    /**
     * @param expectedRole role the endpoint is meant for
     * @throws com.gocomet.seatshare.common.exception.UnauthenticatedException when no caller can be resolved
     * @throws com.gocomet.seatshare.common.exception.ForbiddenException when the caller holds another role
     */
    CallerIdentity resolve(HttpServletRequest request, UserRole expectedRole);
}
