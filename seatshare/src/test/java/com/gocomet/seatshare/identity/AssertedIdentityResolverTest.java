package com.gocomet.seatshare.identity;

import com.gocomet.seatshare.common.exception.UnauthenticatedException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class AssertedIdentityResolverTest {

    private final AssertedIdentityResolver resolver = new AssertedIdentityResolver();

    @Test
    void resolve_Header_TakesRoleFromEndpoint() {
        // Given
        UUID driverId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/driver/bookings/x/accept");
        request.addHeader("X-User-Id", driverId.toString());

        // When
        CallerIdentity identity = resolver.resolve(request, UserRole.DRIVER);

        // Then
        assertThat(identity).isEqualTo(new CallerIdentity(driverId, UserRole.DRIVER));
    }

    @Test
    void resolve_QueryParameter_UsedWhenHeaderMissing() {
        // Given
        UUID riderId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/bookings");
        request.setParameter("userId", riderId.toString());

        // When
        CallerIdentity identity = resolver.resolve(request, UserRole.RIDER);

        // Then
        assertThat(identity.getUserId()).isEqualTo(riderId);
    }

    @Test
    void resolve_HeaderWinsOverParameter() {
        // Given
        UUID fromHeader = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/bookings");
        request.addHeader("X-User-Id", fromHeader.toString());
        request.setParameter("userId", UUID.randomUUID().toString());

        // When & Then
        assertThat(resolver.resolve(request, UserRole.RIDER).getUserId()).isEqualTo(fromHeader);
    }

    @Test
    void resolve_NothingAsserted_ThrowsUnauthenticated() {
        assertThatThrownBy(() -> resolver.resolve(new MockHttpServletRequest(), UserRole.RIDER))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("rider id is required");
    }

    @Test
    void resolve_NotAUuid_ThrowsUnauthenticated() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-User-Id", "driver-7");

        // When & Then
        assertThatThrownBy(() -> resolver.resolve(request, UserRole.DRIVER))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Invalid driver id");
    }
}
