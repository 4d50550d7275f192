package com.gocomet.seatshare.booking.controller;

import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.service.BookingService;
import com.gocomet.seatshare.identity.CallerIdentity;
import com.gocomet.seatshare.identity.IdentityResolver;
import com.gocomet.seatshare.identity.UserRole;
import com.gocomet.seatshare.pickup.dto.PickupVerificationRequest;
import com.gocomet.seatshare.pickup.service.PickupVerificationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Driver actions on a single booking of one of their rides.
 */
@RestController
@RequestMapping("/v1/driver/bookings")
@RequiredArgsConstructor
public class DriverBookingController {

    private final BookingService bookingService;
    private final PickupVerificationService pickupVerificationService;
    private final IdentityResolver identityResolver;

    @GetMapping("/{id}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable UUID id, HttpServletRequest httpRequest) {
        CallerIdentity caller = identityResolver.resolve(httpRequest, UserRole.DRIVER);
        return ResponseEntity.ok(bookingService.getBooking(id, caller));
    }

    /**
     * POST /v1/driver/bookings/{id}/accept: Reserve the seats and issue the pickup PIN
     */
    @PostMapping("/{id}/accept")
    public ResponseEntity<BookingResponse> acceptBooking(@PathVariable UUID id, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(bookingService.acceptBooking(id, driverId(httpRequest)));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BookingResponse> rejectBooking(@PathVariable UUID id, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(bookingService.rejectBooking(id, driverId(httpRequest)));
    }

    /**
     * POST /v1/driver/bookings/{id}/pickup: Verify the rider's PIN and mark them picked up
     */
    @PostMapping("/{id}/pickup")
    public ResponseEntity<BookingResponse> verifyPickup(@PathVariable UUID id,
                                                        @Valid @RequestBody PickupVerificationRequest request,
                                                        HttpServletRequest httpRequest) {
        return ResponseEntity.ok(pickupVerificationService.verifyPickup(id, driverId(httpRequest), request.getPin()));
    }

    private UUID driverId(HttpServletRequest httpRequest) {
        return identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
    }
}
