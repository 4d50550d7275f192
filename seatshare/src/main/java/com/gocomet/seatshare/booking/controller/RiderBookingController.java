package com.gocomet.seatshare.booking.controller;

import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.dto.CreateBookingRequest;
import com.gocomet.seatshare.booking.dto.UpdateBookingRequest;
import com.gocomet.seatshare.booking.service.BookingService;
import com.gocomet.seatshare.identity.CallerIdentity;
import com.gocomet.seatshare.identity.IdentityResolver;
import com.gocomet.seatshare.identity.UserRole;
import com.gocomet.seatshare.pickup.dto.PickupPinResponse;
import com.gocomet.seatshare.pickup.service.PickupVerificationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
public class RiderBookingController {

    private final BookingService bookingService;
    private final PickupVerificationService pickupVerificationService;
    private final IdentityResolver identityResolver;

    /**
     * POST /v1/bookings: Request seats on a ride
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(@Valid @RequestBody CreateBookingRequest request,
                                                         HttpServletRequest httpRequest) {
        UUID riderId = riderId(httpRequest);
        BookingResponse response = bookingService.createBooking(riderId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<BookingResponse>> getMyBookings(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(bookingService.getRiderBookings(riderId(httpRequest)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable UUID id, HttpServletRequest httpRequest) {
        CallerIdentity caller = identityResolver.resolve(httpRequest, UserRole.RIDER);
        return ResponseEntity.ok(bookingService.getBooking(id, caller));
    }

    /**
     * PATCH /v1/bookings/{id}: Change seat count or pickup location
     */
    @PatchMapping("/{id}")
    public ResponseEntity<BookingResponse> updateBooking(@PathVariable UUID id,
                                                         @Valid @RequestBody UpdateBookingRequest request,
                                                         HttpServletRequest httpRequest) {
        return ResponseEntity.ok(bookingService.updateBooking(id, riderId(httpRequest), request));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BookingResponse> cancelBooking(@PathVariable UUID id, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(bookingService.cancelBooking(id, riderId(httpRequest)));
    }

    /**
     * GET /v1/bookings/{id}/pickup-pin: PIN to show the driver at pickup
     */
    @GetMapping("/{id}/pickup-pin")
    public ResponseEntity<PickupPinResponse> getPickupPin(@PathVariable UUID id, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(pickupVerificationService.getPickupPin(id, riderId(httpRequest)));
    }

    private UUID riderId(HttpServletRequest httpRequest) {
        return identityResolver.resolve(httpRequest, UserRole.RIDER).getUserId();
    }
}
