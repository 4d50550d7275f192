package com.gocomet.seatshare.ride.controller;

import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.service.BookingService;
import com.gocomet.seatshare.identity.IdentityResolver;
import com.gocomet.seatshare.identity.UserRole;
import com.gocomet.seatshare.ride.dto.PublishRideRequest;
import com.gocomet.seatshare.ride.dto.RideResponse;
import com.gocomet.seatshare.ride.service.RideService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/rides")
@RequiredArgsConstructor
public class RideController {

    private final RideService rideService;
    private final BookingService bookingService;
    private final IdentityResolver identityResolver;

    /**
     * POST /v1/rides: Driver publishes a ride
     */
    @PostMapping
    public ResponseEntity<RideResponse> publishRide(@Valid @RequestBody PublishRideRequest request,
                                                    HttpServletRequest httpRequest) {
        UUID driverId = identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
        RideResponse response = rideService.publishRide(driverId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /v1/rides/{id}: Ride snapshot with seat counts
     */
    @GetMapping("/{id}")
    public ResponseEntity<RideResponse> getRide(@PathVariable UUID id) {
        return ResponseEntity.ok(rideService.getRide(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<RideResponse> startRide(@PathVariable UUID id, HttpServletRequest httpRequest) {
        UUID driverId = identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
        return ResponseEntity.ok(rideService.startRide(id, driverId));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<RideResponse> completeRide(@PathVariable UUID id, HttpServletRequest httpRequest) {
        UUID driverId = identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
        return ResponseEntity.ok(rideService.completeRide(id, driverId));
    }

    /**
     * POST /v1/rides/{id}/cancel: Cancel a ride and every open booking on it
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<RideResponse> cancelRide(@PathVariable UUID id, HttpServletRequest httpRequest) {
        UUID driverId = identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
        return ResponseEntity.ok(rideService.cancelRide(id, driverId));
    }

    /**
     * GET /v1/rides/{id}/bookings: All booking requests on the driver's ride
     */
    @GetMapping("/{id}/bookings")
    public ResponseEntity<List<BookingResponse>> getRideBookings(@PathVariable UUID id,
                                                                 HttpServletRequest httpRequest) {
        UUID driverId = identityResolver.resolve(httpRequest, UserRole.DRIVER).getUserId();
        return ResponseEntity.ok(bookingService.getRideBookings(id, driverId));
    }
}
