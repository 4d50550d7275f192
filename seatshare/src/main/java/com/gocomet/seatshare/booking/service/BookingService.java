package com.gocomet.seatshare.booking.service;

import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.dto.CreateBookingRequest;
import com.gocomet.seatshare.booking.dto.UpdateBookingRequest;
import com.gocomet.seatshare.booking.event.BookingEventProducer;
import com.gocomet.seatshare.booking.model.Booking;
import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.booking.repository.BookingRepository;
import com.gocomet.seatshare.common.event.BookingEvent;
import com.gocomet.seatshare.common.exception.DuplicateRequestException;
import com.gocomet.seatshare.common.exception.ForbiddenException;
import com.gocomet.seatshare.common.exception.InsufficientSeatsException;
import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.common.exception.PaymentDeclinedException;
import com.gocomet.seatshare.common.exception.ResourceNotFoundException;
import com.gocomet.seatshare.identity.CallerIdentity;
import com.gocomet.seatshare.identity.UserRole;
import com.gocomet.seatshare.notification.service.NotificationService;
import com.gocomet.seatshare.payment.dto.PaymentAuthorization;
import com.gocomet.seatshare.payment.service.PaymentGateway;
import com.gocomet.seatshare.pickup.service.PickupCredential;
import com.gocomet.seatshare.pickup.service.PickupCredentialService;
import com.gocomet.seatshare.ride.model.Ride;
import com.gocomet.seatshare.ride.model.RideStatus;
import com.gocomet.seatshare.ride.repository.RideRepository;
import com.gocomet.seatshare.ride.service.SeatLedger;
import com.gocomet.seatshare.rider.model.Rider;
import com.gocomet.seatshare.rider.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a booking through PENDING → CONFIRMED → COMPLETED (or out through
 * REJECTED / CANCELLED).
 *
 * Every mutating operation row-locks the booking first. Seat inventory is
 * only touched through {@link SeatLedger}, and since a ledger call clears the
 * persistence context the booking is re-read before it is changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final RideRepository rideRepository;
    private final RiderRepository riderRepository;
    private final SeatLedger seatLedger;
    private final PickupCredentialService pickupCredentialService;
    private final ConfirmationNumberGenerator confirmationNumberGenerator;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final BookingEventProducer bookingEventProducer;
    private final TransactionTemplate transactionTemplate;

    /**
     * Rider requests seats on a ride.
     * 1. Validate ride is open and seats look available
     * 2. Reject a second active request for the same ride
     * 3. Authorize the fare if a payer reference was given
     * 4. Under the ride row lock, re-check and store the PENDING booking
     *
     * The processor is called outside any transaction so the ride lock is
     * only held for the final checks and the insert. Nothing is reserved
     * here; seats are only taken when the driver accepts.
     */
    public BookingResponse createBooking(UUID riderId, CreateBookingRequest request) {
        UUID rideId = request.getRideId();
        int seats = request.getNumberOfSeats() != null ? request.getNumberOfSeats() : 1;

        Ride ride = rideRepository.findById(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
        requireOpenForRequests(ride, seats);
        if (riderRepository.findById(riderId).isEmpty()) {
            throw new ResourceNotFoundException("Rider", "id", riderId);
        }
        requireNoActiveBooking(riderId, rideId);

        String authorizationRef = authorizeFare(riderId, ride, seats, request.getPayerReference());

        return transactionTemplate.execute(status -> storeRequest(riderId, rideId, seats, request, authorizationRef));
    }

    // Creates for one ride queue on its row lock, as do ride cancel and complete.
    private BookingResponse storeRequest(UUID riderId, UUID rideId, int seats,
                                         CreateBookingRequest request, String authorizationRef) {
        Ride ride = rideRepository.findByIdForUpdate(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
        requireOpenForRequests(ride, seats);
        requireNoActiveBooking(riderId, rideId);
        Rider rider = riderRepository.findById(riderId)
                .orElseThrow(() -> new ResourceNotFoundException("Rider", "id", riderId));

        Booking booking = Booking.builder()
                .ride(ride)
                .rider(rider)
                .confirmationNumber(confirmationNumberGenerator.nextUnique(bookingRepository::existsByConfirmationNumber))
                .numberOfSeats(seats)
                .pickupAddress(request.getPickupAddress())
                .pickupLat(request.getPickupLat())
                .pickupLng(request.getPickupLng())
                .paymentAuthorizationRef(authorizationRef)
                .build();
        booking = bookingRepository.save(booking);

        log.info("Booking {} requested by rider {} for {} seat(s) on ride {}",
                booking.getId(), riderId, seats, rideId);

        notificationService.notifyDriver(ride.getDriver().getId(), "BOOKING_REQUESTED", Map.of(
                "bookingId", booking.getId().toString(),
                "rideId", rideId.toString(),
                "riderName", rider.getName(),
                "numberOfSeats", seats,
                "pickupAddress", booking.getPickupAddress()
        ));
        bookingEventProducer.publish(BookingEvent.EventType.REQUESTED, booking);

        return toResponse(booking);
    }

    private static void requireOpenForRequests(Ride ride, int seats) {
        if (ride.getStatus() != RideStatus.SCHEDULED) {
            throw new InvalidStateTransitionException(
                    "Ride is " + ride.getStatus().name().toLowerCase() + " and no longer accepts booking requests");
        }
        if (ride.getAvailableSeats() <= 0 || seats > ride.getAvailableSeats()) {
            throw new InsufficientSeatsException(ride.getId(), seats, ride.getAvailableSeats());
        }
    }

    private void requireNoActiveBooking(UUID riderId, UUID rideId) {
        if (bookingRepository.existsByRiderIdAndRideIdAndStatusIn(riderId, rideId, BookingStatus.active())) {
            throw new DuplicateRequestException("You already have a pending or confirmed booking for this ride");
        }
    }

    /**
     * Keyed on ride, rider and amount: a double-submitted request reuses the
     * first approval, while the same payer on another ride is authorized anew.
     */
    private String authorizeFare(UUID riderId, Ride ride, int seats, String payerReference) {
        if (payerReference == null || payerReference.isBlank()) {
            return null;
        }
        BigDecimal amount = ride.getPricePerSeat().multiply(BigDecimal.valueOf(seats));
        String idempotencyKey = ride.getId() + ":" + riderId + ":" + amount.toPlainString();
        PaymentAuthorization authorization = paymentGateway.authorize(idempotencyKey, amount, payerReference);
        if (!authorization.isApproved()) {
            log.info("Payment authorization declined for rider {} on ride {}: {}",
                    riderId, ride.getId(), authorization.getFailureReason());
            throw new PaymentDeclinedException(authorization.getFailureReason());
        }
        return authorization.getReference();
    }

    /**
     * Driver accepts a pending request. The seats are reserved and the pickup
     * PIN issued in the same transaction; if the ledger refuses, the booking
     * stays PENDING.
     */
    @Transactional
    public BookingResponse acceptBooking(UUID bookingId, UUID driverId) {
        Booking booking = lockBooking(bookingId);
        Ride ride = booking.getRide();
        requireRideOwner(ride, driverId, "accept this booking");

        if (booking.getStatus() != BookingStatus.PENDING) {
            throw new InvalidStateTransitionException("Booking", booking.getStatus().name(),
                    BookingStatus.CONFIRMED.name());
        }
        if (ride.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Cannot accept bookings on a " + ride.getStatus().name().toLowerCase() + " ride");
        }
        if (ride.getAvailableSeats() < booking.getNumberOfSeats()) {
            throw new InsufficientSeatsException(ride.getId(), booking.getNumberOfSeats(), ride.getAvailableSeats());
        }

        PickupCredential credential = pickupCredentialService.issue();
        seatLedger.reserve(ride.getId(), booking.getNumberOfSeats());

        booking = reload(bookingId);
        booking.confirm(credential);
        bookingRepository.save(booking);

        log.info("Booking {} accepted by driver {}", bookingId, driverId);

        notificationService.notifyRider(booking.getRider().getId(), "BOOKING_ACCEPTED", Map.of(
                "bookingId", bookingId.toString(),
                "confirmationNumber", booking.getConfirmationNumber(),
                "numberOfSeats", booking.getNumberOfSeats(),
                "pickupPinExpiresAt", booking.getPickupPinExpiresAt().toString()
        ));
        bookingEventProducer.publish(BookingEvent.EventType.ACCEPTED, booking);

        return toResponse(booking);
    }

    @Transactional
    public BookingResponse rejectBooking(UUID bookingId, UUID driverId) {
        Booking booking = lockBooking(bookingId);
        requireRideOwner(booking.getRide(), driverId, "reject this booking");

        booking.reject();
        bookingRepository.save(booking);

        log.info("Booking {} rejected by driver {}", bookingId, driverId);

        notificationService.notifyRider(booking.getRider().getId(), "BOOKING_REJECTED", Map.of(
                "bookingId", bookingId.toString(),
                "rideId", booking.getRide().getId().toString()
        ));
        bookingEventProducer.publish(BookingEvent.EventType.REJECTED, booking);

        return toResponse(booking);
    }

    /**
     * Rider withdraws a booking. Seats go back to the ride only if the
     * booking had been confirmed.
     */
    @Transactional
    public BookingResponse cancelBooking(UUID bookingId, UUID riderId) {
        Booking booking = lockBooking(bookingId);
        requireBookingOwner(booking, riderId, "cancel this booking");

        if (booking.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException("Booking", booking.getStatus().name(),
                    BookingStatus.CANCELLED.name());
        }
        Ride ride = booking.getRide();
        if (ride.getStatus() == RideStatus.CANCELLED || ride.getStatus() == RideStatus.COMPLETED) {
            throw new InvalidStateTransitionException(
                    "Cannot cancel a booking on a " + ride.getStatus().name().toLowerCase() + " ride");
        }

        if (booking.getStatus().holdsSeats()) {
            seatLedger.release(ride.getId(), booking.getNumberOfSeats());
            booking = reload(bookingId);
        }
        booking.cancel();
        bookingRepository.save(booking);

        log.info("Booking {} cancelled by rider {}", bookingId, riderId);

        notificationService.notifyDriver(booking.getRide().getDriver().getId(), "BOOKING_CANCELLED", Map.of(
                "bookingId", bookingId.toString(),
                "rideId", booking.getRide().getId().toString(),
                "numberOfSeats", booking.getNumberOfSeats()
        ));
        bookingEventProducer.publish(BookingEvent.EventType.CANCELLED, booking);

        return toResponse(booking);
    }

    /**
     * Rider changes seat count and/or pickup location before the ride starts.
     * For a confirmed booking the seat difference goes through the ledger
     * first and the count only changes if that succeeds.
     */
    @Transactional
    public BookingResponse updateBooking(UUID bookingId, UUID riderId, UpdateBookingRequest request) {
        Booking booking = lockBooking(bookingId);
        requireBookingOwner(booking, riderId, "update this booking");

        if (booking.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Cannot update a " + booking.getStatus().name().toLowerCase() + " booking");
        }
        Ride ride = booking.getRide();
        if (ride.getStatus() != RideStatus.SCHEDULED) {
            throw new InvalidStateTransitionException(
                    "Cannot update booking for a ride that is " + ride.getStatus().name().toLowerCase());
        }

        boolean locationChanged = request.getPickupAddress() != null;
        if (locationChanged && (request.getPickupLat() == null || request.getPickupLng() == null)) {
            throw new IllegalArgumentException("Pickup latitude and longitude are required when changing the pickup address");
        }

        int oldSeats = booking.getNumberOfSeats();
        Integer newSeats = request.getNumberOfSeats();
        if (newSeats != null && newSeats < 1) {
            throw new IllegalArgumentException("Number of seats must be at least 1");
        }
        boolean seatsChanged = newSeats != null && newSeats != oldSeats;

        if (!locationChanged && !seatsChanged) {
            return toResponse(booking);
        }

        if (seatsChanged) {
            if (booking.getStatus().holdsSeats()) {
                seatLedger.adjust(ride.getId(), newSeats - oldSeats);
                booking = reload(bookingId);
            } else if (newSeats > ride.getAvailableSeats()) {
                throw new InsufficientSeatsException(ride.getId(), newSeats, ride.getAvailableSeats());
            }
            booking.setNumberOfSeats(newSeats);
        }
        if (locationChanged) {
            booking.setPickupAddress(request.getPickupAddress());
            booking.setPickupLat(request.getPickupLat());
            booking.setPickupLng(request.getPickupLng());
        }
        bookingRepository.save(booking);

        List<String> changes = new ArrayList<>();
        if (seatsChanged) {
            changes.add("seats: " + oldSeats + " -> " + newSeats);
        }
        if (locationChanged) {
            changes.add("pickup location");
        }
        log.info("Booking {} updated by rider {} ({})", bookingId, riderId, String.join(", ", changes));

        Map<String, Object> payload = new HashMap<>();
        payload.put("bookingId", bookingId.toString());
        payload.put("numberOfSeats", booking.getNumberOfSeats());
        payload.put("pickupAddress", booking.getPickupAddress());
        payload.put("changes", changes);
        notificationService.notifyDriver(booking.getRide().getDriver().getId(), "BOOKING_UPDATED", payload);

        if (seatsChanged) {
            bookingEventProducer.publish(BookingEvent.EventType.SEATS_CHANGED, booking, oldSeats + "->" + newSeats);
        }

        return toResponse(booking);
    }

    /**
     * Visible to the rider who made it and to the driver of the ride.
     */
    @Transactional(readOnly = true)
    public BookingResponse getBooking(UUID bookingId, CallerIdentity caller) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", "id", bookingId));

        boolean allowed = caller.getRole() == UserRole.RIDER
                ? booking.getRider().getId().equals(caller.getUserId())
                : booking.getRide().isOwnedBy(caller.getUserId());
        if (!allowed) {
            throw new ForbiddenException("You do not have permission to view this booking");
        }
        return toResponse(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getRiderBookings(UUID riderId) {
        return bookingRepository.findByRiderIdOrderByCreatedAtDesc(riderId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getRideBookings(UUID rideId, UUID driverId) {
        Ride ride = rideRepository.findById(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
        requireRideOwner(ride, driverId, "view bookings for this ride");

        return bookingRepository.findByRideIdOrderByCreatedAtAsc(rideId).stream()
                .map(this::toResponse)
                .toList();
    }

    public BookingResponse toResponse(Booking booking) {
        Ride ride = booking.getRide();
        return BookingResponse.builder()
                .id(booking.getId())
                .confirmationNumber(booking.getConfirmationNumber())
                .rideId(ride.getId())
                .riderId(booking.getRider().getId())
                .numberOfSeats(booking.getNumberOfSeats())
                .pickupAddress(booking.getPickupAddress())
                .pickupLat(booking.getPickupLat())
                .pickupLng(booking.getPickupLng())
                .status(booking.getStatus())
                .pickupStatus(booking.getPickupStatus())
                .pickedUpAt(booking.getPickedUpAt())
                .pickupPinExpiresAt(booking.getPickupPinExpiresAt())
                .rideStatus(ride.getStatus())
                .rideAvailableSeats(ride.getAvailableSeats())
                .paymentAuthorizationRef(booking.getPaymentAuthorizationRef())
                .createdAt(booking.getCreatedAt())
                .build();
    }

    private Booking lockBooking(UUID bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", "id", bookingId));
    }

    // The row lock taken by lockBooking outlives the context clear
    private Booking reload(UUID bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", "id", bookingId));
    }

    private static void requireRideOwner(Ride ride, UUID driverId, String action) {
        if (!ride.isOwnedBy(driverId)) {
            throw new ForbiddenException("You do not have permission to " + action);
        }
    }

    private static void requireBookingOwner(Booking booking, UUID riderId, String action) {
        if (!booking.getRider().getId().equals(riderId)) {
            throw new ForbiddenException("You do not have permission to " + action);
        }
    }
}
