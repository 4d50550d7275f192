package com.gocomet.seatshare.ride.service;

import com.gocomet.seatshare.booking.event.BookingEventProducer;
import com.gocomet.seatshare.booking.model.Booking;
import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.booking.repository.BookingRepository;
import com.gocomet.seatshare.common.event.BookingEvent;
import com.gocomet.seatshare.common.event.RideEvent;
import com.gocomet.seatshare.common.exception.ForbiddenException;
import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.common.exception.ResourceNotFoundException;
import com.gocomet.seatshare.driver.model.Driver;
import com.gocomet.seatshare.driver.repository.DriverRepository;
import com.gocomet.seatshare.notification.service.NotificationService;
import com.gocomet.seatshare.ride.dto.PublishRideRequest;
import com.gocomet.seatshare.ride.dto.RideResponse;
import com.gocomet.seatshare.ride.event.RideEventProducer;
import com.gocomet.seatshare.ride.model.Ride;
import com.gocomet.seatshare.ride.model.RideStatus;
import com.gocomet.seatshare.ride.repository.RideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RideService {

    private final RideRepository rideRepository;
    private final DriverRepository driverRepository;
    private final BookingRepository bookingRepository;
    private final SeatLedger seatLedger;
    private final NotificationService notificationService;
    private final RideEventProducer rideEventProducer;
    private final BookingEventProducer bookingEventProducer;

    @Transactional
    public RideResponse publishRide(UUID driverId, PublishRideRequest request) {
        Driver driver = driverRepository.findById(driverId)
                .orElseThrow(() -> new ResourceNotFoundException("Driver", "id", driverId));

        Ride ride = Ride.builder()
                .driver(driver)
                .fromAddress(request.getFromAddress())
                .toAddress(request.getToAddress())
                .departureTime(request.getDepartureTime())
                .publishedSeats(request.getSeats())
                .availableSeats(request.getSeats())
                .pricePerSeat(request.getPricePerSeat())
                .status(RideStatus.SCHEDULED)
                .build();
        ride = rideRepository.save(ride);

        log.info("Ride {} published by driver {}: {} -> {} with {} seat(s)",
                ride.getId(), driverId, ride.getFromAddress(), ride.getToAddress(), ride.getPublishedSeats());
        rideEventProducer.publish(RideEvent.EventType.PUBLISHED, ride);

        return toResponse(ride);
    }

    @Transactional(readOnly = true)
    public RideResponse getRide(UUID rideId) {
        return toResponse(findRide(rideId));
    }

    @Transactional
    public RideResponse startRide(UUID rideId, UUID driverId) {
        Ride ride = lockRide(rideId);
        requireOwner(ride, driverId);

        if (ride.getStatus() != RideStatus.SCHEDULED) {
            throw new InvalidStateTransitionException("Ride", ride.getStatus().name(), RideStatus.IN_PROGRESS.name());
        }
        ride.setStatus(RideStatus.IN_PROGRESS);
        rideRepository.save(ride);

        log.info("Ride {} started by driver {}", rideId, driverId);
        notifyRiders(rideId, BookingStatus.CONFIRMED, "RIDE_STARTED");
        rideEventProducer.publish(RideEvent.EventType.STARTED, ride);

        return toResponse(ride);
    }

    /**
     * Finish the trip.
     * 1. Lock every open booking of the ride, then the ride itself, then any
     *    request that was committed while waiting for the ride
     * 2. Give the confirmed seats back in one ledger call
     * 3. Complete confirmed bookings, reject requests nobody answered
     */
    @Transactional
    public RideResponse completeRide(UUID rideId, UUID driverId) {
        lockOpenBookings(rideId);
        Ride ride = lockRide(rideId);
        requireOwner(ride, driverId);

        if (ride.getStatus() != RideStatus.IN_PROGRESS) {
            throw new InvalidStateTransitionException("Ride", ride.getStatus().name(), RideStatus.COMPLETED.name());
        }
        List<Booking> open = lockOpenBookings(rideId);

        releaseConfirmedSeats(rideId, open);

        List<Booking> bookings = bookingRepository.findAllById(open.stream().map(Booking::getId).toList());
        for (Booking booking : bookings) {
            if (booking.getStatus() == BookingStatus.CONFIRMED) {
                booking.complete();
                bookingEventProducer.publish(BookingEvent.EventType.COMPLETED, booking);
                notificationService.notifyRider(booking.getRider().getId(), "RIDE_COMPLETED", Map.of(
                        "bookingId", booking.getId().toString(),
                        "rideId", rideId.toString()
                ));
            } else {
                booking.reject();
                bookingEventProducer.publish(BookingEvent.EventType.REJECTED, booking, "ride completed");
            }
        }
        bookingRepository.saveAll(bookings);

        ride = findRide(rideId);
        ride.setStatus(RideStatus.COMPLETED);
        rideRepository.save(ride);

        log.info("Ride {} completed by driver {} ({} booking(s) closed)", rideId, driverId, bookings.size());
        rideEventProducer.publish(RideEvent.EventType.COMPLETED, ride);

        return toResponse(ride);
    }

    /**
     * Driver calls the ride off. Every open booking is cancelled and confirmed
     * seats are returned to the inventory before the ride closes.
     */
    @Transactional
    public RideResponse cancelRide(UUID rideId, UUID driverId) {
        lockOpenBookings(rideId);
        Ride ride = lockRide(rideId);
        requireOwner(ride, driverId);

        if (ride.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException("Ride", ride.getStatus().name(), RideStatus.CANCELLED.name());
        }
        List<Booking> open = lockOpenBookings(rideId);

        releaseConfirmedSeats(rideId, open);

        List<Booking> bookings = bookingRepository.findAllById(open.stream().map(Booking::getId).toList());
        for (Booking booking : bookings) {
            booking.cancel();
            bookingEventProducer.publish(BookingEvent.EventType.CANCELLED, booking, "ride cancelled");
            notificationService.notifyRider(booking.getRider().getId(), "RIDE_CANCELLED", Map.of(
                    "bookingId", booking.getId().toString(),
                    "rideId", rideId.toString()
            ));
        }
        bookingRepository.saveAll(bookings);

        ride = findRide(rideId);
        ride.setStatus(RideStatus.CANCELLED);
        rideRepository.save(ride);

        log.info("Ride {} cancelled by driver {} ({} booking(s) cancelled)", rideId, driverId, bookings.size());
        rideEventProducer.publish(RideEvent.EventType.CANCELLED, ride);

        return toResponse(ride);
    }

    private RideResponse toResponse(Ride ride) {
        return RideResponse.builder()
                .id(ride.getId())
                .driverId(ride.getDriver().getId())
                .fromAddress(ride.getFromAddress())
                .toAddress(ride.getToAddress())
                .departureTime(ride.getDepartureTime())
                .publishedSeats(ride.getPublishedSeats())
                .availableSeats(ride.getAvailableSeats())
                .pricePerSeat(ride.getPricePerSeat())
                .status(ride.getStatus())
                .createdAt(ride.getCreatedAt())
                .build();
    }

    private Ride findRide(UUID rideId) {
        return rideRepository.findById(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
    }

    private Ride lockRide(UUID rideId) {
        return rideRepository.findByIdForUpdate(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
    }

    // PENDING rows are locked too: an accept racing with this call either
    // commits first (and is seen as CONFIRMED here) or finds the ride closed.
    // Run again once the ride is locked, since a new request can commit in
    // between and no further one can until this transaction ends.
    private List<Booking> lockOpenBookings(UUID rideId) {
        return bookingRepository.findByRideIdAndStatusInForUpdate(rideId, BookingStatus.active());
    }

    private void releaseConfirmedSeats(UUID rideId, List<Booking> bookings) {
        int confirmedSeats = bookings.stream()
                .filter(b -> b.getStatus().holdsSeats())
                .mapToInt(Booking::getNumberOfSeats)
                .sum();
        if (confirmedSeats > 0) {
            seatLedger.release(rideId, confirmedSeats);
        }
    }

    private void notifyRiders(UUID rideId, BookingStatus status, String eventType) {
        for (Booking booking : bookingRepository.findByRideIdAndStatusIn(rideId, List.of(status))) {
            notificationService.notifyRider(booking.getRider().getId(), eventType, Map.of(
                    "bookingId", booking.getId().toString(),
                    "rideId", rideId.toString()
            ));
        }
    }

    private static void requireOwner(Ride ride, UUID driverId) {
        if (!ride.isOwnedBy(driverId)) {
            throw new ForbiddenException("You do not have permission to manage this ride");
        }
    }
}
