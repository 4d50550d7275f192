package com.gocomet.seatshare.pickup.service;

import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.event.BookingEventProducer;
import com.gocomet.seatshare.booking.model.Booking;
import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.booking.repository.BookingRepository;
import com.gocomet.seatshare.booking.service.BookingService;
import com.gocomet.seatshare.common.event.BookingEvent;
import com.gocomet.seatshare.common.exception.CredentialExpiredException;
import com.gocomet.seatshare.common.exception.CredentialLockedException;
import com.gocomet.seatshare.common.exception.CredentialMismatchException;
import com.gocomet.seatshare.common.exception.ForbiddenException;
import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.common.exception.ResourceNotFoundException;
import com.gocomet.seatshare.notification.service.NotificationService;
import com.gocomet.seatshare.pickup.dto.PickupPinResponse;
import com.gocomet.seatshare.ride.model.Ride;
import com.gocomet.seatshare.ride.model.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Driver-side check of the rider's pickup PIN, and rider-side display of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PickupVerificationService {

    private final BookingRepository bookingRepository;
    private final PickupCredentialService credentialService;
    private final BookingService bookingService;
    private final NotificationService notificationService;
    private final BookingEventProducer bookingEventProducer;

    /**
     * Mark a passenger as picked up once the driver enters the right PIN.
     *
     * The booking row stays locked for the whole check so concurrent attempts
     * are counted one after another. A wrong PIN still commits: the attempt
     * counter and any lockout it triggers must survive the error response.
     */
    @Transactional(noRollbackFor = CredentialMismatchException.class)
    public BookingResponse verifyPickup(UUID bookingId, UUID driverId, String submittedPin) {
        credentialService.requireValidFormat(submittedPin);

        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", "id", bookingId));
        Ride ride = booking.getRide();

        if (!ride.isOwnedBy(driverId)) {
            throw new ForbiddenException("You do not have permission to mark this passenger as picked up");
        }
        if (ride.getStatus() != RideStatus.IN_PROGRESS) {
            throw new InvalidStateTransitionException("Ride must be started before marking passengers as picked up");
        }
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw new InvalidStateTransitionException("Only confirmed bookings can be marked as picked up");
        }
        if (booking.isPickedUp()) {
            log.debug("Booking {} already picked up at {}", bookingId, booking.getPickedUpAt());
            return bookingService.toResponse(booking);
        }
        if (!booking.hasPickupCredential()) {
            throw new InvalidStateTransitionException("No pickup PIN was issued for this booking");
        }

        LocalDateTime now = credentialService.now();
        if (booking.isPinExpired(now)) {
            throw new CredentialExpiredException(booking.getPickupPinExpiresAt());
        }
        if (booking.isPinLocked(now)) {
            LocalDateTime lockedUntil = booking.getPickupPinLockedUntil();
            throw new CredentialLockedException(lockedUntil, minutesUntil(now, lockedUntil));
        }
        booking.clearElapsedLockout(now);

        if (!credentialService.matches(submittedPin, booking.getPickupPinHash())) {
            int remaining = booking.recordFailedPinAttempt(credentialService.maxAttempts(),
                    credentialService.lockoutEndingFrom(now));
            bookingRepository.save(booking);
            if (remaining == 0) {
                log.warn("Pickup PIN for booking {} locked until {} after {} failed attempts",
                        bookingId, booking.getPickupPinLockedUntil(), booking.getPickupPinAttempts());
            } else {
                log.info("Wrong pickup PIN for booking {}, {} attempt(s) left", bookingId, remaining);
            }
            throw new CredentialMismatchException(remaining);
        }

        booking.markPickedUp(now);
        bookingRepository.save(booking);

        log.info("Booking {} picked up by driver {}", bookingId, driverId);

        notificationService.notifyRider(booking.getRider().getId(), "PICKUP_CONFIRMED", Map.of(
                "bookingId", bookingId.toString(),
                "pickedUpAt", now.toString()
        ));
        bookingEventProducer.publish(BookingEvent.EventType.PICKED_UP, booking);

        return bookingService.toResponse(booking);
    }

    /**
     * The plaintext PIN for the rider's own confirmed booking, so they can
     * show it to the driver.
     */
    @Transactional(readOnly = true)
    public PickupPinResponse getPickupPin(UUID bookingId, UUID riderId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", "id", bookingId));

        if (!booking.getRider().getId().equals(riderId)) {
            throw new ForbiddenException("You do not have permission to view this PIN");
        }
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw new InvalidStateTransitionException("PIN is only available for confirmed bookings");
        }
        if (booking.getPickupPinEncrypted() == null) {
            throw new ResourceNotFoundException("Pickup PIN not found for this booking");
        }
        if (booking.isPinExpired(credentialService.now())) {
            throw new CredentialExpiredException(booking.getPickupPinExpiresAt());
        }

        return PickupPinResponse.builder()
                .bookingId(bookingId)
                .pin(credentialService.decrypt(booking.getPickupPinEncrypted()))
                .expiresAt(booking.getPickupPinExpiresAt())
                .pickupStatus(booking.getPickupStatus())
                .build();
    }

    private static long minutesUntil(LocalDateTime now, LocalDateTime until) {
        long seconds = Duration.between(now, until).getSeconds();
        return Math.max(1, (seconds + 59) / 60);
    }
}
