package com.gocomet.seatshare.booking.model;

import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.pickup.service.PickupCredential;
import com.gocomet.seatshare.ride.model.Ride;
import com.gocomet.seatshare.rider.model.Rider;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_ride_id", columnList = "ride_id"),
        @Index(name = "idx_bookings_rider_ride_status", columnList = "rider_id, ride_id, status"),
        @Index(name = "idx_bookings_confirmation", columnList = "confirmation_number", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ride_id", nullable = false)
    private Ride ride;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "rider_id", nullable = false)
    private Rider rider;

    @Column(name = "confirmation_number", nullable = false, unique = true)
    private String confirmationNumber;

    @Column(name = "number_of_seats", nullable = false)
    private Integer numberOfSeats;

    @Column(name = "pickup_address", nullable = false)
    private String pickupAddress;

    @Column(name = "pickup_lat", nullable = false)
    private Double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private Double pickupLng;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private BookingStatus status = BookingStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "pickup_status", nullable = false)
    @Builder.Default
    private PickupStatus pickupStatus = PickupStatus.PENDING;

    @Column(name = "picked_up_at")
    private LocalDateTime pickedUpAt;

    @Column(name = "pickup_pin_hash")
    private String pickupPinHash;

    @Column(name = "pickup_pin_encrypted")
    private String pickupPinEncrypted;

    @Column(name = "pickup_pin_expires_at")
    private LocalDateTime pickupPinExpiresAt;

    @Column(name = "pickup_pin_attempts", nullable = false)
    @Builder.Default
    private Integer pickupPinAttempts = 0;

    @Column(name = "pickup_pin_locked_until")
    private LocalDateTime pickupPinLockedUntil;

    @Column(name = "payment_authorization_ref")
    private String paymentAuthorizationRef;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // ── Lifecycle transitions ──────────────────────────────────────────────

    public void confirm(PickupCredential credential) {
        moveTo(BookingStatus.CONFIRMED);
        this.pickupStatus = PickupStatus.PENDING;
        this.pickedUpAt = null;
        this.pickupPinHash = credential.getHash();
        this.pickupPinEncrypted = credential.getEncrypted();
        this.pickupPinExpiresAt = credential.getExpiresAt();
        this.pickupPinAttempts = 0;
        this.pickupPinLockedUntil = null;
    }

    public void reject() {
        moveTo(BookingStatus.REJECTED);
    }

    public void cancel() {
        moveTo(BookingStatus.CANCELLED);
    }

    public void complete() {
        moveTo(BookingStatus.COMPLETED);
    }

    private void moveTo(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Booking", status.name(), target.name());
        }
        this.status = target;
    }

    // ── Pickup credential state ────────────────────────────────────────────

    public boolean hasPickupCredential() {
        return pickupPinHash != null;
    }

    public boolean isPickedUp() {
        return pickupStatus == PickupStatus.PICKED_UP;
    }

    public boolean isPinExpired(LocalDateTime now) {
        return pickupPinExpiresAt != null && pickupPinExpiresAt.isBefore(now);
    }

    public boolean isPinLocked(LocalDateTime now) {
        return pickupPinLockedUntil != null && pickupPinLockedUntil.isAfter(now);
    }

    /** A lockout whose window has passed; the attempt counter starts over. */
    public void clearElapsedLockout(LocalDateTime now) {
        if (pickupPinLockedUntil != null && !pickupPinLockedUntil.isAfter(now)) {
            this.pickupPinLockedUntil = null;
            this.pickupPinAttempts = 0;
        }
    }

    /**
     * @return attempts remaining before lockout, 0 once the lock is set
     */
    public int recordFailedPinAttempt(int maxAttempts, LocalDateTime lockUntil) {
        this.pickupPinAttempts = pickupPinAttempts + 1;
        if (pickupPinAttempts >= maxAttempts) {
            this.pickupPinLockedUntil = lockUntil;
        }
        return Math.max(0, maxAttempts - pickupPinAttempts);
    }

    public void markPickedUp(LocalDateTime now) {
        this.pickupStatus = PickupStatus.PICKED_UP;
        this.pickedUpAt = now;
        this.pickupPinAttempts = 0;
        this.pickupPinLockedUntil = null;
    }
}
