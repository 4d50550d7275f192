package com.gocomet.seatshare.booking.model;

import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.pickup.service.PickupCredential;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class BookingTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 18, 9, 0);

    @Test
    void confirm_StoresCredentialAndResetsPickupState() {
        // Given
        Booking booking = Booking.builder()
                .pickupPinAttempts(3)
                .pickupPinLockedUntil(NOW)
                .build();

        // When
        booking.confirm(new PickupCredential("hash", "cipher", NOW.plusHours(24)));

        // Then
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getPickupStatus()).isEqualTo(PickupStatus.PENDING);
        assertThat(booking.getPickupPinHash()).isEqualTo("hash");
        assertThat(booking.getPickupPinEncrypted()).isEqualTo("cipher");
        assertThat(booking.getPickupPinExpiresAt()).isEqualTo(NOW.plusHours(24));
        assertThat(booking.getPickupPinAttempts()).isZero();
        assertThat(booking.getPickupPinLockedUntil()).isNull();
    }

    @Test
    void cancel_AfterCompletion_ThrowsAndKeepsStatus() {
        // Given
        Booking booking = Booking.builder().status(BookingStatus.COMPLETED).build();

        // When & Then
        assertThatThrownBy(booking::cancel)
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessage("Cannot transition Booking from COMPLETED to CANCELLED");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.COMPLETED);
    }

    @Test
    void complete_PendingBooking_Throws() {
        Booking booking = Booking.builder().build();

        assertThatThrownBy(booking::complete).isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void recordFailedPinAttempt_LocksOnThreshold() {
        // Given
        Booking booking = Booking.builder().build();
        LocalDateTime lockUntil = NOW.plusMinutes(10);

        // When
        int remaining = 0;
        for (int i = 1; i <= 4; i++) {
            remaining = booking.recordFailedPinAttempt(5, lockUntil);
            assertThat(booking.getPickupPinLockedUntil()).isNull();
        }
        assertThat(remaining).isEqualTo(1);
        remaining = booking.recordFailedPinAttempt(5, lockUntil);

        // Then
        assertThat(remaining).isZero();
        assertThat(booking.getPickupPinAttempts()).isEqualTo(5);
        assertThat(booking.getPickupPinLockedUntil()).isEqualTo(lockUntil);
        assertThat(booking.isPinLocked(NOW)).isTrue();
        assertThat(booking.isPinLocked(lockUntil)).isFalse();
    }

    @Test
    void clearElapsedLockout_OnlyOnceLockHasPassed() {
        // Given
        Booking booking = Booking.builder()
                .pickupPinAttempts(5)
                .pickupPinLockedUntil(NOW.plusMinutes(1))
                .build();

        // When
        booking.clearElapsedLockout(NOW);

        // Then
        assertThat(booking.getPickupPinAttempts()).isEqualTo(5);

        // When
        booking.clearElapsedLockout(NOW.plusMinutes(1));

        // Then
        assertThat(booking.getPickupPinAttempts()).isZero();
        assertThat(booking.getPickupPinLockedUntil()).isNull();
    }

    @Test
    void isPinExpired_StrictlyAfterExpiry() {
        Booking booking = Booking.builder().pickupPinExpiresAt(NOW).build();

        assertThat(booking.isPinExpired(NOW)).isFalse();
        assertThat(booking.isPinExpired(NOW.plusSeconds(1))).isTrue();
        assertThat(Booking.builder().build().isPinExpired(NOW)).isFalse();
    }
}
