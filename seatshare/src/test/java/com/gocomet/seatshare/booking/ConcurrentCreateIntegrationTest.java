package com.gocomet.seatshare.booking;

import com.gocomet.seatshare.booking.dto.CreateBookingRequest;
import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.common.exception.DuplicateRequestException;
import com.gocomet.seatshare.common.exception.InvalidStateTransitionException;
import com.gocomet.seatshare.driver.model.Driver;
import com.gocomet.seatshare.ride.model.RideStatus;
import com.gocomet.seatshare.rider.model.Rider;
import com.gocomet.seatshare.support.BaseIntegrationTest;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

/**
 * Booking requests racing each other, or racing the driver closing the ride,
 * must leave at most one active request per rider and none on a closed ride.
 */
class ConcurrentCreateIntegrationTest extends BaseIntegrationTest {

    @Test
    void createConcurrently_SameRiderSameRide_OnlyOneRequestIsStored() throws Exception {
        // Given
        Driver driver = createDriver();
        UUID rideId = publishRide(driver, 3).getId();
        Rider rider = createRider();

        // When
        List<Outcome> outcomes = runAllAtOnce(List.of(
                () -> create(rider, rideId, "payer-0"),
                () -> create(rider, rideId, "payer-1")
        ));

        // Then
        assertThat(outcomes).containsExactlyInAnyOrder(Outcome.CREATED, Outcome.DUPLICATE);
        assertThat(bookingRepository.findByRideIdAndStatusIn(rideId, BookingStatus.active())).hasSize(1);
    }

    @RepeatedTest(5)
    void createWhileRideIsCancelled_NoActiveRequestSurvives() throws Exception {
        // Given
        Driver driver = createDriver();
        UUID rideId = publishRide(driver, 3).getId();
        Rider rider = createRider();

        // When
        List<Outcome> outcomes = runAllAtOnce(List.of(
                () -> create(rider, rideId, null),
                () -> {
                    rideService.cancelRide(rideId, driver.getId());
                    return Outcome.RIDE_CLOSED;
                }
        ));

        // Then
        assertThat(outcomes).contains(Outcome.RIDE_CLOSED);
        assertThat(reloadRide(rideId).getStatus()).isEqualTo(RideStatus.CANCELLED);
        assertThat(bookingRepository.findByRideIdAndStatusIn(rideId, BookingStatus.active())).isEmpty();
    }

    private Outcome create(Rider rider, UUID rideId, String payerReference) {
        try {
            bookingService.createBooking(rider.getId(), CreateBookingRequest.builder()
                    .rideId(rideId)
                    .numberOfSeats(1)
                    .pickupAddress("Forum Mall, Koramangala")
                    .pickupLat(12.9346)
                    .pickupLng(77.6113)
                    .payerReference(payerReference)
                    .build());
            return Outcome.CREATED;
        } catch (DuplicateRequestException e) {
            return Outcome.DUPLICATE;
        } catch (InvalidStateTransitionException e) {
            return Outcome.RIDE_CLOSED;
        }
    }

    private List<Outcome> runAllAtOnce(List<Callable<Outcome>> calls)
            throws InterruptedException, ExecutionException {
        ExecutorService executor = Executors.newFixedThreadPool(calls.size());
        CountDownLatch ready = new CountDownLatch(calls.size());
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Callable<Outcome> call : calls) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    return call.call();
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }
            return outcomes;
        } catch (TimeoutException e) {
            throw new AssertionError("Concurrent requests did not finish", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private enum Outcome {
        CREATED,
        DUPLICATE,
        RIDE_CLOSED
    }
}
