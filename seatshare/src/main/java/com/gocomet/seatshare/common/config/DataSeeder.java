package com.gocomet.seatshare.common.config;

import com.gocomet.seatshare.driver.model.Driver;
import com.gocomet.seatshare.driver.repository.DriverRepository;
import com.gocomet.seatshare.ride.model.Ride;
import com.gocomet.seatshare.ride.repository.RideRepository;
import com.gocomet.seatshare.rider.model.Rider;
import com.gocomet.seatshare.rider.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Seeds a local database with a few riders, drivers and scheduled rides.
 * Enabled with app.seed.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final DriverRepository driverRepository;
    private final RiderRepository riderRepository;
    private final RideRepository rideRepository;
    private final Clock clock;

    @Override
    public void run(String... args) {
        if (driverRepository.count() > 0) {
            log.info("Database already seeded. Skipping.");
            return;
        }

        log.info("Seeding database with development data...");

        riderRepository.save(Rider.builder()
                .name("Ashish")
                .email("ashish@test.com")
                .phone("+919876543210")
                .build());

        riderRepository.save(Rider.builder()
                .name("Priya")
                .email("priya@test.com")
                .phone("+919876543211")
                .build());

        Driver raju = driverRepository.save(Driver.builder()
                .name("Raju")
                .email("raju@driver.com")
                .phone("+919800000001")
                .build());

        Driver kumar = driverRepository.save(Driver.builder()
                .name("Kumar")
                .email("kumar@driver.com")
                .phone("+919800000002")
                .build());

        LocalDateTime tomorrow = LocalDateTime.now(clock).plusDays(1).withHour(8).withMinute(0).withSecond(0).withNano(0);

        rideRepository.save(Ride.builder()
                .driver(raju)
                .fromAddress("Koramangala, Bangalore")
                .toAddress("Mysore Palace, Mysore")
                .departureTime(tomorrow)
                .publishedSeats(3)
                .availableSeats(3)
                .pricePerSeat(new BigDecimal("450.00"))
                .build());

        rideRepository.save(Ride.builder()
                .driver(kumar)
                .fromAddress("HSR Layout, Bangalore")
                .toAddress("Kempegowda International Airport")
                .departureTime(tomorrow.plusHours(3))
                .publishedSeats(4)
                .availableSeats(4)
                .pricePerSeat(new BigDecimal("300.00"))
                .build());

        log.info("Seeded {} riders, {} drivers and {} rides",
                riderRepository.count(), driverRepository.count(), rideRepository.count());
    }
}
