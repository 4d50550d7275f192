package com.gocomet.seatshare.ride.model;

import com.gocomet.seatshare.driver.model.Driver;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A published trip. {@code availableSeats} is written only by
 * {@link com.gocomet.seatshare.ride.service.SeatLedger}.
 */
@Entity
@Table(name = "rides", indexes = {
        @Index(name = "idx_rides_driver_id", columnList = "driver_id"),
        @Index(name = "idx_rides_status", columnList = "status")
})
@Check(constraints = "available_seats >= 0 AND available_seats <= published_seats")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "driver_id", nullable = false)
    private Driver driver;

    @Column(name = "from_address", nullable = false)
    private String fromAddress;

    @Column(name = "to_address", nullable = false)
    private String toAddress;

    @Column(name = "departure_time", nullable = false)
    private LocalDateTime departureTime;

    @Column(name = "published_seats", nullable = false, updatable = false)
    private Integer publishedSeats;

    @Setter(AccessLevel.NONE)
    @Column(name = "available_seats", nullable = false, updatable = false)
    private Integer availableSeats;

    @Column(name = "price_per_seat", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerSeat;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RideStatus status = RideStatus.SCHEDULED;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(UUID driverId) {
        return driver != null && driver.getId().equals(driverId);
    }
}
