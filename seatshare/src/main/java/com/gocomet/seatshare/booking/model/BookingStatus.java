package com.gocomet.seatshare.booking.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle. The legal edges are declared here and nowhere else:
 * <pre>
 * PENDING   -> CONFIRMED | REJECTED | CANCELLED
 * CONFIRMED -> CANCELLED | COMPLETED
 * </pre>
 * Seats are held against the ride's inventory only while CONFIRMED.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    REJECTED,
    CANCELLED,
    COMPLETED;

    private static final Map<BookingStatus, Set<BookingStatus>> EDGES = new EnumMap<>(BookingStatus.class);

    static {
        EDGES.put(PENDING, EnumSet.of(CONFIRMED, REJECTED, CANCELLED));
        EDGES.put(CONFIRMED, EnumSet.of(CANCELLED, COMPLETED));
        EDGES.put(REJECTED, EnumSet.noneOf(BookingStatus.class));
        EDGES.put(CANCELLED, EnumSet.noneOf(BookingStatus.class));
        EDGES.put(COMPLETED, EnumSet.noneOf(BookingStatus.class));
    }

    public boolean canTransitionTo(BookingStatus target) {
        return EDGES.get(this).contains(target);
    }

    public boolean isTerminal() {
        return EDGES.get(this).isEmpty();
    }

    public boolean holdsSeats() {
        return this == CONFIRMED;
    }

    /** Statuses that block the same rider from requesting the ride again. */
    public static Set<BookingStatus> active() {
        return EnumSet.of(PENDING, CONFIRMED);
    }
}
