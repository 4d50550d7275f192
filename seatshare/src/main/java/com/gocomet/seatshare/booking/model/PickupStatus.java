package com.gocomet.seatshare.booking.model;

public enum PickupStatus {
    PENDING,
    PICKED_UP
}
