package com.gocomet.seatshare.identity;

public enum UserRole {
    DRIVER,
    RIDER
}
