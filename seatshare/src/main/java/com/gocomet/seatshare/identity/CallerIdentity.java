package com.gocomet.seatshare.identity;

import lombok.Value;

import java.util.UUID;

@Value
public class CallerIdentity {
    UUID userId;
    UserRole role;
}
