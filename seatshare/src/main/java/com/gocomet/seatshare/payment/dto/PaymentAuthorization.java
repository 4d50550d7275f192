package com.gocomet.seatshare.payment.dto;

import lombok.Value;

@Value
public class PaymentAuthorization {

    boolean approved;
    String reference;
    String failureReason;

    public static PaymentAuthorization approved(String reference) {
        return new PaymentAuthorization(true, reference, null);
    }

    public static PaymentAuthorization declined(String reason) {
        return new PaymentAuthorization(false, null, reason);
    }
}
