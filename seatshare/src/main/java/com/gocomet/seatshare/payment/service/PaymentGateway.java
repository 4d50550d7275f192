package com.gocomet.seatshare.payment.service;

import com.gocomet.seatshare.payment.dto.PaymentAuthorization;

import java.math.BigDecimal;

/**
 * Authorizes, but never captures, a payment with the external processor.
 */
public interface PaymentGateway {

    /**
     * Repeating a call with the same idempotency key returns the earlier
     * approval instead of authorizing the amount twice.
     */
    PaymentAuthorization authorize(String idempotencyKey, BigDecimal amount, String payerReference);
}
