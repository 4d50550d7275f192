package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

public class PaymentDeclinedException extends BusinessException {

    public PaymentDeclinedException(String reason) {
        super("PAYMENT_DECLINED", HttpStatus.PAYMENT_REQUIRED, "Payment authorization failed: " + reason);
    }
}
