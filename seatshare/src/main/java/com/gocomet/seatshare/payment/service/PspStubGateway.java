package com.gocomet.seatshare.payment.service;

import com.gocomet.seatshare.payment.dto.PaymentAuthorization;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulates an external Payment Service Provider (like Razorpay/Stripe).
 *
 * Behavior:
 * - configurable approval rate (90% by default)
 * - random delay up to the configured maximum (simulates network latency)
 * - idempotent: a repeated key returns the earlier approval
 * - declines are not remembered, so a retry with the same key is authorized afresh
 */
@Service
@Slf4j
public class PspStubGateway implements PaymentGateway {

    private final Random random = new Random();

    // In-memory store for idempotency (simulates the PSP's dedup)
    private final ConcurrentHashMap<String, PaymentAuthorization> authorizations = new ConcurrentHashMap<>();

    private final double successRate;
    private final int maxLatencyMs;

    public PspStubGateway(@Value("${app.payment.stub.success-rate:0.9}") double successRate,
                          @Value("${app.payment.stub.max-latency-ms:0}") int maxLatencyMs) {
        this.successRate = successRate;
        this.maxLatencyMs = maxLatencyMs;
    }

    @Override
    public PaymentAuthorization authorize(String idempotencyKey, BigDecimal amount, String payerReference) {
        PaymentAuthorization cached = authorizations.get(idempotencyKey);
        if (cached != null) {
            log.info("PSP Stub: Duplicate authorization for key {}. Returning cached result.", idempotencyKey);
            return cached;
        }

        simulateLatency();

        if (random.nextDouble() >= successRate) {
            log.info("PSP Stub: Authorization DECLINED for payer {}", payerReference);
            return PaymentAuthorization.declined("Insufficient funds");
        }

        String reference = "auth_" + UUID.randomUUID().toString().substring(0, 12);
        PaymentAuthorization result = PaymentAuthorization.approved(reference);
        PaymentAuthorization existing = authorizations.putIfAbsent(idempotencyKey, result);
        if (existing != null) {
            return existing;
        }
        log.info("PSP Stub: Authorized {} for payer {}, ref {}", amount, payerReference, reference);
        return result;
    }

    private void simulateLatency() {
        if (maxLatencyMs <= 0) {
            return;
        }
        try {
            int delay = random.nextInt(maxLatencyMs + 1);
            Thread.sleep(delay);
            log.debug("PSP Stub: Simulated {}ms network delay", delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
