package com.acme.streams.sample;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderEvent(
    String orderId, String customerId, String status, BigDecimal amount, Instant occurredAt) {}
