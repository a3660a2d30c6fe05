package com.safepocket.subscriptions.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionResponseDto(
        long id,
        String provider,
        String reference,
        BigDecimal monthlyCost,
        LocalDate nextRenewalDate,
        String status,
        Instant lastTransactionAt,
        String notes
) {
}
