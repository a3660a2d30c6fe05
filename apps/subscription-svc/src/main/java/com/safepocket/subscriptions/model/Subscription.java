package com.safepocket.subscriptions.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

public record Subscription(
        long id,
        String provider,
        String reference,
        BigDecimal monthlyCost,
        LocalDate nextRenewalDate,
        SubscriptionStatus status,
        Instant lastTransactionAt,
        Optional<String> notes
) {
    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public boolean isCancelled() {
        return status == SubscriptionStatus.CANCELLED;
    }

    public Subscription withBilling(BigDecimal newMonthlyCost, LocalDate newNextRenewalDate, Instant newLastTransactionAt) {
        return new Subscription(
                id,
                provider,
                reference,
                newMonthlyCost,
                newNextRenewalDate,
                status,
                newLastTransactionAt,
                notes
        );
    }

    public Subscription withStatus(SubscriptionStatus newStatus, String newNotes) {
        return new Subscription(
                id,
                provider,
                reference,
                monthlyCost,
                nextRenewalDate,
                newStatus,
                lastTransactionAt,
                Optional.ofNullable(newNotes)
        );
    }

    public Subscription withRenewal(SubscriptionStatus newStatus, LocalDate newNextRenewalDate, String newNotes) {
        return new Subscription(
                id,
                provider,
                reference,
                monthlyCost,
                newNextRenewalDate,
                newStatus,
                lastTransactionAt,
                Optional.ofNullable(newNotes)
        );
    }

    public Subscription withNotes(String newNotes) {
        return new Subscription(
                id,
                provider,
                reference,
                monthlyCost,
                nextRenewalDate,
                status,
                lastTransactionAt,
                Optional.ofNullable(newNotes)
        );
    }
}
