package com.safepocket.subscriptions.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A bank-statement line as stored in the ledger. {@code subscriptionId} is assigned at most once.
 */
public record TransactionRecord(
        UUID id,
        String descriptionKey,
        String description,
        BigDecimal amount,
        Instant occurredAt,
        Optional<Long> subscriptionId
) {
    public boolean isLinked() {
        return subscriptionId.isPresent();
    }

    public TransactionRecord withSubscriptionId(long newSubscriptionId) {
        return new TransactionRecord(
                id,
                descriptionKey,
                description,
                amount,
                occurredAt,
                Optional.of(newSubscriptionId)
        );
    }
}
