package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.TransactionRecord;
import java.util.List;
import java.util.UUID;

/**
 * Append-only transaction history. Records are never removed; the only permitted change is
 * attaching a subscription id to a record that has none.
 */
public interface TransactionLedger {

    TransactionRecord append(TransactionRecord transaction);

    /**
     * Same-key records ordered by {@code occurredAt} ascending; ties keep ledger order.
     */
    List<TransactionRecord> findByDescriptionKey(String descriptionKey);

    List<TransactionRecord> findBySubscriptionId(long subscriptionId);

    /**
     * @throws IllegalStateException when the record is already linked to another subscription
     */
    TransactionRecord link(UUID transactionId, long subscriptionId);

    List<TransactionRecord> findAll();
}
