package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.TransactionRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

/**
 * Not thread-safe on its own; callers serialise access through {@code SubscriptionAssistantService}.
 */
@Repository
public class InMemoryTransactionLedger implements TransactionLedger {

    private final List<TransactionRecord> entries = new ArrayList<>();
    private final Map<UUID, Integer> positions = new HashMap<>();

    @Override
    public TransactionRecord append(TransactionRecord transaction) {
        if (positions.containsKey(transaction.id())) {
            throw new IllegalArgumentException("Transaction already recorded: " + transaction.id());
        }
        positions.put(transaction.id(), entries.size());
        entries.add(transaction);
        return transaction;
    }

    @Override
    public List<TransactionRecord> findByDescriptionKey(String descriptionKey) {
        return entries.stream()
                .filter(tx -> tx.descriptionKey().equals(descriptionKey))
                .sorted(Comparator.comparing(TransactionRecord::occurredAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<TransactionRecord> findBySubscriptionId(long subscriptionId) {
        return entries.stream()
                .filter(tx -> tx.subscriptionId().filter(id -> id == subscriptionId).isPresent())
                .sorted(Comparator.comparing(TransactionRecord::occurredAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public TransactionRecord link(UUID transactionId, long subscriptionId) {
        Integer position = positions.get(transactionId);
        if (position == null) {
            throw new IllegalArgumentException("Transaction not found: " + transactionId);
        }
        TransactionRecord current = entries.get(position);
        if (current.isLinked()) {
            long existing = current.subscriptionId().get();
            if (existing != subscriptionId) {
                throw new IllegalStateException("Transaction " + transactionId
                        + " is already linked to subscription " + existing);
            }
            return current;
        }
        TransactionRecord linked = current.withSubscriptionId(subscriptionId);
        entries.set(position, linked);
        return linked;
    }

    @Override
    public List<TransactionRecord> findAll() {
        return List.copyOf(entries);
    }
}
