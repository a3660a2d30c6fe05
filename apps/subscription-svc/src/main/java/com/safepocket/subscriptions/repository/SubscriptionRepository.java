package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.Subscription;
import java.util.List;
import java.util.Optional;

public interface SubscriptionRepository {

    /**
     * Next identifier from a monotonically increasing sequence starting at 1. Never reused.
     */
    long nextId();

    Subscription save(Subscription subscription);

    Optional<Subscription> findById(long subscriptionId);

    /**
     * All subscriptions in identifier order, cancelled ones included.
     */
    List<Subscription> findAll();
}
