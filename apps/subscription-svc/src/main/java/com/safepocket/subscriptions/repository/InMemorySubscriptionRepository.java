package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.Subscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySubscriptionRepository implements SubscriptionRepository {

    private final Map<Long, Subscription> storage = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long nextId() {
        return sequence.incrementAndGet();
    }

    @Override
    public Subscription save(Subscription subscription) {
        storage.put(subscription.id(), subscription);
        return subscription;
    }

    @Override
    public Optional<Subscription> findById(long subscriptionId) {
        return Optional.ofNullable(storage.get(subscriptionId));
    }

    @Override
    public List<Subscription> findAll() {
        return new ArrayList<>(storage.values());
    }
}
