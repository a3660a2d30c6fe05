package com.safepocket.subscriptions.model;

public class SubscriptionNotFoundException extends RuntimeException {

    private final long subscriptionId;

    public SubscriptionNotFoundException(long subscriptionId) {
        super("Subscription not found: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    public long getSubscriptionId() {
        return subscriptionId;
    }
}
