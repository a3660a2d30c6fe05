package com.safepocket.subscriptions.model;

public enum SubscriptionStatus {
    ACTIVE,
    CANCELLED
}
