package com.safepocket.subscriptions.model;

import java.util.Arrays;

public enum SubscriptionDecision {
    CANCEL("cancel"),
    RENEW("renew");

    private final String value;

    SubscriptionDecision(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SubscriptionDecision fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("decision must be provided");
        }
        return Arrays.stream(values())
                .filter(decision -> decision.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown decision: " + value));
    }
}
