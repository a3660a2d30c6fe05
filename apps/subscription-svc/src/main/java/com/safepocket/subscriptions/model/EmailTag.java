package com.safepocket.subscriptions.model;

public enum EmailTag {
    RENEWAL_NOTICE("renewal_notice"),
    PRICE_INCREASE("price_increase");

    private final String value;

    EmailTag(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
