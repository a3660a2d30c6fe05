package com.safepocket.subscriptions.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "safepocket.subscriptions")
public record SubscriptionProperties(
        Detection detection,
        Email email,
        Dashboard dashboard
) {

    @ConstructorBinding
    public SubscriptionProperties {
        // every section is optional; missing ones fall back to the built-in cadence rules
        if (detection == null) {
            detection = Detection.defaults();
        }
        if (email == null) {
            email = Email.defaults();
        }
        if (dashboard == null) {
            dashboard = Dashboard.defaults();
        }
    }

    public static SubscriptionProperties defaults() {
        return new SubscriptionProperties(null, null, null);
    }

    public record Detection(Integer minIntervalDays, Integer maxIntervalDays, Integer renewalPeriodDays) {
        public Detection {
            if (minIntervalDays == null) {
                minIntervalDays = 27;
            }
            if (maxIntervalDays == null) {
                maxIntervalDays = 33;
            }
            if (renewalPeriodDays == null) {
                renewalPeriodDays = 30;
            }
            if (minIntervalDays <= 0) {
                throw new IllegalArgumentException("minIntervalDays must be positive");
            }
            if (maxIntervalDays < minIntervalDays) {
                throw new IllegalArgumentException("maxIntervalDays must not be lower than minIntervalDays");
            }
            if (renewalPeriodDays <= 0) {
                throw new IllegalArgumentException("renewalPeriodDays must be positive");
            }
        }

        public static Detection defaults() {
            return new Detection(null, null, null);
        }

        public boolean isRecurringInterval(long days) {
            return days >= minIntervalDays && days <= maxIntervalDays;
        }
    }

    public record Email(Integer reminderLeadDays) {
        public Email {
            if (reminderLeadDays == null) {
                reminderLeadDays = 7;
            }
            if (reminderLeadDays < 0) {
                throw new IllegalArgumentException("reminderLeadDays must not be negative");
            }
        }

        public static Email defaults() {
            return new Email(null);
        }
    }

    public record Dashboard(Integer horizonDays) {
        public Dashboard {
            if (horizonDays == null) {
                horizonDays = 14;
            }
            if (horizonDays < 0) {
                throw new IllegalArgumentException("horizonDays must not be negative");
            }
        }

        public static Dashboard defaults() {
            return new Dashboard(null);
        }
    }
}
