package com.safepocket.subscriptions.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SubscriptionPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        SubscriptionProperties props = new SubscriptionProperties(null, null, null);

        assertThat(props.detection().minIntervalDays()).isEqualTo(27);
        assertThat(props.detection().maxIntervalDays()).isEqualTo(33);
        assertThat(props.detection().renewalPeriodDays()).isEqualTo(30);
        assertThat(props.email().reminderLeadDays()).isEqualTo(7);
        assertThat(props.dashboard().horizonDays()).isEqualTo(14);
    }

    @Test
    void recurringIntervalIsInclusive() {
        SubscriptionProperties.Detection detection = SubscriptionProperties.Detection.defaults();

        assertThat(detection.isRecurringInterval(26)).isFalse();
        assertThat(detection.isRecurringInterval(27)).isTrue();
        assertThat(detection.isRecurringInterval(33)).isTrue();
        assertThat(detection.isRecurringInterval(34)).isFalse();
    }

    @Test
    void rejectsInvertedWindow() {
        assertThatThrownBy(() -> new SubscriptionProperties.Detection(40, 30, 30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIntervalDays");
    }

    @Test
    void rejectsInvalidPeriods() {
        assertThatThrownBy(() -> new SubscriptionProperties.Detection(27, 33, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("renewalPeriodDays");
        assertThatThrownBy(() -> new SubscriptionProperties.Email(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SubscriptionProperties.Dashboard(-3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("horizonDays");
    }
}
