package com.safepocket.subscriptions.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SavingsTrackerTest {

    @Test
    void totalIsRoundedToCents() {
        SavingsTracker tracker = new SavingsTracker();
        tracker.record(new BigDecimal("10.005"));
        tracker.record(new BigDecimal("0.10"));

        assertThat(tracker.total()).isEqualByComparingTo("10.11");
        assertThat(tracker.total().scale()).isEqualTo(2);
    }

    @Test
    void rejectsNegativeAmounts() {
        SavingsTracker tracker = new SavingsTracker();

        assertThatThrownBy(() -> tracker.record(new BigDecimal("-1.00")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.total()).isEqualByComparingTo("0.00");
    }
}
