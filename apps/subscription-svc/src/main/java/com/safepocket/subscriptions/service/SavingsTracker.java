package com.safepocket.subscriptions.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Running total of monthly costs avoided through cancellations. Never decreases.
 */
@Component
public class SavingsTracker {

    private BigDecimal total = BigDecimal.ZERO;

    public void record(BigDecimal monthlyCost) {
        if (monthlyCost.signum() < 0) {
            throw new IllegalArgumentException("monthlyCost must not be negative");
        }
        total = total.add(monthlyCost);
    }

    public BigDecimal total() {
        return total.setScale(2, RoundingMode.HALF_UP);
    }
}
