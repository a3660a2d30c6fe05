package com.safepocket.subscriptions.model;

import java.math.BigDecimal;
import java.util.List;

public record DashboardSummary(
        int activeSubscriptions,
        int cancelledSubscriptions,
        BigDecimal monthlyCommitment,
        BigDecimal totalSavings,
        List<Subscription> upcomingRenewals
) {
}
