package com.safepocket.subscriptions.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record DashboardResponseDto(
        int activeSubscriptions,
        int cancelledSubscriptions,
        BigDecimal monthlyCommitment,
        BigDecimal totalSavings,
        List<SubscriptionResponseDto> upcomingRenewals,
        String traceId
) {
}
