package com.safepocket.subscriptions.controller;

import com.safepocket.subscriptions.controller.dto.SubscriptionResponseDto;
import com.safepocket.subscriptions.model.Subscription;
import java.util.List;
import java.util.Locale;

final class SubscriptionMapper {

    private SubscriptionMapper() {
    }

    static SubscriptionResponseDto toDto(Subscription subscription) {
        return new SubscriptionResponseDto(
                subscription.id(),
                subscription.provider(),
                subscription.reference(),
                subscription.monthlyCost(),
                subscription.nextRenewalDate(),
                subscription.status().name().toLowerCase(Locale.ROOT),
                subscription.lastTransactionAt(),
                subscription.notes().orElse(null)
        );
    }

    static List<SubscriptionResponseDto> toDtos(List<Subscription> subscriptions) {
        return subscriptions.stream()
                .map(SubscriptionMapper::toDto)
                .toList();
    }
}
