package com.safepocket.subscriptions.service;

import com.safepocket.subscriptions.config.SubscriptionProperties;
import com.safepocket.subscriptions.model.DashboardSummary;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.repository.SubscriptionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class DashboardService {

    private final SubscriptionRepository subscriptionRepository;
    private final SavingsTracker savingsTracker;
    private final Clock clock;
    private final int defaultHorizonDays;

    public DashboardService(
            SubscriptionRepository subscriptionRepository,
            SavingsTracker savingsTracker,
            Clock clock,
            SubscriptionProperties properties
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.savingsTracker = savingsTracker;
        this.clock = clock;
        this.defaultHorizonDays = properties.dashboard().horizonDays();
    }

    public DashboardSummary summarize() {
        return summarize(defaultHorizonDays);
    }

    public DashboardSummary summarize(int horizonDays) {
        if (horizonDays < 0) {
            throw new IllegalArgumentException("horizonDays must not be negative");
        }
        List<Subscription> subscriptions = subscriptionRepository.findAll();
        List<Subscription> active = subscriptions.stream()
                .filter(Subscription::isActive)
                .toList();
        int cancelled = (int) subscriptions.stream()
                .filter(Subscription::isCancelled)
                .count();
        LocalDate cutoff = LocalDate.now(clock).plusDays(horizonDays);
        // sorted() is stable on ordered streams, ties keep identifier order
        List<Subscription> upcoming = active.stream()
                .filter(subscription -> !subscription.nextRenewalDate().isAfter(cutoff))
                .sorted(Comparator.comparing(Subscription::nextRenewalDate))
                .toList();
        BigDecimal commitment = active.stream()
                .map(Subscription::monthlyCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        return new DashboardSummary(active.size(), cancelled, commitment, savingsTracker.total(), upcoming);
    }
}
