package com.safepocket.subscriptions.service;

import com.safepocket.subscriptions.config.SubscriptionProperties;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.model.SubscriptionDecision;
import com.safepocket.subscriptions.model.SubscriptionNotFoundException;
import com.safepocket.subscriptions.model.SubscriptionStatus;
import com.safepocket.subscriptions.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SubscriptionDecisionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionDecisionService.class);

    static final String CANCELLED_NOTE = "Cancelled via assistant";
    static final String RENEWED_NOTE = "Renewed via assistant";

    private final SubscriptionRepository subscriptionRepository;
    private final SavingsTracker savingsTracker;
    private final int renewalPeriodDays;

    public SubscriptionDecisionService(
            SubscriptionRepository subscriptionRepository,
            SavingsTracker savingsTracker,
            SubscriptionProperties properties
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.savingsTracker = savingsTracker;
        this.renewalPeriodDays = properties.detection().renewalPeriodDays();
    }

    public Subscription apply(long subscriptionId, SubscriptionDecision decision) {
        Subscription current = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
        Subscription updated = switch (decision) {
            case CANCEL -> cancel(current);
            case RENEW -> renew(current);
        };
        log.info("Decision {} applied to subscription id={} status {} -> {}",
                decision, subscriptionId, current.status(), updated.status());
        return subscriptionRepository.save(updated);
    }

    private Subscription cancel(Subscription subscription) {
        if (!subscription.isCancelled()) {
            savingsTracker.record(subscription.monthlyCost());
        }
        return subscription.withStatus(SubscriptionStatus.CANCELLED, CANCELLED_NOTE);
    }

    private Subscription renew(Subscription subscription) {
        return subscription.withRenewal(
                SubscriptionStatus.ACTIVE,
                subscription.nextRenewalDate().plusDays(renewalPeriodDays),
                RENEWED_NOTE
        );
    }
}
