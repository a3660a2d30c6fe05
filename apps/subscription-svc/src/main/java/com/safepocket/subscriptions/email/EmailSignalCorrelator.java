package com.safepocket.subscriptions.email;

import com.safepocket.subscriptions.config.SubscriptionProperties;
import com.safepocket.subscriptions.detection.SubscriptionText;
import com.safepocket.subscriptions.model.EmailRecord;
import com.safepocket.subscriptions.model.EmailTag;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.repository.SubscriptionRepository;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EmailSignalCorrelator {

    private static final Logger log = LoggerFactory.getLogger(EmailSignalCorrelator.class);

    static final String RENEWAL_NOTE = "Renewal reminder synced from email";
    static final String PRICE_INCREASE_NOTE_PREFIX = "Price increase detected on ";

    private final SubscriptionRepository subscriptionRepository;
    private final int reminderLeadDays;

    public EmailSignalCorrelator(SubscriptionRepository subscriptionRepository, SubscriptionProperties properties) {
        this.subscriptionRepository = subscriptionRepository;
        this.reminderLeadDays = properties.email().reminderLeadDays();
    }

    public void correlate(EmailRecord email) {
        LocalDate emailDate = email.receivedAt().atZone(ZoneOffset.UTC).toLocalDate();
        if (email.hasTag(EmailTag.PRICE_INCREASE)) {
            applyPriceIncrease(emailDate);
        }
        if (email.hasTag(EmailTag.RENEWAL_NOTICE)) {
            applyRenewalNotice(email.subject(), emailDate);
        }
    }

    // Not scoped to the sender's provider: every subscription is annotated.
    private void applyPriceIncrease(LocalDate emailDate) {
        String note = PRICE_INCREASE_NOTE_PREFIX + emailDate;
        List<Subscription> subscriptions = subscriptionRepository.findAll();
        subscriptions.forEach(subscription -> subscriptionRepository.save(subscription.withNotes(note)));
        log.info("Price increase signal on {} annotated {} subscriptions", emailDate, subscriptions.size());
    }

    private void applyRenewalNotice(String subject, LocalDate emailDate) {
        String provider = SubscriptionText.deriveProviderName(subject).toLowerCase(Locale.ROOT);
        LocalDate renewalDate = emailDate.plusDays(reminderLeadDays);
        List<Subscription> matches = subscriptionRepository.findAll().stream()
                .filter(subscription -> subscription.provider().toLowerCase(Locale.ROOT).equals(provider))
                .toList();
        if (matches.isEmpty()) {
            log.debug("Renewal notice for provider '{}' matched no subscription", provider);
            return;
        }
        for (Subscription subscription : matches) {
            subscriptionRepository.save(subscription.withRenewal(subscription.status(), renewalDate, RENEWAL_NOTE));
        }
        log.info("Renewal notice for provider '{}' moved {} subscriptions to {}", provider, matches.size(), renewalDate);
    }
}
