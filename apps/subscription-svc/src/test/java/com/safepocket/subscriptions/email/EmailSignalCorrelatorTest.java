package com.safepocket.subscriptions.email;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.subscriptions.config.SubscriptionProperties;
import com.safepocket.subscriptions.model.EmailRecord;
import com.safepocket.subscriptions.model.EmailTag;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.model.SubscriptionStatus;
import com.safepocket.subscriptions.repository.InMemorySubscriptionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmailSignalCorrelatorTest {

    private static final Instant RECEIVED_AT = Instant.parse("2024-03-10T08:30:00Z");
    private static final LocalDate ORIGINAL_RENEWAL = LocalDate.of(2024, 4, 1);

    private InMemorySubscriptionRepository subscriptionRepository;
    private EmailSignalCorrelator correlator;

    @BeforeEach
    void setUp() {
        subscriptionRepository = new InMemorySubscriptionRepository();
        correlator = new EmailSignalCorrelator(subscriptionRepository, SubscriptionProperties.defaults());
    }

    @Test
    void priceIncreaseAnnotatesEverySubscription() {
        Subscription disney = subscription("Disney", SubscriptionStatus.ACTIVE);
        Subscription netflix = subscription("Netflix", SubscriptionStatus.CANCELLED);

        correlator.correlate(email("Netflix prices", EnumSet.of(EmailTag.PRICE_INCREASE)));

        assertThat(subscriptionRepository.findAll())
                .extracting(Subscription::notes)
                .containsOnly(Optional.of("Price increase detected on 2024-03-10"));
        assertThat(subscriptionRepository.findById(netflix.id()).orElseThrow().status())
                .isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(subscriptionRepository.findById(disney.id()).orElseThrow().nextRenewalDate())
                .isEqualTo(ORIGINAL_RENEWAL);
    }

    @Test
    void renewalNoticeMovesMatchingProviderOnly() {
        Subscription disney = subscription("Disney", SubscriptionStatus.ACTIVE);
        Subscription spotify = subscription("Spotify", SubscriptionStatus.ACTIVE);

        correlator.correlate(email("DISNEY+ renewal reminder", EnumSet.of(EmailTag.RENEWAL_NOTICE)));

        Subscription updated = subscriptionRepository.findById(disney.id()).orElseThrow();
        assertThat(updated.nextRenewalDate()).isEqualTo(LocalDate.of(2024, 3, 17));
        assertThat(updated.notes()).contains("Renewal reminder synced from email");
        assertThat(subscriptionRepository.findById(spotify.id()).orElseThrow()).isEqualTo(spotify);
    }

    @Test
    void renewalNoticeKeepsStatusOfCancelledMatch() {
        Subscription disney = subscription("Disney", SubscriptionStatus.CANCELLED);

        correlator.correlate(email("Disney+ renewal reminder", EnumSet.of(EmailTag.RENEWAL_NOTICE)));

        Subscription updated = subscriptionRepository.findById(disney.id()).orElseThrow();
        assertThat(updated.status()).isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(updated.nextRenewalDate()).isEqualTo(LocalDate.of(2024, 3, 17));
    }

    @Test
    void renewalNoticeWithoutMatchChangesNothing() {
        Subscription spotify = subscription("Spotify", SubscriptionStatus.ACTIVE);

        correlator.correlate(email("HBO renewal", EnumSet.of(EmailTag.RENEWAL_NOTICE)));

        assertThat(subscriptionRepository.findAll()).containsExactly(spotify);
    }

    @Test
    void renewalNoteWinsWhenBothSignalsArrive() {
        Subscription disney = subscription("Disney", SubscriptionStatus.ACTIVE);
        Subscription spotify = subscription("Spotify", SubscriptionStatus.ACTIVE);

        correlator.correlate(email("Disney+ renewal at a higher rate",
                EnumSet.of(EmailTag.RENEWAL_NOTICE, EmailTag.PRICE_INCREASE)));

        assertThat(subscriptionRepository.findById(disney.id()).orElseThrow().notes())
                .contains("Renewal reminder synced from email");
        assertThat(subscriptionRepository.findById(spotify.id()).orElseThrow().notes())
                .contains("Price increase detected on 2024-03-10");
    }

    @Test
    void untaggedEmailIsIgnored() {
        Subscription spotify = subscription("Spotify", SubscriptionStatus.ACTIVE);

        correlator.correlate(email("Spotify Wrapped", Set.of()));

        assertThat(subscriptionRepository.findAll()).containsExactly(spotify);
    }

    private Subscription subscription(String provider, SubscriptionStatus status) {
        return subscriptionRepository.save(new Subscription(
                subscriptionRepository.nextId(),
                provider,
                provider + " order",
                new BigDecimal("59.00"),
                ORIGINAL_RENEWAL,
                status,
                Instant.parse("2024-03-02T09:00:00Z"),
                Optional.empty()
        ));
    }

    private EmailRecord email(String subject, Set<EmailTag> tags) {
        return new EmailRecord(UUID.randomUUID(), subject, "body", RECEIVED_AT, tags);
    }
}
