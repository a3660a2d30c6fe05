package com.safepocket.subscriptions.detection;

import com.safepocket.subscriptions.config.SubscriptionProperties;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.model.SubscriptionStatus;
import com.safepocket.subscriptions.model.TransactionRecord;
import com.safepocket.subscriptions.repository.SubscriptionRepository;
import com.safepocket.subscriptions.repository.TransactionLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recognises monthly charges by comparing a transaction with the previous one that shares its
 * description key. A key cluster maps to at most one subscription: the first detection creates it,
 * every later detection updates it.
 */
@Component
public class RecurringChargeMatcher {

    private static final Logger log = LoggerFactory.getLogger(RecurringChargeMatcher.class);

    private final TransactionLedger ledger;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionProperties.Detection detection;

    public RecurringChargeMatcher(
            TransactionLedger ledger,
            SubscriptionRepository subscriptionRepository,
            SubscriptionProperties properties
    ) {
        this.ledger = ledger;
        this.subscriptionRepository = subscriptionRepository;
        this.detection = properties.detection();
    }

    /**
     * Evaluates a transaction that has already been appended to the ledger.
     *
     * @return the created or updated subscription, empty when no cadence was detected
     */
    public Optional<Subscription> match(TransactionRecord transaction) {
        List<TransactionRecord> similar = ledger.findByDescriptionKey(transaction.descriptionKey());
        if (similar.size() < 2) {
            return Optional.empty();
        }
        TransactionRecord latest = similar.get(similar.size() - 1);
        TransactionRecord previous = similar.get(similar.size() - 2);
        long intervalDays = Duration.between(previous.occurredAt(), latest.occurredAt()).toDays();
        if (!detection.isRecurringInterval(intervalDays)) {
            log.debug("Key '{}' interval {}d outside [{}, {}], no cadence", transaction.descriptionKey(),
                    intervalDays, detection.minIntervalDays(), detection.maxIntervalDays());
            return Optional.empty();
        }

        OptionalLong existingId = clusterSubscriptionId(previous, similar);
        if (existingId.isEmpty()) {
            return Optional.of(createSubscription(similar));
        }
        long subscriptionId = existingId.getAsLong();
        ledger.link(transaction.id(), subscriptionId);
        return Optional.of(refreshSubscription(subscriptionId));
    }

    private OptionalLong clusterSubscriptionId(TransactionRecord previous, List<TransactionRecord> similar) {
        if (previous.isLinked()) {
            return OptionalLong.of(previous.subscriptionId().get());
        }
        // the predecessor may have missed the cadence window while older charges were already linked
        return similar.stream()
                .map(TransactionRecord::subscriptionId)
                .flatMap(Optional::stream)
                .mapToLong(Long::longValue)
                .findFirst();
    }

    private Subscription createSubscription(List<TransactionRecord> similar) {
        TransactionRecord latest = similar.get(similar.size() - 1);
        Subscription subscription = new Subscription(
                subscriptionRepository.nextId(),
                SubscriptionText.deriveProviderName(latest.description()),
                latest.description(),
                averageMagnitude(similar),
                renewalAfter(latest),
                SubscriptionStatus.ACTIVE,
                latest.occurredAt(),
                Optional.empty()
        );
        subscriptionRepository.save(subscription);
        for (TransactionRecord tx : similar) {
            ledger.link(tx.id(), subscription.id());
        }
        log.info("Detected subscription id={} provider={} monthlyCost={} from {} charges",
                subscription.id(), subscription.provider(), subscription.monthlyCost(), similar.size());
        return subscription;
    }

    private Subscription refreshSubscription(long subscriptionId) {
        Subscription current = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new IllegalStateException("Linked subscription missing: " + subscriptionId));
        List<TransactionRecord> linked = ledger.findBySubscriptionId(subscriptionId);
        TransactionRecord latest = linked.stream()
                .max(Comparator.comparing(TransactionRecord::occurredAt))
                .orElseThrow(() -> new IllegalStateException("Subscription without transactions: " + subscriptionId));
        Subscription updated = current.withBilling(averageMagnitude(linked), renewalAfter(latest), latest.occurredAt());
        log.debug("Updated subscription id={} from {} linked charges, next renewal {}",
                subscriptionId, linked.size(), updated.nextRenewalDate());
        return subscriptionRepository.save(updated);
    }

    private LocalDate renewalAfter(TransactionRecord transaction) {
        return transaction.occurredAt()
                .atZone(ZoneOffset.UTC)
                .toLocalDate()
                .plusDays(detection.renewalPeriodDays());
    }

    private static BigDecimal averageMagnitude(List<TransactionRecord> transactions) {
        BigDecimal total = transactions.stream()
                .map(TransactionRecord::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(transactions.size()), 2, RoundingMode.HALF_UP).abs();
    }
}
