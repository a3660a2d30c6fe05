package com.safepocket.subscriptions.service;

import com.safepocket.subscriptions.detection.RecurringChargeMatcher;
import com.safepocket.subscriptions.detection.SubscriptionText;
import com.safepocket.subscriptions.email.EmailClassifier;
import com.safepocket.subscriptions.email.EmailSignalCorrelator;
import com.safepocket.subscriptions.model.DashboardSummary;
import com.safepocket.subscriptions.model.EmailRecord;
import com.safepocket.subscriptions.model.EmailTag;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.model.SubscriptionDecision;
import com.safepocket.subscriptions.model.TransactionRecord;
import com.safepocket.subscriptions.repository.EmailRepository;
import com.safepocket.subscriptions.repository.SubscriptionRepository;
import com.safepocket.subscriptions.repository.TransactionLedger;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every inbound event. Ledger, registry and savings state are only touched while
 * holding {@code monitor}; the scan-then-write sequence of matching must not interleave.
 */
@Service
public class SubscriptionAssistantService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionAssistantService.class);

    private final Object monitor = new Object();

    private final TransactionLedger ledger;
    private final SubscriptionRepository subscriptionRepository;
    private final EmailRepository emailRepository;
    private final RecurringChargeMatcher matcher;
    private final EmailClassifier emailClassifier;
    private final EmailSignalCorrelator emailSignalCorrelator;
    private final SubscriptionDecisionService decisionService;
    private final DashboardService dashboardService;

    public SubscriptionAssistantService(
            TransactionLedger ledger,
            SubscriptionRepository subscriptionRepository,
            EmailRepository emailRepository,
            RecurringChargeMatcher matcher,
            EmailClassifier emailClassifier,
            EmailSignalCorrelator emailSignalCorrelator,
            SubscriptionDecisionService decisionService,
            DashboardService dashboardService
    ) {
        this.ledger = ledger;
        this.subscriptionRepository = subscriptionRepository;
        this.emailRepository = emailRepository;
        this.matcher = matcher;
        this.emailClassifier = emailClassifier;
        this.emailSignalCorrelator = emailSignalCorrelator;
        this.decisionService = decisionService;
        this.dashboardService = dashboardService;
    }

    public Optional<Subscription> registerTransaction(String description, BigDecimal amount, Instant occurredAt) {
        TransactionRecord record = new TransactionRecord(
                UUID.randomUUID(),
                SubscriptionText.normalizeDescription(description),
                description,
                amount,
                occurredAt,
                Optional.empty()
        );
        synchronized (monitor) {
            ledger.append(record);
            log.debug("Recorded transaction id={} key='{}' amount={} at {}",
                    record.id(), record.descriptionKey(), amount, occurredAt);
            return matcher.match(record);
        }
    }

    public EmailRecord ingestEmail(String subject, String body, Instant receivedAt) {
        Set<EmailTag> tags = emailClassifier.classify(subject, body);
        EmailRecord email = new EmailRecord(UUID.randomUUID(), subject, body, receivedAt, tags);
        synchronized (monitor) {
            emailRepository.save(email);
            emailSignalCorrelator.correlate(email);
        }
        log.debug("Ingested email id={} tags={}", email.id(), tags);
        return email;
    }

    public Subscription applyDecision(long subscriptionId, SubscriptionDecision decision) {
        synchronized (monitor) {
            return decisionService.apply(subscriptionId, decision);
        }
    }

    public DashboardSummary dashboard() {
        synchronized (monitor) {
            return dashboardService.summarize();
        }
    }

    public DashboardSummary dashboard(int horizonDays) {
        synchronized (monitor) {
            return dashboardService.summarize(horizonDays);
        }
    }

    public List<Subscription> listSubscriptions() {
        synchronized (monitor) {
            return subscriptionRepository.findAll();
        }
    }

    public Optional<Subscription> findSubscription(long subscriptionId) {
        synchronized (monitor) {
            return subscriptionRepository.findById(subscriptionId);
        }
    }

    public List<EmailRecord> listEmails() {
        synchronized (monitor) {
            return emailRepository.findAll();
        }
    }
}
