package com.safepocket.subscriptions.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record EmailRecord(
        UUID id,
        String subject,
        String body,
        Instant receivedAt,
        Set<EmailTag> tags
) {
    public EmailRecord {
        tags = Set.copyOf(tags);
    }

    public boolean hasTag(EmailTag tag) {
        return tags.contains(tag);
    }
}
