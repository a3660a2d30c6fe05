package com.safepocket.subscriptions.email;

import com.safepocket.subscriptions.model.EmailTag;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Keyword tagging of inbox mail. English and Scandinavian phrasings are recognised.
 */
@Component
public class EmailClassifier {

    private static final List<String> RENEWAL_KEYWORDS = List.of("renew", "förnya", "fornyelse", "renewal");
    private static final List<String> PRICE_INCREASE_KEYWORDS = List.of("price increase", "höjs", "higher rate");

    public Set<EmailTag> classify(String subject, String body) {
        String text = (nullToEmpty(subject) + " " + nullToEmpty(body)).toLowerCase(Locale.ROOT);
        Set<EmailTag> tags = EnumSet.noneOf(EmailTag.class);
        if (containsAny(text, RENEWAL_KEYWORDS)) {
            tags.add(EmailTag.RENEWAL_NOTICE);
        }
        if (containsAny(text, PRICE_INCREASE_KEYWORDS)) {
            tags.add(EmailTag.PRICE_INCREASE);
        }
        return tags;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
