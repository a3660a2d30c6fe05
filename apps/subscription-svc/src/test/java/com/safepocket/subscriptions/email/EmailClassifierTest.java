package com.safepocket.subscriptions.email;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.subscriptions.model.EmailTag;
import org.junit.jupiter.api.Test;

class EmailClassifierTest {

    private final EmailClassifier classifier = new EmailClassifier();

    @Test
    void tagsRenewalNoticeFromSubjectOrBody() {
        assertThat(classifier.classify("Disney+ renewal reminder", "See you soon"))
                .containsExactly(EmailTag.RENEWAL_NOTICE);
        assertThat(classifier.classify("Hello", "Your plan will RENEW on Monday"))
                .containsExactly(EmailTag.RENEWAL_NOTICE);
        assertThat(classifier.classify("Dags att förnya", ""))
                .containsExactly(EmailTag.RENEWAL_NOTICE);
    }

    @Test
    void tagsPriceIncrease() {
        assertThat(classifier.classify("Important", "A price increase applies from May"))
                .containsExactly(EmailTag.PRICE_INCREASE);
        assertThat(classifier.classify("Priset höjs", "Ny månadskostnad"))
                .containsExactly(EmailTag.PRICE_INCREASE);
    }

    @Test
    void tagsAreIndependent() {
        assertThat(classifier.classify("Renewal notice", "You will be billed at a higher rate"))
                .containsExactlyInAnyOrder(EmailTag.RENEWAL_NOTICE, EmailTag.PRICE_INCREASE);
        assertThat(classifier.classify("Weekly newsletter", "Nothing to see here")).isEmpty();
    }

    @Test
    void keywordMayStraddleSubjectAndBody() {
        // subject and body are joined with a single space before matching
        assertThat(classifier.classify("Notice of price", "increase")).containsExactly(EmailTag.PRICE_INCREASE);
    }
}
