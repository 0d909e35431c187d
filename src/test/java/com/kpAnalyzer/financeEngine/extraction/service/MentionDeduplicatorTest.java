package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.THRESHOLDS;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.mention;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MentionDeduplicator Tests")
class MentionDeduplicatorTest {

    private final MentionDeduplicator deduplicator = new MentionDeduplicator(THRESHOLDS);

    @Test
    @DisplayName("Should keep the first of two near-identical mentions")
    void shouldKeepFirstDuplicate() {
        CurrencyMention first = mention(CurrencyCode.USD, "1000", 0);
        CurrencyMention second = mention(CurrencyCode.USD, "1005", 20);

        assertThat(deduplicator.deduplicate(List.of(second, first))).containsExactly(first);
    }

    @Test
    @DisplayName("Should keep mentions that are far apart")
    void shouldKeepDistantMentions() {
        CurrencyMention first = mention(CurrencyCode.USD, "1000", 0);
        CurrencyMention second = mention(CurrencyCode.USD, "1000", 60);

        assertThat(deduplicator.deduplicate(List.of(first, second))).containsExactly(first, second);
    }

    @Test
    @DisplayName("Should keep mentions of different currencies or amounts")
    void shouldKeepDifferentMentions() {
        CurrencyMention dollars = mention(CurrencyCode.USD, "1000", 0);
        CurrencyMention euros = mention(CurrencyCode.EUR, "1000", 10);
        CurrencyMention moreDollars = mention(CurrencyCode.USD, "1100", 20);

        assertThat(deduplicator.deduplicate(List.of(dollars, euros, moreDollars)))
                .containsExactly(dollars, euros, moreDollars);
    }

    @Test
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent() {
        List<CurrencyMention> once = deduplicator.deduplicate(List.of(
                mention(CurrencyCode.RUB, "500", 0),
                mention(CurrencyCode.RUB, "501", 10),
                mention(CurrencyCode.RUB, "500", 45),
                mention(CurrencyCode.RUB, "500", 100)));

        assertThat(once).hasSize(2);
        assertThat(deduplicator.deduplicate(once)).isEqualTo(once);
    }
}
