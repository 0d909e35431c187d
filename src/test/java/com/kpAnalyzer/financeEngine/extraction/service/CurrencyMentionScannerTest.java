package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.PATTERNS;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.THRESHOLDS;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CurrencyMentionScanner Tests")
class CurrencyMentionScannerTest {

    private final CurrencyMentionScanner scanner = new CurrencyMentionScanner(PATTERNS, THRESHOLDS);

    @Nested
    @DisplayName("Amount Formats")
    class AmountFormatTests {

        @Test
        @DisplayName("Should parse European separators with a suffix symbol")
        void shouldParseEuropeanSeparators() {
            List<CurrencyMention> mentions = scanner.scan("1.000,50 сом");

            assertThat(mentions).hasSize(1);
            assertThat(mentions.get(0).getCode()).isEqualTo(CurrencyCode.KGS);
            assertThat(mentions.get(0).getAmount()).isEqualByComparingTo("1000.50");
            assertThat(mentions.get(0).getOriginalText()).isEqualTo("1.000,50 сом");
        }

        @Test
        @DisplayName("Should parse a prefixed dollar amount")
        void shouldParsePrefixedDollarAmount() {
            List<CurrencyMention> mentions = scanner.scan("$1,234.56");

            assertThat(mentions).hasSize(1);
            assertThat(mentions.get(0).getCode()).isEqualTo(CurrencyCode.USD);
            assertThat(mentions.get(0).getAmount()).isEqualByComparingTo("1234.56");
            assertThat(mentions.get(0).getPosition()).isZero();
        }

        @Test
        @DisplayName("Should parse space-grouped rubles")
        void shouldParseSpaceGroupedRubles() {
            List<CurrencyMention> mentions = scanner.scan("10 000 руб");

            assertThat(mentions).hasSize(1);
            assertThat(mentions.get(0).getCode()).isEqualTo(CurrencyCode.RUB);
            assertThat(mentions.get(0).getAmount()).isEqualByComparingTo("10000");
        }

        @Test
        @DisplayName("Should not read somoni as som")
        void shouldDistinguishSomoniFromSom() {
            List<CurrencyMention> mentions = scanner.scan("Стоимость: 500 сомони");

            assertThat(mentions).extracting(CurrencyMention::getCode).containsExactly(CurrencyCode.TJS);
        }

        @Test
        @DisplayName("Should drop zero amounts")
        void shouldDropZeroAmounts() {
            assertThat(scanner.scan("Лицензия: 0 руб")).isEmpty();
        }

        @Test
        @DisplayName("Should find nothing in text without currencies")
        void shouldFindNothingWithoutCurrencies() {
            assertThat(scanner.scan("Срок выполнения 12345 часов")).isEmpty();
            assertThat(scanner.scan("")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Ordering and Claims")
    class OrderingTests {

        @Test
        @DisplayName("Should return mentions of several currencies in text order")
        void shouldSortByPosition() {
            List<CurrencyMention> mentions = scanner.scan("Сервер 200 EUR, лицензия 100 USD, работы 5000 руб");

            assertThat(mentions).extracting(CurrencyMention::getCode)
                    .containsExactly(CurrencyCode.EUR, CurrencyCode.USD, CurrencyCode.RUB);
            assertThat(mentions).extracting(CurrencyMention::getPosition).isSorted();
        }

        @Test
        @DisplayName("Should keep adjacent prefixed amounts apart")
        void shouldKeepAdjacentPrefixedAmountsApart() {
            List<CurrencyMention> mentions = scanner.scan("Hosting $100 $200 total");

            assertThat(mentions).extracting(CurrencyMention::getOriginalText).containsExactly("$100", "$200");
            assertThat(mentions).extracting(CurrencyMention::getCode).containsOnly(CurrencyCode.USD);
            assertThat(mentions.get(1).getAmount()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Should still take a trailing symbol after a prefixed amount")
        void shouldTakeTrailingSymbol() {
            List<CurrencyMention> mentions = scanner.scan("Итого: USD 1,000 $ за проект");

            assertThat(mentions).extracting(CurrencyMention::getOriginalText).containsExactly("USD 1,000 $");
        }

        @Test
        @DisplayName("Should skip matches inside a window claimed by an earlier currency")
        void shouldSkipClaimedMatches() {
            List<CurrencyMention> mentions = scanner.scan("USD 100 руб");

            assertThat(mentions).hasSize(1);
            assertThat(mentions.get(0).getCode()).isEqualTo(CurrencyCode.RUB);
            assertThat(mentions.get(0).getPosition()).isEqualTo(4);
        }
    }
}
