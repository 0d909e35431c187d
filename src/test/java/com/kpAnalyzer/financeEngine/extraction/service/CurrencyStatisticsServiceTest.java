package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.converter;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.mention;
import static com.kpAnalyzer.financeEngine.extraction.ExtractionTestFixtures.statisticsService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("CurrencyStatisticsService Tests")
class CurrencyStatisticsServiceTest {

    private final CurrencyStatisticsService statisticsService = statisticsService();

    @Test
    @DisplayName("Should aggregate mixed-currency mentions")
    void shouldAggregateMixedCurrencies() {
        CurrencyMention largest = mention(CurrencyCode.EUR, "200", 20);
        List<CurrencyMention> mentions = List.of(
                mention(CurrencyCode.USD, "100", 0),
                largest,
                mention(CurrencyCode.USD, "50", 40));

        CurrencyStatistics statistics = statisticsService.calculate(mentions);

        assertThat(statistics.getTotalMentions()).isEqualTo(3);
        assertThat(statistics.getUniqueCurrencies()).isEqualTo(2);
        assertThat(statistics.getPrimaryCurrency()).isEqualTo(CurrencyCode.USD);
        assertThat(statistics.isMixedCurrencies()).isTrue();
        assertThat(statistics.getDistribution())
                .containsExactly(entry(CurrencyCode.USD, 2), entry(CurrencyCode.EUR, 1));
        assertThat(statistics.getAverageAmount()).isEqualTo(new BigDecimal("116.67"));
        assertThat(statistics.getMedianAmount()).isEqualTo(new BigDecimal("100.00"));
        assertThat(statistics.getLargestMention()).isSameAs(largest);
        assertThat(statistics.getTotalValueReference()).isEqualByComparingTo("366");
    }

    @Test
    @DisplayName("Should average the two middle amounts for an even count")
    void shouldAverageMiddleAmounts() {
        CurrencyStatistics statistics = statisticsService.calculate(List.of(
                mention(CurrencyCode.RUB, "20", 0),
                mention(CurrencyCode.RUB, "10", 60)));

        assertThat(statistics.getMedianAmount()).isEqualByComparingTo("15");
        assertThat(statistics.isMixedCurrencies()).isFalse();
    }

    @Test
    @DisplayName("Should break primary currency ties by first appearance")
    void shouldBreakTiesByFirstAppearance() {
        CurrencyStatistics statistics = statisticsService.calculate(List.of(
                mention(CurrencyCode.EUR, "10", 0),
                mention(CurrencyCode.USD, "10", 60)));

        assertThat(statistics.getPrimaryCurrency()).isEqualTo(CurrencyCode.EUR);
    }

    @Test
    @DisplayName("Should return zeros for no mentions")
    void shouldReturnZerosForNoMentions() {
        CurrencyStatistics statistics = statisticsService.calculate(List.of());

        assertThat(statistics.getTotalMentions()).isZero();
        assertThat(statistics.getPrimaryCurrency()).isNull();
        assertThat(statistics.getLargestMention()).isNull();
        assertThat(statistics.getDistribution()).isEmpty();
        assertThat(statistics.getTotalValueReference()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should convert to dollars with the fixed rate table")
    void shouldConvertWithFixedRates() {
        CurrencyConverter converter = converter();

        assertThat(converter.getReferenceCurrency()).isEqualTo(CurrencyCode.USD);
        assertThat(converter.toReference(mention(CurrencyCode.RUB, "1000", 0))).isEqualByComparingTo("11");
        assertThat(converter.toReference(mention(CurrencyCode.KZT, "500", 0))).isEqualByComparingTo("1");
    }
}
