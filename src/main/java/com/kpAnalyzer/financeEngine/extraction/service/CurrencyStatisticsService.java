package com.kpAnalyzer.financeEngine.extraction.service;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyMention;
import com.kpAnalyzer.financeEngine.extraction.model.CurrencyStatistics;
import com.kpAnalyzer.financeEngine.extraction.model.ExtractedFinancials;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate statistics over extracted mentions.
 */
@Service
@RequiredArgsConstructor
public class CurrencyStatisticsService {
    
    private static final int SCALE = 2;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    
    private final CurrencyConverter currencyConverter;
    
    public CurrencyStatistics calculate(ExtractedFinancials financials) {
        return calculate(financials.getCurrencies());
    }
    
    /**
     * Computes counts, distribution, primary currency, reference-currency total, mean, median and
     * largest mention. An empty list yields zeros and null optional fields.
     */
    public CurrencyStatistics calculate(List<CurrencyMention> currencies) {
        if (currencies.isEmpty()) {
            return CurrencyStatistics.empty();
        }
        
        Map<CurrencyCode, Integer> distribution = new LinkedHashMap<>();
        for (CurrencyMention mention : currencies) {
            distribution.merge(mention.getCode(), 1, Integer::sum);
        }
        
        // Ties go to the currency seen first in the text
        CurrencyCode primary = null;
        int primaryCount = 0;
        for (Map.Entry<CurrencyCode, Integer> entry : distribution.entrySet()) {
            if (entry.getValue() > primaryCount) {
                primary = entry.getKey();
                primaryCount = entry.getValue();
            }
        }
        
        List<BigDecimal> amounts = currencies.stream()
                .map(CurrencyMention::getAmount)
                .sorted()
                .toList();
        BigDecimal sum = amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = sum.divide(BigDecimal.valueOf(amounts.size()), SCALE, RoundingMode.HALF_UP);
        
        CurrencyMention largest = currencies.get(0);
        for (CurrencyMention mention : currencies) {
            if (mention.getAmount().compareTo(largest.getAmount()) > 0) {
                largest = mention;
            }
        }
        
        return CurrencyStatistics.builder()
                .totalMentions(currencies.size())
                .uniqueCurrencies(distribution.size())
                .primaryCurrency(primary)
                .totalValueReference(currencyConverter.toReference(currencies).setScale(SCALE, RoundingMode.HALF_UP))
                .mixedCurrencies(distribution.size() > 1)
                .distribution(distribution)
                .averageAmount(average)
                .medianAmount(median(amounts))
                .largestMention(largest)
                .build();
    }
    
    private BigDecimal median(List<BigDecimal> sortedAmounts) {
        int size = sortedAmounts.size();
        if (size % 2 == 1) {
            return sortedAmounts.get(size / 2).setScale(SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal lower = sortedAmounts.get(size / 2 - 1);
        BigDecimal upper = sortedAmounts.get(size / 2);
        return lower.add(upper).divide(TWO, SCALE, RoundingMode.HALF_UP);
    }
}
