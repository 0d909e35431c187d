package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate statistics over the extracted currency mentions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrencyStatistics {
    
    private int totalMentions;
    
    private int uniqueCurrencies;
    
    /**
     * Most frequent currency. Null when no mentions were found.
     */
    private CurrencyCode primaryCurrency;
    
    /**
     * Sum of all mentions converted to the reference currency (USD).
     */
    @Builder.Default
    private BigDecimal totalValueReference = BigDecimal.ZERO;
    
    private boolean mixedCurrencies;
    
    /**
     * Mention count per currency, in order of first appearance.
     */
    @Builder.Default
    private Map<CurrencyCode, Integer> distribution = new LinkedHashMap<>();
    
    @Builder.Default
    private BigDecimal averageAmount = BigDecimal.ZERO;
    
    @Builder.Default
    private BigDecimal medianAmount = BigDecimal.ZERO;
    
    /**
     * Mention with the largest amount. Null when no mentions were found.
     */
    private CurrencyMention largestMention;
    
    public static CurrencyStatistics empty() {
        return CurrencyStatistics.builder().build();
    }
}
