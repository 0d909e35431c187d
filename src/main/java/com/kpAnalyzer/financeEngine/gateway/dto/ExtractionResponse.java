package com.kpAnalyzer.financeEngine.gateway.dto;

import com.kpAnalyzer.financeEngine.extraction.model.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for financial extraction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionResponse {
    
    private String correlationId;
    
    /**
     * Detected document language: "ru" or "en".
     */
    private String language;
    
    private FinancialsView financials;
    
    private StatisticsView statistics;
    
    private ValidationResult validation;
    
    /**
     * Currency mention as exposed over HTTP, with a ready-made display string.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class MentionView {
        private String currency;
        private String symbol;
        private String name;
        private BigDecimal amount;
        private String formattedAmount;
        private String originalText;
        private int position;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class FinancialsView {
        private MentionView totalBudget;
        
        @Builder.Default
        private List<MentionView> currencies = new ArrayList<>();
        
        /**
         * Named categories keyed by their wire key (e.g. "project_management").
         */
        @Builder.Default
        private Map<String, MentionView> costBreakdown = new LinkedHashMap<>();
        
        @Builder.Default
        private List<MentionView> otherCosts = new ArrayList<>();
        
        @Builder.Default
        private List<String> paymentTerms = new ArrayList<>();
        
        @Builder.Default
        private List<String> financialNotes = new ArrayList<>();
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class StatisticsView {
        private int totalMentions;
        private int uniqueCurrencies;
        private String primaryCurrency;
        private BigDecimal totalValueUsd;
        private boolean mixedCurrencies;
        
        @Builder.Default
        private Map<String, Integer> distribution = new LinkedHashMap<>();
        
        private BigDecimal averageAmount;
        private BigDecimal medianAmount;
        private MentionView largestMention;
    }
}
