package com.kpAnalyzer.financeEngine.extraction.dto;

import com.kpAnalyzer.financeEngine.extraction.model.CurrencyCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw pattern data as stored in {@code patterns/financial-patterns.json}.
 * 
 * All pattern strings are Java regular expression fragments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatternDefinitions {
    
    private CurrencyCode referenceCurrency;
    
    /**
     * Number fragment shared by all currency patterns.
     */
    private String amountPattern;
    
    /**
     * Currency definitions. Order matters: earlier currencies win overlapping matches.
     */
    @Builder.Default
    private List<CurrencyDefinition> currencies = new ArrayList<>();
    
    /**
     * Total-budget phrases, in priority order.
     */
    @Builder.Default
    private List<String> budgetKeywords = new ArrayList<>();
    
    @Builder.Default
    private List<CategoryDefinition> costCategories = new ArrayList<>();
    
    @Builder.Default
    private List<String> paymentTermPatterns = new ArrayList<>();
    
    @Builder.Default
    private List<String> financialNotePatterns = new ArrayList<>();
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CurrencyDefinition {
        
        private CurrencyCode code;
        
        private String symbol;
        
        private String name;
        
        /**
         * Value of one unit in the reference currency.
         */
        private BigDecimal referenceRate;
        
        /**
         * Symbols that may precede the amount (e.g., "\\$").
         */
        @Builder.Default
        private List<String> prefixSymbols = new ArrayList<>();
        
        /**
         * Symbols that may follow the amount (e.g., "руб").
         */
        @Builder.Default
        private List<String> suffixSymbols = new ArrayList<>();
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CategoryDefinition {
        
        /**
         * Category key (e.g., "project_management").
         */
        private String category;
        
        @Builder.Default
        private List<String> keywords = new ArrayList<>();
    }
}
