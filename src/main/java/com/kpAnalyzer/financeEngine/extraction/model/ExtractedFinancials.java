package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured financial summary extracted from one proposal text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedFinancials {
    
    /**
     * Mention representing the total project cost.
     * When set, it is the same instance as one element of {@link #currencies}. Null if none.
     */
    private CurrencyMention totalBudget;
    
    /**
     * Deduplicated mentions, ascending by position.
     */
    @Builder.Default
    private List<CurrencyMention> currencies = new ArrayList<>();
    
    @Builder.Default
    private CostBreakdown costBreakdown = CostBreakdown.empty();
    
    @Builder.Default
    private List<String> paymentTerms = new ArrayList<>();
    
    @Builder.Default
    private List<String> financialNotes = new ArrayList<>();
}
