package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cost breakdown of a proposal.
 * 
 * Each named category holds at most one mention; a mention is held by at most one category.
 * Mentions that matched a category keyword but lost the comparison are kept in {@code other}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostBreakdown {
    
    @Builder.Default
    private Map<CostCategory, CurrencyMention> categories = new EnumMap<>(CostCategory.class);
    
    @Builder.Default
    private List<CurrencyMention> other = new ArrayList<>();
    
    public CurrencyMention get(CostCategory category) {
        return categories.get(category);
    }
    
    /**
     * Number of named categories with an assigned mention ({@code other} excluded).
     */
    public int namedCategoryCount() {
        return categories.size();
    }
    
    public static CostBreakdown empty() {
        return CostBreakdown.builder().build();
    }
}
