package com.kpAnalyzer.financeEngine.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One recognized currency amount at a specific position in the document text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrencyMention {
    
    private CurrencyCode code;
    
    /**
     * Display symbol of the currency (e.g., "$", "₽", "сом").
     */
    private String symbol;
    
    private String name;
    
    /**
     * Parsed amount, always greater than zero.
     */
    private BigDecimal amount;
    
    /**
     * Matched text, trimmed.
     */
    private String originalText;
    
    /**
     * Character offset of the match start in the source text.
     */
    private int position;
    
    /**
     * Absolute character distance between this mention and a text position.
     */
    public int distanceTo(int textPosition) {
        return Math.abs(position - textPosition);
    }
}
